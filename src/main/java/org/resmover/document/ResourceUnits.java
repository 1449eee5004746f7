package org.resmover.document;

import java.util.Optional;

import org.resmover.resources.ResourceDependency;
import org.resmover.resources.ResourceType;

/**
 * Resource identity of container document children.
 */
public final class ResourceUnits {

    private static final String GENERIC_ITEM_TAG = "item";

    private ResourceUnits() {
    }

    /**
     * Type of a child element: its tag, or its {@code type} attribute for a generic
     * {@code <item type="dimen" name="...">}.
     */
    public static Optional<ResourceType> resourceType(DocumentNode node) {
        if (node == null || !node.isElement()) {
            return Optional.empty();
        }
        if (GENERIC_ITEM_TAG.equals(node.tagName())) {
            return ResourceType.classify(node.attribute("type"));
        }
        return ResourceType.classify(node.tagName());
    }

    /**
     * @return the {@code name} attribute as written, or {@code null}.
     */
    public static String rawName(DocumentNode node) {
        return node == null ? null : node.attribute("name");
    }

    /**
     * @return the normalized identity of the element, or empty if it has no type or no name.
     */
    public static Optional<ResourceDependency> dependency(DocumentNode node) {
        String rawName = rawName(node);
        if (rawName == null) {
            return Optional.empty();
        }
        return resourceType(node).map(type -> ResourceDependency.of(type, rawName));
    }
}
