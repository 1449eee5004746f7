package org.resmover.resources;

import java.util.Objects;

/**
 * A reference to a resource by type and name.
 * <p>
 * Names are normalized so that the markup spelling ({@code @style/Widget.Button}) and the
 * code spelling ({@code R.style.Widget_Button}) of the same resource compare equal.
 *
 * @param type the resource type.
 * @param name the normalized resource name (dots replaced by underscores).
 */
public record ResourceDependency(ResourceType type, String name) {

    public ResourceDependency {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Creates a dependency from a name as written in source or markup.
     *
     * @param type    the resource type.
     * @param rawName the name as written, possibly dotted.
     * @return the normalized dependency.
     */
    public static ResourceDependency of(ResourceType type, String rawName) {
        return new ResourceDependency(type, normalizeName(rawName));
    }

    /**
     * Replaces literal dots with underscores.
     *
     * @param rawName the name as written.
     * @return the normalized name.
     */
    public static String normalizeName(String rawName) {
        return rawName.replace('.', '_');
    }

    @Override
    public String toString() {
        return type.rawName() + "/" + name;
    }
}
