package org.resmover.scan;

import java.nio.file.Path;
import java.util.Set;

import org.resmover.resources.ResourceDependency;

/**
 * A module directory together with the resources it referenced when it was resolved.
 * <p>
 * Only valid for the round it was resolved in; edits made by a round change what a
 * module references.
 *
 * @param moduleRoot   the module directory.
 * @param dependencies references of the types the run operates on.
 */
public record ModuleInfo(Path moduleRoot, Set<ResourceDependency> dependencies) {

    public ModuleInfo {
        dependencies = Set.copyOf(dependencies);
    }
}
