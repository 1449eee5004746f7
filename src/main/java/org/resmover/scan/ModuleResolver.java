package org.resmover.scan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

import org.resmover.resources.ResourceType;

/**
 * Resolves a module's references from the current disk state, restricted to a type filter.
 */
public class ModuleResolver {

    private final ReferenceScanner scanner;

    public ModuleResolver(ReferenceScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * @param moduleRoot the module directory.
     * @param typeFilter the types to keep.
     * @return a fresh {@link ModuleInfo}; never cached.
     * @throws IOException if scanning fails.
     */
    public ModuleInfo resolve(Path moduleRoot, Set<ResourceType> typeFilter) throws IOException {
        return new ModuleInfo(moduleRoot, scanner.scan(moduleRoot).stream()
            .filter(dependency -> typeFilter.contains(dependency.type()))
            .collect(Collectors.toSet()));
    }
}
