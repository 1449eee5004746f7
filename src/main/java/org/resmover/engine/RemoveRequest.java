package org.resmover.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import org.resmover.resources.ConfigurationException;
import org.resmover.resources.ResourceType;

/**
 * Parameters of a remove run.
 *
 * @param target               module to remove unused resources from.
 * @param protectedDirectories modules depending on {@code target} whose references must keep resolving.
 * @param typeFilter           resource types to remove.
 * @param maxRounds            round cap, at least 1.
 * @param ignorePattern        resources whose name contains a match are never removed; may be {@code null}.
 */
public record RemoveRequest(
        Path target,
        List<Path> protectedDirectories,
        Set<ResourceType> typeFilter,
        int maxRounds,
        Pattern ignorePattern
) {

    public RemoveRequest {
        Objects.requireNonNull(target, "target");
        protectedDirectories = protectedDirectories == null ? List.of() : List.copyOf(protectedDirectories);
        typeFilter = Set.copyOf(Objects.requireNonNull(typeFilter, "typeFilter"));

        if (maxRounds < 1) {
            throw new ConfigurationException("maxRounds must be at least 1 but was " + maxRounds);
        }
    }
}
