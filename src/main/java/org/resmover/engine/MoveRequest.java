package org.resmover.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.resmover.resources.ConfigurationException;
import org.resmover.resources.ResourceType;

/**
 * Parameters of a move run.
 *
 * @param source               module to move resources out of.
 * @param destinations         modules to move resources into; at least one.
 * @param protectedDirectories modules depending on {@code source} whose references must keep resolving.
 * @param typeFilter           resource types to move.
 * @param maxRounds            round cap, at least 1.
 */
public record MoveRequest(
        Path source,
        List<Path> destinations,
        List<Path> protectedDirectories,
        Set<ResourceType> typeFilter,
        int maxRounds
) {

    public MoveRequest {
        Objects.requireNonNull(source, "source");
        destinations = destinations == null ? List.of() : List.copyOf(destinations);
        protectedDirectories = protectedDirectories == null ? List.of() : List.copyOf(protectedDirectories);
        typeFilter = Set.copyOf(Objects.requireNonNull(typeFilter, "typeFilter"));

        if (destinations.isEmpty()) {
            throw new ConfigurationException("You must specify at least one output directory");
        }
        if (maxRounds < 1) {
            throw new ConfigurationException("maxRounds must be at least 1 but was " + maxRounds);
        }
    }
}
