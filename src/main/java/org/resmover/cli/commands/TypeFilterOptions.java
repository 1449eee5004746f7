package org.resmover.cli.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.resmover.resources.ResourceType;
import org.resmover.resources.TypeFilter;

import picocli.CommandLine.Option;

/**
 * Mutually exclusive type selection: either --include or --exclude, but not both.
 * Used as an exclusive {@code @ArgGroup}.
 */
public class TypeFilterOptions {

    @Option(
        names = {"-i", "--include"},
        converter = ResourceTypeConverter.class,
        split = ",",
        description = "Resource type to operate on (repeatable, comma separated)"
    )
    List<ResourceType> include = new ArrayList<>();

    @Option(
        names = {"-e", "--exclude"},
        converter = ResourceTypeConverter.class,
        split = ",",
        description = "Resource type to leave alone (repeatable, comma separated)"
    )
    List<ResourceType> exclude = new ArrayList<>();

    /**
     * @param options the parsed group, or {@code null} if neither option was given.
     * @return the resolved type filter; all types when no option was given.
     */
    static Set<ResourceType> resolve(TypeFilterOptions options) {
        if (options == null) {
            return TypeFilter.resolve(List.of(), List.of());
        }
        return TypeFilter.resolve(options.include, options.exclude);
    }
}
