package org.resmover.cli.commands;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.resmover.resources.ResourceType;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Converts a raw Android resource type name ({@code drawable}, {@code string}, ...) to a {@link ResourceType}.
 */
public class ResourceTypeConverter implements ITypeConverter<ResourceType> {

    static final String ALL_RESOURCE_TYPES = Arrays.stream(ResourceType.values())
        .map(ResourceType::rawName)
        .collect(Collectors.joining(", ", "[", "]"));

    @Override
    public ResourceType convert(String value) {
        return ResourceType.classify(value)
            .orElseThrow(() -> new TypeConversionException(
                value + " is not a valid android resource, pick from " + ALL_RESOURCE_TYPES + "."));
    }
}
