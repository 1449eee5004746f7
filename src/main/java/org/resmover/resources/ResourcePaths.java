package org.resmover.resources;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Path helpers for module directories and resource files.
 */
public final class ResourcePaths {

    private ResourcePaths() {
    }

    /**
     * Lists all regular files below {@code root} whose extension is in {@code extensions},
     * in sorted path order. A missing root yields an empty list.
     *
     * @param root       directory to walk.
     * @param extensions lower case extensions without the dot.
     * @return matching files.
     * @throws IOException if the directory tree or any directory below it cannot be read.
     */
    public static List<Path> listFiles(Path root, Set<String> extensions) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> extensions.contains(extension(p)))
                .sorted()
                .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * @return the lower case extension of the file name (after the last dot), or an empty string.
     */
    public static String extension(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Resource name of a standalone resource file: the file name up to its first dot,
     * so {@code ic_star.9.png} is {@code ic_star}.
     */
    public static String resourceName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot >= 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Resource type of a file, taken from its parent directory.
     * Example: {@code res/anim-v21/slide_in.xml} is an {@link ResourceType#ANIMATION}.
     */
    public static Optional<ResourceType> resourceType(Path file) {
        Path parent = file.getParent();
        if (parent == null || parent.getFileName() == null) {
            return Optional.empty();
        }
        return ResourceType.fromDirectoryName(parent.getFileName().toString());
    }

    /**
     * Standalone dependency identity of a resource file, if its directory classifies.
     */
    public static Optional<ResourceDependency> standaloneDependency(Path file) {
        return resourceType(file).map(type -> ResourceDependency.of(type, resourceName(file)));
    }
}
