package org.resmover.scan;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.resmover.config.MoverSettings;
import org.resmover.resources.ResourceDependency;
import org.resmover.resources.ResourcePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects every resource a module references.
 * <p>
 * This is a lightweight text scan: each line of every eligible file below the module's
 * source root is matched against each {@link ExtractionRule} independently and the
 * results are unioned. It does not parse Java, Kotlin or XML.
 */
public class ReferenceScanner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceScanner.class);

    private final String sourceRoot;
    private final Set<String> extensions;
    private final List<ExtractionRule> rules;

    public ReferenceScanner(MoverSettings settings) {
        this(settings, ReferenceRules.defaults());
    }

    public ReferenceScanner(MoverSettings settings, List<ExtractionRule> rules) {
        this.sourceRoot = settings.sourceRoot();
        this.extensions = settings.scanExtensions();
        this.rules = List.copyOf(rules);
    }

    /**
     * Scans a module directory.
     *
     * @param moduleRoot the module root; its source root may be missing.
     * @return all referenced resources, unordered.
     * @throws IOException if the tree cannot be walked or a file cannot be read.
     */
    public Set<ResourceDependency> scan(Path moduleRoot) throws IOException {
        Path root = moduleRoot.resolve(sourceRoot);
        List<Path> files = ResourcePaths.listFiles(root, extensions);

        Set<ResourceDependency> dependencies = new HashSet<>();
        for (Path file : files) {
            scanFile(file, dependencies);
        }

        log.debug("Scanned {} file(s) in {}: {} reference(s)", files.size(), root, dependencies.size());
        return dependencies;
    }

    private void scanFile(Path file, Set<ResourceDependency> into) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                for (ExtractionRule rule : rules) {
                    into.addAll(rule.extract(line));
                }
            }
        } catch (IOException e) {
            throw new IOException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
