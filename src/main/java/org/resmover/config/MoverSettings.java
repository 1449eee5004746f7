package org.resmover.config;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code resmover} configuration block.
 *
 * @param maxRounds          default round cap for move and remove runs.
 * @param sourceRoot         module-relative directory scanned for references.
 * @param resourceRoot       module-relative directory holding resource definitions.
 * @param scanExtensions     file extensions (lower case, no dot) scanned for references.
 * @param resourceExtensions file extensions (lower case, no dot) treated as resource files.
 * @param indentation        indentation used when re-indenting a destination document.
 * @param colorOutput        whether progress output is colorized.
 * @param frameWidth         width of progress frame rules.
 */
public record MoverSettings(
        int maxRounds,
        String sourceRoot,
        String resourceRoot,
        Set<String> scanExtensions,
        Set<String> resourceExtensions,
        String indentation,
        boolean colorOutput,
        int frameWidth
) {

    private static final String ROOT = "resmover";

    public MoverSettings {
        scanExtensions = Set.copyOf(scanExtensions);
        resourceExtensions = Set.copyOf(resourceExtensions);
    }

    /**
     * Reads settings from the {@code resmover} block of the given configuration.
     *
     * @param config the resolved application configuration.
     * @return the settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static MoverSettings fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        return new MoverSettings(
            c.getInt("max-rounds"),
            c.getString("layout.source-root"),
            c.getString("layout.resource-root"),
            lowerCase(c.getStringList("scan.extensions")),
            lowerCase(c.getStringList("resources.extensions")),
            c.getString("document.indentation"),
            c.getBoolean("output.color"),
            c.getInt("output.frame-width")
        );
    }

    /**
     * @return settings built from the classpath {@code reference.conf} only.
     */
    public static MoverSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    private static Set<String> lowerCase(List<String> extensions) {
        return extensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }
}
