package org.resmover.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class MoverSettingsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        MoverSettings settings = MoverSettings.defaults();

        assertThat(settings.maxRounds()).isEqualTo(10);
        assertThat(settings.sourceRoot()).isEqualTo("src");
        assertThat(settings.resourceRoot()).isEqualTo("src/main/res");
        assertThat(settings.scanExtensions()).containsExactlyInAnyOrder("java", "kt", "xml");
        assertThat(settings.resourceExtensions()).containsExactlyInAnyOrder("xml", "png", "webp");
        assertThat(settings.indentation()).isEqualTo("    ");
        assertThat(settings.colorOutput()).isTrue();
        assertThat(settings.frameWidth()).isEqualTo(120);
    }

    @Test
    void overridesFallBackToDefaults() {
        MoverSettings settings = MoverSettings.fromConfig(ConfigFactory.parseString("""
                resmover {
                  max-rounds = 4
                  resources.extensions = ["XML", "jpg"]
                }
                """)
            .withFallback(ConfigFactory.defaultReference()));

        assertThat(settings.maxRounds()).isEqualTo(4);
        assertThat(settings.resourceExtensions()).containsExactlyInAnyOrder("xml", "jpg");
        assertThat(settings.sourceRoot()).isEqualTo("src");
    }

    @Test
    void wrongTypeIsRejected() {
        assertThatThrownBy(() -> MoverSettings.fromConfig(ConfigFactory.parseString("resmover.max-rounds = lots")
                .withFallback(ConfigFactory.defaultReference())))
            .isInstanceOf(ConfigException.WrongType.class);
    }
}
