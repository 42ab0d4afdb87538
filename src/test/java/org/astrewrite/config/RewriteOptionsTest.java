package org.astrewrite.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RewriteOptionsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        RewriteOptions options = RewriteOptions.defaults();

        assertThat(options.compactFileComments()).isTrue();
        assertThat(options.logSummary()).isTrue();
    }

    @Test
    void explicitValuesOverrideDefaults() {
        Config config = ConfigFactory.parseMap(Map.of("astrewrite.rewrite.compact-file-comments", false));

        RewriteOptions options = RewriteOptions.fromConfig(config);

        assertThat(options.compactFileComments()).isFalse();
        assertThat(options.logSummary()).isTrue();
    }

    @Test
    void invalidValueIsReported() {
        Config config = ConfigFactory.parseString("astrewrite.rewrite.log-summary = sometimes");

        assertThatThrownBy(() -> RewriteOptions.fromConfig(config))
                .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void loaderReadsTheGivenFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("astrewrite.conf");
        Files.writeString(file, "astrewrite.rewrite { log-summary = false }\n", StandardCharsets.UTF_8);

        RewriteOptions options = RewriteOptions.fromConfig(ConfigLoader.load(file.toFile()));

        assertThat(options.logSummary()).isFalse();
        assertThat(options.compactFileComments()).isTrue();
    }

    @Test
    void loaderFallsBackToDefaultsWithoutFile(@TempDir Path tempDir) {
        File missing = tempDir.resolve("missing.conf").toFile();

        Config config = ConfigLoader.load(missing);

        assertThat(config.getBoolean("astrewrite.rewrite.compact-file-comments")).isTrue();
        assertThat(config.getBoolean("astrewrite.rewrite.log-summary")).isTrue();
    }
}
