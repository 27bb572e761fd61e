package org.cortexview.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.cortexview.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies the configuration precedence: system properties over the configuration file over
 * {@code reference.conf}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String COLLECTOR = "node.processes.observatory.options.collector";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(COLLECTOR + ".identityName");
        System.clearProperty("test.value");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(final String content) throws IOException {
        final Path file = tempDir.resolve("cortexview.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("reference.conf provides the defaults")
    void merge_usesReferenceDefaults() {
        final Config config = ConfigLoader.merge(ConfigFactory.empty());

        assertThat(config.getString(COLLECTOR + ".identityName")).isEqualTo("Timmy");
        assertThat(config.getInt("node.processes.observatory.options.broadcast.queueDepth")).isEqualTo(1);
        assertThat(config.getString("node.processes.observatory.options.projection.type")).isEqualTo("random");
        assertThat(config.getObject("node.processes").keySet()).containsExactlyInAnyOrder("observatory", "httpServer");
        assertThat(config.getString("node.processes.httpServer.require.observatory")).isEqualTo("observatory");
    }

    @Test
    @DisplayName("The configuration file overrides reference.conf")
    void load_fileOverridesReference() throws IOException {
        final File file = writeConfig(COLLECTOR + ".identityName = \"Daneel\"\ntest.value = \"file-value\"\n");

        final Config config = ConfigLoader.load(file);

        assertThat(config.getString(COLLECTOR + ".identityName")).isEqualTo("Daneel");
        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getInt("node.processes.observatory.options.projection.seed")).isEqualTo(42);
    }

    @Test
    @DisplayName("A system property overrides the configuration file")
    void load_systemPropertyOverridesFile() throws IOException {
        final File file = writeConfig(COLLECTOR + ".identityName = \"Daneel\"\n");
        System.setProperty(COLLECTOR + ".identityName", "Giskard");
        ConfigFactory.invalidateCaches();

        final Config config = ConfigLoader.load(file);

        assertThat(config.getString(COLLECTOR + ".identityName")).isEqualTo("Giskard");
    }

    @Test
    @DisplayName("Substitutions resolve against the merged configuration")
    void load_resolvesSubstitutionsAcrossSources() throws IOException {
        final File file = writeConfig("test.copy = ${test.value}\n");
        System.setProperty("test.value", "from-system");
        ConfigFactory.invalidateCaches();

        final Config config = ConfigLoader.load(file);

        assertThat(config.getString("test.copy")).isEqualTo("from-system");
    }

    @Test
    @DisplayName("A missing explicit file is a configuration error")
    void load_missingExplicitFileFails() {
        final File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Configuration file not found");
    }

    @Test
    @DisplayName("A malformed file is a configuration error")
    void load_malformedFileFails() throws IOException {
        final File file = writeConfig("node { processes = \n");

        assertThatThrownBy(() -> ConfigLoader.load(file))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Failed to parse configuration file");
    }

    @Test
    @DisplayName("An unresolvable substitution is a configuration error")
    void merge_unresolvableSubstitutionFails() {
        final Config fileConfig = ConfigFactory.parseString("test.copy = ${does.not.exist}");

        assertThatThrownBy(() -> ConfigLoader.merge(fileConfig))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Failed to resolve configuration");
    }
}
