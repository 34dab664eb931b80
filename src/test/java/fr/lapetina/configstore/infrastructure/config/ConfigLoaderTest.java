package fr.lapetina.configstore.infrastructure.config;

import fr.lapetina.configstore.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load the bootstrap file from the classpath")
    void shouldLoadFromClasspath() {
        StoreConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getServer().isEnabled()).isFalse();
        assertThat(config.getRefresh().getIntervalMs()).isEqualTo(100);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("configstore_test");
        assertThat(config.getSources()).extracting(StoreConfig.SourceConfig::getType)
                .containsExactly("inmemory", "env", "inmemory");
        assertThat(config.getSources().get(0).getItems()).hasSize(3);
        assertThat(config.getSources().get(2).getItems().get(0).getPriority()).isEqualTo(100);
    }

    @Test
    @DisplayName("should prefer the file system over the classpath")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("bootstrap.yaml");
        Files.writeString(file, "server:\n  port: 9191\nsources:\n  - type: file\n    path: /etc/app.yaml\n    refresh: true\n");

        StoreConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getServer().getPort()).isEqualTo(9191);
        assertThat(config.getServer().isEnabled()).isTrue();
        assertThat(config.getSources()).singleElement().satisfies(source -> {
            assertThat(source.getPath()).isEqualTo("/etc/app.yaml");
            assertThat(source.isRefresh()).isTrue();
            assertThat(source.getFormat()).isEqualTo("yaml");
        });
    }

    @Test
    @DisplayName("should fall back to defaults for an empty document")
    void shouldDefaultEmptyDocument() {
        StoreConfig config = ConfigLoader.loadFromStream(new ByteArrayInputStream(new byte[0]));

        assertThat(config.getServer().getPort()).isEqualTo(8080);
        assertThat(config.getRefresh().getIntervalMs()).isEqualTo(10_000);
        assertThat(config.getSources()).isEmpty();
    }

    @Test
    @DisplayName("should fail for a missing file")
    void shouldFailForMissingFile() {
        ConfigLoader loader = new ConfigLoader(tempDir.resolve("absent.yaml").toString());

        assertThatThrownBy(loader::load)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should fail for an unknown property")
    void shouldFailForUnknownProperty() {
        byte[] yaml = "server:\n  colour: blue\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ConfigLoader.loadFromStream(new ByteArrayInputStream(yaml)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }
}
