package fr.lapetina.configstore;

import fr.lapetina.configstore.infrastructure.config.ConfigLoader;
import fr.lapetina.configstore.infrastructure.config.StoreConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigStoreApplicationTest {

    @Test
    @DisplayName("should run without an HTTP server when disabled")
    void shouldRunHeadless() throws Exception {
        StoreConfig config = new ConfigLoader("test-config.yaml").load();

        try (ConfigStoreApplication app = new ConfigStoreApplication(new ConfigStoreFactory(config, Map::of))) {
            app.start();

            assertThat(app.getHttpServer()).isNull();
            assertThat(app.getFactory().getStore().resolve().getValue("feature.x")).contains("on");
        }
    }

    @Test
    @DisplayName("should serve the store over HTTP when enabled")
    void shouldServeOverHttp() throws Exception {
        StoreConfig config = new ConfigLoader("test-config.yaml").load();
        config.getServer().setEnabled(true);
        config.getServer().setHost("127.0.0.1");
        config.getServer().setPort(0);

        try (ConfigStoreApplication app = new ConfigStoreApplication(new ConfigStoreFactory(config, Map::of))) {
            app.start();
            int port = app.getHttpServer().getPort();

            HttpResponse<String> response = HttpClient.newHttpClient().send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/config/db.port")).build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("5432");
        }
    }

    @Test
    @DisplayName("should release awaitShutdown on request")
    void shouldReleaseOnShutdownRequest() throws Exception {
        StoreConfig config = new StoreConfig();
        config.getServer().setEnabled(false);
        config.getMetrics().setEnabled(false);

        try (ConfigStoreApplication app = new ConfigStoreApplication(new ConfigStoreFactory(config, Map::of))) {
            app.requestShutdown();
            app.awaitShutdown();
        }
    }
}
