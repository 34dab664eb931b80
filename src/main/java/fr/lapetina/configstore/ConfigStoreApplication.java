package fr.lapetina.configstore;

import fr.lapetina.configstore.api.HttpServer;
import fr.lapetina.configstore.infrastructure.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the standalone config store.
 */
public class ConfigStoreApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigStoreApplication.class);

    private final ConfigStoreFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ConfigStoreApplication(String configPath) throws Exception {
        this(ConfigStoreFactory.create(configPath));
    }

    ConfigStoreApplication(ConfigStoreFactory factory) throws Exception {
        log.info("Starting Config Store...");
        this.factory = factory;

        StoreConfig.ServerConfig server = factory.getConfig().getServer();
        if (server.isEnabled()) {
            this.httpServer = new HttpServer(
                    server.getHost(),
                    server.getPort(),
                    server.getBacklog(),
                    factory.getStore(),
                    factory.getMetricsRegistry()
            );
        } else {
            this.httpServer = null;
        }

        // Log every change so operators can follow configuration drift
        factory.getStore().addListener(store ->
                log.info("Configuration changed: providers={}", store.getProviderCount()));

        log.info("Config Store initialized");
    }

    public void start() {
        if (httpServer != null) {
            httpServer.start();
            log.info("Config Store started on port {}", httpServer.getPort());
        } else {
            log.info("Config Store started without HTTP server");
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ConfigStoreFactory getFactory() {
        return factory;
    }

    public HttpServer getHttpServer() {
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Shutting down Config Store...");

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Config Store shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "configstore.yaml";

        try {
            ConfigStoreApplication app = new ConfigStoreApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Config Store", e);
            System.exit(1);
        }
    }
}
