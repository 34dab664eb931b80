package fr.lapetina.configstore;

import fr.lapetina.configstore.domain.model.Item;
import fr.lapetina.configstore.domain.provider.InMemoryProvider;
import fr.lapetina.configstore.domain.provider.ItemDecoder;
import fr.lapetina.configstore.domain.provider.JsonItemDecoder;
import fr.lapetina.configstore.domain.provider.YamlItemDecoder;
import fr.lapetina.configstore.infrastructure.config.ConfigLoader;
import fr.lapetina.configstore.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.configstore.infrastructure.config.StoreConfig;
import fr.lapetina.configstore.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.configstore.source.SourceRegistrar;
import fr.lapetina.configstore.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Factory for creating a fully-wired store from bootstrap configuration.
 * This is the primary entry point for obtaining a configured {@link Store}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ConfigStoreFactory factory = ConfigStoreFactory.create("configstore.yaml")) {
 *     ResolvedConfig config = factory.getStore().resolve();
 *     // use config...
 * }
 * }</pre>
 */
public class ConfigStoreFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigStoreFactory.class);

    private final StoreConfig config;
    private final MetricsRegistry metricsRegistry;
    private final Store store;
    private final SourceRegistrar sourceRegistrar;

    protected ConfigStoreFactory(StoreConfig config, Supplier<Map<String, String>> environment) {
        this.config = config;

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? MetricsRegistry.prometheus(config.getMetrics().getPrefix())
                : MetricsRegistry.simple();

        // Initialize store and source helpers
        this.store = new Store(metricsRegistry);
        this.sourceRegistrar = SourceRegistrar.builder(store)
                .refreshInterval(Duration.ofMillis(config.getRefresh().getIntervalMs()))
                .environment(environment)
                .build();

        try {
            registerSources();
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }

        log.info("ConfigStoreFactory initialized with {} providers", store.getProviderCount());
    }

    /**
     * Creates a factory from the specified bootstrap file.
     */
    public static ConfigStoreFactory create(String configPath) {
        log.info("Initializing ConfigStoreFactory from config: {}", configPath);
        return new ConfigStoreFactory(new ConfigLoader(configPath).load(), System::getenv);
    }

    /**
     * Creates a factory from the default bootstrap file (configstore.yaml).
     */
    public static ConfigStoreFactory create() {
        return create("configstore.yaml");
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static ConfigStoreFactory fromConfig(StoreConfig config) {
        return new ConfigStoreFactory(config, System::getenv);
    }

    public Store getStore() {
        return store;
    }

    public SourceRegistrar getSourceRegistrar() {
        return sourceRegistrar;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public StoreConfig getConfig() {
        return config;
    }

    private void registerSources() {
        int index = 0;
        for (StoreConfig.SourceConfig source : config.getSources()) {
            String type = source.getType() != null ? source.getType().toLowerCase(Locale.ROOT) : "";
            switch (type) {
                case "file" -> {
                    ItemDecoder decoder = decoderFor(source.getFormat());
                    if (source.isRefresh()) {
                        sourceRegistrar.fileCustomRefresh(source.getPath(), decoder);
                    } else {
                        sourceRegistrar.fileCustom(source.getPath(), decoder);
                    }
                }
                case "filelist" -> sourceRegistrar.fileList(source.getPath(), decoderFor(source.getFormat()));
                case "env" -> sourceRegistrar.env(source.getPrefix());
                case "inmemory" -> registerInMemory(source, index);
                default -> throw new ConfigurationException(
                        "Unknown source type at sources[" + index + "]: " + source.getType());
            }
            index++;
        }
    }

    private void registerInMemory(StoreConfig.SourceConfig source, int index) {
        String name = source.getName() != null ? source.getName() : "inmemory:" + index;
        InMemoryProvider provider = sourceRegistrar.inMemory(name);
        for (StoreConfig.ItemConfig item : source.getItems()) {
            if (item.getKey() == null) {
                throw new ConfigurationException("Item without key in source: " + name);
            }
            provider.add(Item.of(item.getKey(), item.getValue(), item.getPriority()));
        }
        log.debug("Registered in-memory source: name={}, items={}", name, provider.size());
    }

    private static ItemDecoder decoderFor(String format) {
        String normalized = format != null ? format.toLowerCase(Locale.ROOT) : "yaml";
        return switch (normalized) {
            case "yaml", "yml" -> new YamlItemDecoder();
            case "json" -> new JsonItemDecoder();
            default -> throw new ConfigurationException("Unknown file format: " + format);
        };
    }

    @Override
    public void close() {
        log.info("Shutting down ConfigStoreFactory...");

        try {
            store.close();
        } catch (Exception e) {
            log.warn("Error closing store", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ConfigStoreFactory shut down");
    }
}
