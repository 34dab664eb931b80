package fr.lapetina.configstore.source;

import fr.lapetina.configstore.domain.model.Item;
import fr.lapetina.configstore.domain.provider.ErrorProvider;
import fr.lapetina.configstore.domain.provider.FileProvider;
import fr.lapetina.configstore.domain.provider.InMemoryProvider;
import fr.lapetina.configstore.domain.provider.ItemDecoder;
import fr.lapetina.configstore.domain.provider.KeyTransformer;
import fr.lapetina.configstore.domain.provider.Provider;
import fr.lapetina.configstore.domain.provider.YamlItemDecoder;
import fr.lapetina.configstore.infrastructure.refresh.FileRefreshTask;
import fr.lapetina.configstore.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Builds providers for the common source kinds and registers them with a {@link Store}.
 *
 * A source that cannot be set up is registered as an {@link ErrorProvider} under the
 * name it would have had, so its failure shows up on every resolution.
 * Registering against a closed store throws {@link IllegalStateException} and
 * leaves no refresh task running.
 *
 * <p>Usage:
 * <pre>{@code
 * SourceRegistrar sources = SourceRegistrar.builder(store).build();
 * sources.fileRefresh("/etc/app/base.yaml");
 * sources.fileList("/etc/app/conf.d");
 * sources.env("APP");
 * sources.inMemory("overrides").add(Item.of("feature.x", "on", 100));
 * }</pre>
 */
public final class SourceRegistrar {

    /** Priority given to every item imported from the environment */
    public static final long ENV_PRIORITY = 15;

    private final Store store;
    private final Logger log;
    private final Duration refreshInterval;
    private final ItemDecoder defaultDecoder;
    private final KeyTransformer keyTransformer;
    private final Supplier<Map<String, String>> environment;

    private SourceRegistrar(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "Store is required");
        this.log = builder.log;
        this.refreshInterval = builder.refreshInterval;
        this.defaultDecoder = builder.defaultDecoder;
        this.keyTransformer = builder.keyTransformer;
        this.environment = builder.environment;
    }

    public static Builder builder(Store store) {
        return new Builder(store);
    }

    public static SourceRegistrar of(Store store) {
        return builder(store).build();
    }

    // ==================== FILES ====================

    /**
     * Registers a file decoded with the default decoder, read once.
     *
     * @return the registered provider, or empty if {@code filename} is empty
     */
    public Optional<Provider> file(String filename) {
        return file(filename, false, null);
    }

    /**
     * Registers a file decoded with the default decoder and polled for changes.
     */
    public Optional<Provider> fileRefresh(String filename) {
        return file(filename, true, null);
    }

    /**
     * Registers a file decoded with {@code decoder}, read once.
     */
    public Optional<Provider> fileCustom(String filename, ItemDecoder decoder) {
        return file(filename, false, decoder);
    }

    /**
     * Registers a file decoded with {@code decoder} and polled for changes.
     */
    public Optional<Provider> fileCustomRefresh(String filename, ItemDecoder decoder) {
        return file(filename, true, decoder);
    }

    private Optional<Provider> file(String filename, boolean refresh, ItemDecoder decoder) {
        if (filename == null || filename.isEmpty()) {
            return Optional.empty();
        }

        String name = "file:" + filename;
        ItemDecoder effectiveDecoder = decoder != null ? decoder : defaultDecoder;

        Instant loadedAt = Instant.now();
        Path path;
        List<Item> items;
        try {
            path = Path.of(filename);
            items = FileProvider.readItems(path, effectiveDecoder);
        } catch (IOException | RuntimeException e) {
            return Optional.of(error(name, e));
        }

        FileProvider provider = new FileProvider(path, effectiveDecoder, items, loadedAt, store::notifyWatchers);
        if (refresh) {
            FileRefreshTask task = new FileRefreshTask(provider, refreshInterval, store.getMetricsRegistry());
            provider.attachRefreshTask(task.start());
        }
        // A closed store closes the provider, and with it the refresh task, before throwing
        store.registerProvider(provider);
        log.info("Configuration from file: {}", filename);
        return Optional.of(provider);
    }

    // ==================== DIRECTORIES ====================

    /**
     * Registers every regular file directly inside {@code dirname}, read once
     * with the default decoder.
     */
    public List<Provider> fileList(String dirname) {
        return fileList(dirname, null);
    }

    /**
     * Registers every regular file directly inside {@code dirname}, read once.
     *
     * <p>Subdirectories are skipped, never descended into. A symbolic link is
     * followed one level and skipped if it points to a directory. Failing to
     * list the directory, or to stat a link target, registers a single error
     * provider named {@code filelist:<dir>} and stops there.
     *
     * @return the providers registered, in file name order
     */
    public List<Provider> fileList(String dirname, ItemDecoder decoder) {
        if (dirname == null || dirname.isEmpty()) {
            return List.of();
        }

        String name = "filelist:" + dirname;
        List<Path> entries;
        try (Stream<Path> listing = Files.list(Path.of(dirname))) {
            entries = listing
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException | RuntimeException e) {
            return List.of(error(name, e));
        }

        List<Provider> registered = new ArrayList<>();
        for (Path entry : entries) {
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            if (Files.isSymbolicLink(entry)) {
                BasicFileAttributes target;
                try {
                    target = Files.readAttributes(entry, BasicFileAttributes.class);
                } catch (IOException e) {
                    registered.add(error(name, e));
                    return registered;
                }
                if (target.isDirectory()) {
                    continue;
                }
            }
            file(entry.toString(), false, decoder).ifPresent(registered::add);
        }
        return registered;
    }

    // ==================== ENVIRONMENT ====================

    /**
     * Imports environment variables starting with {@code prefix}, stripped of it.
     *
     * <p>The prefix is matched case-insensitively and gets a trailing {@code _}
     * if it lacks one. Both the prefix and each variable name go through the
     * key transformer before matching. An empty prefix imports everything under
     * the name {@code env:all}. Items get {@link #ENV_PRIORITY}. The environment
     * is read once.
     */
    public InMemoryProvider env(String prefix) {
        String normalized = prefix != null ? prefix : "";
        if (!normalized.isEmpty() && !normalized.endsWith("_")) {
            normalized += "_";
        }

        String label = normalized.isEmpty() ? "all" : normalized.toUpperCase(Locale.ROOT);
        InMemoryProvider provider = inMemory("env:" + label);

        String transformedPrefix = keyTransformer.transform(normalized);
        List<Item> items = new ArrayList<>();
        for (Map.Entry<String, String> variable : new TreeMap<>(environment.get()).entrySet()) {
            String key = keyTransformer.transform(variable.getKey());
            if (key.startsWith(transformedPrefix)) {
                items.add(new Item(key.substring(transformedPrefix.length()), variable.getValue(), ENV_PRIORITY));
            }
        }
        provider.add(items);

        log.info("Configuration from environment: prefix={}, items={}", label, items.size());
        return provider;
    }

    // ==================== IN-MEMORY / ERRORS ====================

    /**
     * Registers an empty in-memory provider; items can be added to it afterwards.
     */
    public InMemoryProvider inMemory(String name) {
        InMemoryProvider provider = new InMemoryProvider(name);
        store.registerProvider(provider);
        return provider;
    }

    /**
     * Registers a provider that always fails with {@code error}.
     */
    public ErrorProvider error(String name, Throwable error) {
        log.error("Configuration source failed: name={}, error={}", name, error.getMessage());
        ErrorProvider provider = new ErrorProvider(name, error);
        store.registerProvider(provider);
        return provider;
    }

    public Store getStore() {
        return store;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public static final class Builder {
        private final Store store;
        private Logger log = LoggerFactory.getLogger(SourceRegistrar.class);
        private Duration refreshInterval = FileRefreshTask.DEFAULT_INTERVAL;
        private ItemDecoder defaultDecoder = new YamlItemDecoder();
        private KeyTransformer keyTransformer = KeyTransformer.DEFAULT;
        private Supplier<Map<String, String>> environment = System::getenv;

        private Builder(Store store) {
            this.store = store;
        }

        /**
         * Sets the diagnostics sink; {@code NOPLogger.NOP_LOGGER} disables output.
         */
        public Builder logger(Logger log) {
            this.log = Objects.requireNonNull(log, "Logger is required");
            return this;
        }

        public Builder refreshInterval(Duration refreshInterval) {
            if (refreshInterval.isZero() || refreshInterval.isNegative()) {
                throw new IllegalArgumentException("Refresh interval must be positive: " + refreshInterval);
            }
            this.refreshInterval = refreshInterval;
            return this;
        }

        public Builder defaultDecoder(ItemDecoder defaultDecoder) {
            this.defaultDecoder = Objects.requireNonNull(defaultDecoder, "Decoder is required");
            return this;
        }

        public Builder keyTransformer(KeyTransformer keyTransformer) {
            this.keyTransformer = Objects.requireNonNull(keyTransformer, "Key transformer is required");
            return this;
        }

        public Builder environment(Supplier<Map<String, String>> environment) {
            this.environment = Objects.requireNonNull(environment, "Environment is required");
            return this;
        }

        public SourceRegistrar build() {
            return new SourceRegistrar(this);
        }
    }
}
