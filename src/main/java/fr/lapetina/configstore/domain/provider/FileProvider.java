package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;
import fr.lapetina.configstore.domain.model.ItemList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Provider backed by a single configuration file.
 *
 * Items are decoded once at construction and kept in an {@link InMemoryProvider}.
 * {@link #reloadIfModified()} re-reads the file when its modification time moves
 * past the last one seen; a file that fails to decode leaves the previous items
 * in place.
 */
public final class FileProvider implements Provider {

    private static final Logger log = LoggerFactory.getLogger(FileProvider.class);

    private final Path path;
    private final ItemDecoder decoder;
    private final InMemoryProvider backing;
    private final Runnable onChange;

    private volatile Instant lastSeen;
    private volatile AutoCloseable refreshTask;

    /**
     * @param path         file to read
     * @param decoder      decoder used for every reload
     * @param initialItems items decoded at setup time
     * @param loadedAt     instant taken just before the initial read
     * @param onChange     called after every successful reload
     */
    public FileProvider(Path path, ItemDecoder decoder, List<Item> initialItems,
                        Instant loadedAt, Runnable onChange) {
        this.path = Objects.requireNonNull(path, "Path is required");
        this.decoder = Objects.requireNonNull(decoder, "Decoder is required");
        this.backing = new InMemoryProvider(nameFor(path)).add(initialItems);
        this.lastSeen = Objects.requireNonNull(loadedAt, "Load time is required");
        this.onChange = onChange != null ? onChange : () -> { };
    }

    public static String nameFor(Path path) {
        return "file:" + path;
    }

    /**
     * Reads and decodes a file in one go.
     */
    public static List<Item> readItems(Path path, ItemDecoder decoder) throws IOException {
        return decoder.decode(Files.readAllBytes(path));
    }

    @Override
    public String name() {
        return backing.name();
    }

    @Override
    public ItemList load() {
        return backing.load();
    }

    public Path getPath() {
        return path;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    /**
     * Performs one refresh check.
     *
     * @return what happened during this check
     */
    public synchronized RefreshOutcome reloadIfModified() {
        Instant modified;
        try {
            modified = Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            log.debug("Cannot stat config file, skipping refresh: path={}, error={}", path, e.getMessage());
            return RefreshOutcome.FAILED;
        }

        if (!modified.isAfter(lastSeen)) {
            return RefreshOutcome.UNCHANGED;
        }
        lastSeen = modified;

        List<Item> items;
        try {
            items = readItems(path, decoder);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to reload config file, keeping current items: path={}, error={}",
                    path, e.getMessage());
            return RefreshOutcome.FAILED;
        }

        backing.replace(items);
        log.info("Config file reloaded: path={}, items={}", path, items.size());
        onChange.run();
        return RefreshOutcome.RELOADED;
    }

    /**
     * Hands over the background task polling this file; it is stopped on {@link #close()}.
     */
    public void attachRefreshTask(AutoCloseable task) {
        this.refreshTask = task;
    }

    public boolean isRefreshing() {
        return refreshTask != null;
    }

    @Override
    public void close() {
        AutoCloseable task = refreshTask;
        refreshTask = null;
        if (task != null) {
            try {
                task.close();
            } catch (Exception e) {
                log.warn("Error stopping refresh task: path={}", path, e);
            }
        }
    }

    @Override
    public String toString() {
        return "FileProvider{path=" + path + ", refreshing=" + isRefreshing() + '}';
    }

    /**
     * Result of a single refresh check.
     */
    public enum RefreshOutcome {
        /** File changed and was swapped in */
        RELOADED,

        /** File not modified since the last check */
        UNCHANGED,

        /** Stat, read or decode failed; previous items kept */
        FAILED
    }
}
