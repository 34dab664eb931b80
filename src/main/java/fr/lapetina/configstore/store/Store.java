package fr.lapetina.configstore.store;

import fr.lapetina.configstore.domain.model.Item;
import fr.lapetina.configstore.domain.model.ItemList;
import fr.lapetina.configstore.domain.model.ProviderError;
import fr.lapetina.configstore.domain.model.ResolvedConfig;
import fr.lapetina.configstore.domain.provider.Provider;
import fr.lapetina.configstore.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Registry of configuration providers.
 *
 * Resolution is pull-based: {@link #resolve()} invokes every provider and merges
 * their items. Change notification is push-based: refreshing sources call
 * {@link #notifyWatchers()} and consumers decide when to resolve again.
 *
 * Thread-safe. Providers may be registered while another thread resolves.
 */
public final class Store implements AutoCloseable {

    private final Logger log;
    private final MetricsRegistry metricsRegistry;

    private final List<Provider> providers = new CopyOnWriteArrayList<>();
    private final List<Watcher> watchers = new CopyOnWriteArrayList<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param log             sink for store diagnostics; use
     *                        {@code org.slf4j.helpers.NOPLogger.NOP_LOGGER} to silence it
     * @param metricsRegistry metrics for resolutions and registrations; the provider
     *                        and watcher gauges of a shared registry follow the
     *                        store created last
     */
    public Store(Logger log, MetricsRegistry metricsRegistry) {
        this.log = log;
        this.metricsRegistry = metricsRegistry;
        metricsRegistry.registerProviderCount(providers::size);
        metricsRegistry.registerWatcherCount(() -> watchers.size() + listeners.size());
    }

    public Store(MetricsRegistry metricsRegistry) {
        this(LoggerFactory.getLogger(Store.class), metricsRegistry);
    }

    public Store() {
        this(MetricsRegistry.simple());
    }

    /**
     * Adds a provider. Names are not checked for uniqueness: providers sharing a
     * name all contribute.
     *
     * @throws IllegalStateException if the store is closed; the provider is
     *                               closed before this is thrown
     */
    public void registerProvider(Provider provider) {
        if (closed.get()) {
            rejectClosed(provider);
        }
        providers.add(provider);
        // close() may have run between the check and the add
        if (closed.get() && providers.remove(provider)) {
            rejectClosed(provider);
        }
        log.debug("Provider registered: name={}", provider.name());
    }

    private void rejectClosed(Provider provider) {
        closeProvider(provider);
        throw new IllegalStateException("Store is closed, cannot register provider: " + provider.name());
    }

    private void closeProvider(Provider provider) {
        try {
            provider.close();
        } catch (Exception e) {
            log.warn("Error closing provider: name={}", provider.name(), e);
        }
    }

    /**
     * Adds a provider backed by a plain supplier.
     */
    public Provider registerProvider(String name, Supplier<ItemList> supplier) {
        Provider provider = Provider.of(name, supplier);
        registerProvider(provider);
        return provider;
    }

    /**
     * Invokes every provider in registration order and merges their items.
     *
     * <p>On a key conflict the higher priority wins; on equal priority the
     * provider registered later wins. A failing provider never aborts the
     * resolution: whatever items it returned are merged and its error is
     * reported in {@link ResolvedConfig#errors()}.
     */
    public ResolvedConfig resolve() {
        long start = System.nanoTime();
        Map<String, Item> merged = new TreeMap<>();
        List<ProviderError> errors = new ArrayList<>();

        for (Provider provider : providers) {
            ItemList list;
            try {
                list = provider.load();
            } catch (RuntimeException e) {
                list = ItemList.failed(e);
            }
            if (list == null) {
                list = ItemList.empty();
            }

            for (Item item : list.items()) {
                Item current = merged.get(item.key());
                if (item.overrides(current)) {
                    merged.put(item.key(), item);
                }
            }

            if (list.isFailed()) {
                errors.add(new ProviderError(provider.name(), list.error()));
                metricsRegistry.incrementProviderError(provider.name());
                log.debug("Provider failed during resolve: name={}, error={}",
                        provider.name(), list.error().getMessage());
            }
        }

        metricsRegistry.recordResolve(Duration.ofNanos(System.nanoTime() - start));
        return new ResolvedConfig(merged, errors, Instant.now());
    }

    /**
     * Signals every watcher and listener that configuration may have changed.
     * Does not resolve.
     */
    public void notifyWatchers() {
        for (Watcher watcher : watchers) {
            watcher.signal();
        }
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(this);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Registers a new polling watcher.
     */
    public Watcher registerWatcher() {
        Watcher watcher = new Watcher(this);
        watchers.add(watcher);
        return watcher;
    }

    void unregisterWatcher(Watcher watcher) {
        watchers.remove(watcher);
    }

    /**
     * Adds a callback invoked on the notifying thread for every change.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns provider names in registration order.
     */
    public List<String> getProviderNames() {
        return providers.stream().map(Provider::name).toList();
    }

    public int getProviderCount() {
        return providers.size();
    }

    public int getWatcherCount() {
        return watchers.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * Closes every provider, stopping their refresh tasks, and drops all watchers.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Provider provider : providers) {
            closeProvider(provider);
        }
        for (Watcher watcher : new ArrayList<>(watchers)) {
            watcher.close();
        }
        listeners.clear();
        log.info("Store closed: providers={}", providers.size());
    }
}
