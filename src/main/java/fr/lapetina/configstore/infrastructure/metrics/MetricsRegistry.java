package fr.lapetina.configstore.infrastructure.metrics;

import fr.lapetina.configstore.domain.provider.FileProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Resolution count and latency
 * - Provider error counters
 * - Refresh outcome counters per file
 * - Provider and watcher gauges
 * - Prometheus exposition when backed by a Prometheus registry
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "configstore";

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> refreshCounters = new ConcurrentHashMap<>();

    // Sources read by the store gauges
    private final AtomicReference<Supplier<Number>> providerCount = new AtomicReference<>();
    private final AtomicReference<Supplier<Number>> watcherCount = new AtomicReference<>();

    private final Counter resolveCounter;
    private final Timer resolveTimer;

    public MetricsRegistry(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;

        this.resolveCounter = Counter.builder(prefix + "_resolve_total")
                .description("Total number of resolutions")
                .register(registry);

        this.resolveTimer = Timer.builder(prefix + "_resolve_latency")
                .description("Time spent resolving all providers")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.debug("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Creates a registry exposing Prometheus metrics, JVM metrics included.
     */
    public static MetricsRegistry prometheus(String prefix) {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        log.info("Prometheus metrics enabled with prefix: {}", prefix);
        return new MetricsRegistry(registry, prefix);
    }

    /**
     * Creates an in-process registry, used when no exposition is needed.
     */
    public static MetricsRegistry simple() {
        return new MetricsRegistry(new SimpleMeterRegistry(), DEFAULT_PREFIX);
    }

    /**
     * Records one full resolution.
     */
    public void recordResolve(Duration latency) {
        resolveCounter.increment();
        resolveTimer.record(latency);
    }

    /**
     * Increments the error counter of a provider.
     */
    public void incrementProviderError(String providerName) {
        errorCounters.computeIfAbsent(providerName, k ->
                Counter.builder(prefix + "_provider_errors_total")
                        .description("Total number of provider failures seen during resolution")
                        .tag("provider", providerName)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts the outcome of one refresh check.
     */
    public void recordRefresh(String providerName, FileProvider.RefreshOutcome outcome) {
        String key = providerName + ":" + outcome.name();
        refreshCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_refresh_total")
                        .description("Total number of refresh checks")
                        .tag("provider", providerName)
                        .tag("outcome", outcome.name().toLowerCase())
                        .register(registry)
        ).increment();
    }

    /**
     * Points the provider gauge at {@code count}.
     *
     * <p>The gauge is registered once per registry. Attaching a second store
     * re-targets it, so the gauge reports the store attached last.
     */
    public void registerProviderCount(Supplier<Number> count) {
        bindGauge(providerCount, prefix + "_providers", "Number of registered providers", count);
    }

    /**
     * Points the watcher gauge at {@code count}; same re-targeting rule as
     * {@link #registerProviderCount(Supplier)}.
     */
    public void registerWatcherCount(Supplier<Number> count) {
        bindGauge(watcherCount, prefix + "_watchers", "Number of registered watchers", count);
    }

    private void bindGauge(AtomicReference<Supplier<Number>> target, String name,
                           String description, Supplier<Number> count) {
        if (target.getAndSet(count) == null) {
            Gauge.builder(name, target, ref -> ref.get().get().doubleValue())
                    .description(description)
                    .strongReference(true)
                    .register(registry);
        } else {
            log.debug("Gauge re-targeted to a new store: {}", name);
        }
    }

    /**
     * Returns the Prometheus scrape output, or an empty string if this
     * registry is not Prometheus-backed.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry) {
            return ((PrometheusMeterRegistry) registry).scrape();
        }
        return "";
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
