package fr.lapetina.configstore.infrastructure.refresh;

import fr.lapetina.configstore.domain.provider.FileProvider;
import fr.lapetina.configstore.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background poller for one refreshable config file.
 *
 * Runs on its own daemon thread and checks the file at a fixed delay.
 * Stopped by {@link #close()}; nothing else ends it.
 */
public final class FileRefreshTask implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileRefreshTask.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);

    private final FileProvider provider;
    private final Duration interval;
    private final MetricsRegistry metricsRegistry;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public FileRefreshTask(FileProvider provider, Duration interval, MetricsRegistry metricsRegistry) {
        this.provider = provider;
        this.interval = interval;
        this.metricsRegistry = metricsRegistry;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-refresh-" + provider.getPath().getFileName());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts polling. The first check happens one interval from now.
     */
    public FileRefreshTask start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::tick,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Config refresh started: path={}, interval={}", provider.getPath(), interval);
        }
        return this;
    }

    /**
     * Performs one check immediately on the calling thread.
     */
    public FileProvider.RefreshOutcome tick() {
        FileProvider.RefreshOutcome outcome;
        try {
            outcome = provider.reloadIfModified();
        } catch (RuntimeException e) {
            // A change listener failing must not kill the scheduled task
            log.error("Error during config refresh: path={}", provider.getPath(), e);
            outcome = FileProvider.RefreshOutcome.FAILED;
        }
        metricsRegistry.recordRefresh(provider.name(), outcome);
        return outcome;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Config refresh stopped: path={}", provider.getPath());
        } else {
            scheduler.shutdownNow();
        }
    }
}
