package fr.lapetina.configstore.store;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link Store#registerWatcher()}.
 *
 * Holds at most one pending notification: several changes signalled before
 * the consumer looks collapse into one.
 */
public final class Watcher implements AutoCloseable {

    private static final Object SIGNAL = new Object();

    private final Store store;
    private final BlockingQueue<Object> pending = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Watcher(Store store) {
        this.store = store;
    }

    void signal() {
        if (!closed.get()) {
            pending.offer(SIGNAL);
        }
    }

    /**
     * Consumes the pending notification, if any, without blocking.
     *
     * @return true if a change was signalled since the last call
     */
    public boolean poll() {
        return pending.poll() != null;
    }

    /**
     * Waits for the next notification.
     *
     * @return true if a change was signalled, false on timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS) != null;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Unregisters this watcher and drops any pending notification.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            store.unregisterWatcher(this);
            pending.clear();
        }
    }
}
