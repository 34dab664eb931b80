package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;
import fr.lapetina.configstore.domain.model.ItemList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable, lock-guarded holder of items.
 *
 * Backs file and environment sources so they can be refreshed in place.
 * Appends, full replacement and snapshot reads all take the same lock,
 * so a reader never observes a half-replaced list.
 */
public final class InMemoryProvider implements Provider {

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private List<Item> items = new ArrayList<>();

    public InMemoryProvider(String name) {
        this.name = Objects.requireNonNull(name, "Provider name is required");
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Appends items.
     *
     * @return this provider, for chaining
     */
    public InMemoryProvider add(Item... newItems) {
        return add(Arrays.asList(newItems));
    }

    public InMemoryProvider add(Collection<Item> newItems) {
        lock.lock();
        try {
            items.addAll(newItems);
        } finally {
            lock.unlock();
        }
        return this;
    }

    /**
     * Replaces all items at once.
     */
    public void replace(List<Item> newItems) {
        List<Item> copy = new ArrayList<>(newItems);
        lock.lock();
        try {
            items = copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the current items. Never fails.
     */
    @Override
    public ItemList load() {
        lock.lock();
        try {
            return ItemList.of(items);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "InMemoryProvider{name='" + name + "', items=" + size() + '}';
    }
}
