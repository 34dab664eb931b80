package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.ItemList;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named source of configuration items, invoked on demand by the store.
 *
 * Implementations must be thread-safe: {@link #load()} may be called from
 * any thread that resolves the store, concurrently with a background refresh.
 */
public interface Provider extends AutoCloseable {

    /**
     * Returns the diagnostic name of this provider, e.g. {@code file:/etc/app.yaml}.
     * Names are not required to be unique.
     */
    String name();

    /**
     * Produces the current items of this source.
     *
     * <p>Failures are reported through {@link ItemList#error()} rather than thrown,
     * so a partially readable source still contributes what it has.
     */
    ItemList load();

    /**
     * Releases background resources held by this provider.
     */
    @Override
    default void close() {
        // Default no-op, override for providers owning a refresh task
    }

    /**
     * Adapts a plain supplier into a named provider.
     */
    static Provider of(String name, Supplier<ItemList> supplier) {
        Objects.requireNonNull(name, "Provider name is required");
        Objects.requireNonNull(supplier, "Supplier is required");
        return new Provider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ItemList load() {
                return supplier.get();
            }

            @Override
            public String toString() {
                return "Provider{name='" + name + "'}";
            }
        };
    }
}
