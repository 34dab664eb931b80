package fr.lapetina.configstore.domain.model;

import java.util.Objects;

/**
 * A single configuration entry.
 * Immutable and thread-safe.
 *
 * Priority only matters when two items share a key: the higher one wins.
 * An empty key is accepted but cannot be looked up meaningfully.
 */
public record Item(
        String key,
        String value,
        long priority
) {
    public Item {
        Objects.requireNonNull(key, "Item key is required");
        if (value == null) {
            value = "";
        }
    }

    public static Item of(String key, String value, long priority) {
        return new Item(key, value, priority);
    }

    public static Item of(String key, String value) {
        return new Item(key, value, 0);
    }

    /**
     * Returns true if this item wins over {@code other} when both are merged
     * in that order. Ties go to this item, the later one.
     */
    public boolean overrides(Item other) {
        return other == null || priority >= other.priority;
    }
}
