package fr.lapetina.configstore.domain.model;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Result of a single provider invocation: the items it produced and,
 * if the list may be incomplete, the reason why.
 */
public record ItemList(
        List<Item> items,
        Throwable error
) {
    private static final ItemList EMPTY = new ItemList(List.of(), null);

    public ItemList {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static ItemList empty() {
        return EMPTY;
    }

    public static ItemList of(Collection<Item> items) {
        return new ItemList(List.copyOf(items), null);
    }

    public static ItemList of(Item... items) {
        return new ItemList(List.of(items), null);
    }

    public static ItemList failed(Throwable error) {
        return new ItemList(List.of(), error);
    }

    public static ItemList partial(Collection<Item> items, Throwable error) {
        return new ItemList(List.copyOf(items), error);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
