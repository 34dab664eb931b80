package fr.lapetina.configstore.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time view produced by resolving every registered provider.
 * Immutable and thread-safe.
 *
 * Per-provider failures are kept alongside the merged items so callers can
 * still use every healthy source.
 */
public record ResolvedConfig(
        Map<String, Item> items,
        List<ProviderError> errors,
        Instant resolvedAt
) {
    public ResolvedConfig {
        items = items != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(items))
                : Map.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        if (resolvedAt == null) {
            resolvedAt = Instant.now();
        }
    }

    public static ResolvedConfig empty() {
        return new ResolvedConfig(Map.of(), List.of(), Instant.now());
    }

    public Optional<Item> get(String key) {
        return Optional.ofNullable(items.get(key));
    }

    public Optional<String> getValue(String key) {
        return get(key).map(Item::value);
    }

    public Set<String> keys() {
        return items.keySet();
    }

    public int size() {
        return items.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns the errors reported by every provider registered under {@code providerName}.
     */
    public List<ProviderError> errorsFor(String providerName) {
        return errors.stream()
                .filter(e -> e.providerName().equals(providerName))
                .toList();
    }
}
