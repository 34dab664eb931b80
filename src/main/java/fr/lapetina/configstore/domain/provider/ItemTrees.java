package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Converts a generic document tree (lists, maps and scalars, as produced by
 * SnakeYAML or Jackson) into items.
 *
 * Two shapes are accepted:
 * - a sequence of {@code {key, value, priority}} mappings
 * - a mapping of scalar {@code key: value} pairs, all at priority 0
 */
final class ItemTrees {

    private ItemTrees() {
        // Utility class
    }

    static List<Item> toItems(Object root) throws IOException {
        if (root == null) {
            return List.of();
        }
        if (root instanceof Collection) {
            return fromSequence((Collection<?>) root);
        }
        if (root instanceof Map) {
            return fromMapping((Map<?, ?>) root);
        }
        throw new IOException("Expected a list of items or a mapping, got: "
                + root.getClass().getSimpleName());
    }

    private static List<Item> fromSequence(Collection<?> entries) throws IOException {
        List<Item> items = new ArrayList<>(entries.size());
        int index = 0;
        for (Object entry : entries) {
            if (!(entry instanceof Map)) {
                throw new IOException("Item #" + index + " is not a mapping");
            }
            Map<?, ?> fields = (Map<?, ?>) entry;
            items.add(new Item(
                    scalar(fields.get("key"), "key"),
                    scalar(fields.get("value"), "value"),
                    priority(fields.get("priority"), index)
            ));
            index++;
        }
        return items;
    }

    private static List<Item> fromMapping(Map<?, ?> map) throws IOException {
        List<Item> items = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = text(entry.getKey());
            items.add(new Item(key, scalar(entry.getValue(), key), 0));
        }
        return items;
    }

    private static String scalar(Object value, String field) throws IOException {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof Collection) {
            throw new IOException("Field '" + field + "' must be a scalar");
        }
        return text(value);
    }

    /**
     * Renders a decoded scalar. Timestamps resolved by the YAML parser go back
     * to ISO-8601 in UTC, date-only when they fall on midnight.
     */
    private static String text(Object value) {
        if (value instanceof Date) {
            Instant instant = ((Date) value).toInstant();
            ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
            if (utc.toLocalTime().equals(LocalTime.MIDNIGHT)) {
                return DateTimeFormatter.ISO_LOCAL_DATE.format(utc);
            }
            return instant.toString();
        }
        return String.valueOf(value);
    }

    private static long priority(Object value, int index) throws IOException {
        if (value == null) {
            return 0;
        }
        try {
            if (value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).longValueExact();
            }
            if (value instanceof Number) {
                // Floating values are accepted only when integral
                return new BigDecimal(value.toString()).longValueExact();
            }
            return Long.parseLong(String.valueOf(value).trim());
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IOException("Item #" + index + " has an invalid priority: " + value, e);
        }
    }
}
