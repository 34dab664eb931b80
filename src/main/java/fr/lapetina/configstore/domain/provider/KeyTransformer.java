package fr.lapetina.configstore.domain.provider;

import java.util.Locale;

/**
 * Normalises environment variable names before prefix matching.
 */
@FunctionalInterface
public interface KeyTransformer {

    /**
     * Lower-cases the key and turns every {@code _} into {@code -},
     * so {@code APP_DB_HOST} becomes {@code app-db-host}.
     */
    KeyTransformer DEFAULT = key -> key.toLowerCase(Locale.ROOT).replace('_', '-');

    /**
     * Leaves keys untouched.
     */
    KeyTransformer IDENTITY = key -> key;

    String transform(String key);
}
