package fr.lapetina.configstore.store;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when the backing data of at least one provider changed.
     * The store is not resolved on the listener's behalf; call
     * {@link Store#resolve()} to read the new values.
     *
     * @param store the store whose configuration may have changed
     */
    void onConfigChanged(Store store);
}
