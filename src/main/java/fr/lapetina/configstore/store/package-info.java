/**
 * The provider registry and its resolution and notification engine.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.configstore.store.Store} - Registers providers, resolves them by priority, fans out change notifications</li>
 *   <li>{@link fr.lapetina.configstore.store.Watcher} - Polling handle for change notifications</li>
 *   <li>{@link fr.lapetina.configstore.store.ConfigChangeListener} - Callback for change notifications</li>
 * </ul>
 *
 * <h2>Resolution</h2>
 * <p>Providers are invoked in registration order. For items sharing a key, the higher
 * priority wins and ties go to the provider registered last. Provider failures are
 * collected, never fatal.
 *
 * @see fr.lapetina.configstore.store.Store
 */
package fr.lapetina.configstore.store;
