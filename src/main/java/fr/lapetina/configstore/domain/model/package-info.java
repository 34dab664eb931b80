/**
 * Value types shared by providers, the store and the query API.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.configstore.domain.model.Item} - Immutable key/value/priority entry</li>
 *   <li>{@link fr.lapetina.configstore.domain.model.ItemList} - Items from one provider call, with an optional error</li>
 *   <li>{@link fr.lapetina.configstore.domain.model.ResolvedConfig} - Merged view returned by the store</li>
 *   <li>{@link fr.lapetina.configstore.domain.model.ProviderError} - A provider failure collected during resolution</li>
 * </ul>
 *
 * <p>All classes in this package are immutable records.
 */
package fr.lapetina.configstore.domain.model;
