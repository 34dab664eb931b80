/**
 * Configuration providers and file decoders.
 *
 * <p>A {@link fr.lapetina.configstore.domain.provider.Provider} is a named source the store
 * invokes on demand. File and environment sources keep their items in an
 * {@link fr.lapetina.configstore.domain.provider.InMemoryProvider} so they can be refreshed in
 * place; sources that could not be set up become an
 * {@link fr.lapetina.configstore.domain.provider.ErrorProvider}.
 */
package fr.lapetina.configstore.domain.provider;
