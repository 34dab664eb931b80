/**
 * Bootstrap configuration loading.
 *
 * <p>The bootstrap file lists the sources to register, in precedence order, along with
 * refresh, metrics and HTTP settings.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.configstore.infrastructure.config.StoreConfig} - Bootstrap configuration model</li>
 *   <li>{@link fr.lapetina.configstore.infrastructure.config.ConfigLoader} - YAML loading from file system or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP query API settings (port, backlog)</li>
 *   <li>{@code refresh} - Poll interval of refreshable files</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code sources} - Ordered list of {@code file}, {@code filelist}, {@code env} and {@code inmemory} sources</li>
 * </ul>
 */
package fr.lapetina.configstore.infrastructure.config;
