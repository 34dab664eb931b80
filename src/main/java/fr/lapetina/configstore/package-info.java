/**
 * Config Store - aggregates configuration from files, directories, the environment and
 * in-memory overrides into one priority-resolved view, with live reload of files.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.configstore.ConfigStoreFactory} - Main entry point for creating
 *       a store wired from a YAML bootstrap file</li>
 *   <li>{@link fr.lapetina.configstore.ConfigStoreApplication} - Standalone HTTP server
 *       exposing the resolved configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Store store = new Store();
 * SourceRegistrar sources = SourceRegistrar.of(store);
 * sources.fileRefresh("/etc/app/base.yaml");
 * sources.env("APP");
 *
 * Watcher watcher = store.registerWatcher();
 * ResolvedConfig config = store.resolve();
 * String host = config.getValue("db.host").orElse("localhost");
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Priority resolution with last-registered-wins on ties</li>
 *   <li>Failure isolation: a broken source is reported, never fatal</li>
 *   <li>Hot reload of files with change notification</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.configstore.store.Store
 * @see fr.lapetina.configstore.source.SourceRegistrar
 */
package fr.lapetina.configstore;
