package fr.lapetina.configstore.integration;

import fr.lapetina.configstore.ConfigStoreFactory;
import fr.lapetina.configstore.infrastructure.config.ConfigLoader;
import fr.lapetina.configstore.infrastructure.config.StoreConfig;

import java.util.Map;

/**
 * Factory wired against a fixed environment instead of the process one.
 */
class TestConfigStoreFactory extends ConfigStoreFactory {

    TestConfigStoreFactory(StoreConfig config, Map<String, String> environment) {
        super(config, () -> environment);
    }

    static TestConfigStoreFactory create(String configPath, Map<String, String> environment) {
        return new TestConfigStoreFactory(new ConfigLoader(configPath).load(), environment);
    }
}
