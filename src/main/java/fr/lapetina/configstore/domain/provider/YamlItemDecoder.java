package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Default file decoder, backed by SnakeYAML.
 *
 * <pre>{@code
 * - key: db.host
 *   value: localhost
 *   priority: 10
 * }</pre>
 */
public final class YamlItemDecoder implements ItemDecoder {

    @Override
    public List<Item> decode(byte[] content) throws IOException {
        // Yaml instances are not thread-safe
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(new String(content, StandardCharsets.UTF_8));
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML: " + e.getMessage(), e);
        }
        return ItemTrees.toItems(root);
    }
}
