package fr.lapetina.configstore.domain.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configstore.domain.model.Item;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * JSON file decoder, backed by Jackson. Accepts the same shapes as
 * {@link YamlItemDecoder}.
 */
public final class JsonItemDecoder implements ItemDecoder {

    private final ObjectMapper objectMapper;

    public JsonItemDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonItemDecoder() {
        this(new ObjectMapper());
    }

    @Override
    public List<Item> decode(byte[] content) throws IOException {
        if (new String(content, StandardCharsets.UTF_8).isBlank()) {
            return List.of();
        }
        return ItemTrees.toItems(objectMapper.readValue(content, Object.class));
    }
}
