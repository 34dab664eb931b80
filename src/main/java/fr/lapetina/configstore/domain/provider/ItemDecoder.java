package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;

import java.io.IOException;
import java.util.List;

/**
 * Turns the raw content of a configuration file into items.
 */
@FunctionalInterface
public interface ItemDecoder {

    /**
     * @param content the full file content
     * @return decoded items, never null
     * @throws IOException if the content cannot be decoded
     */
    List<Item> decode(byte[] content) throws IOException;
}
