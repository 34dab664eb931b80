package fr.lapetina.configstore.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.configstore.domain.model.Item;

/**
 * API view of a single resolved item.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItemResponse {

    private String key;
    private String value;
    private long priority;

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public long getPriority() { return priority; }
    public void setPriority(long priority) { this.priority = priority; }

    /**
     * Creates from a domain item. The key is left out when the item is
     * rendered inside a keyed map.
     */
    public static ItemResponse fromItem(Item item, boolean includeKey) {
        ItemResponse api = new ItemResponse();
        if (includeKey) {
            api.setKey(item.key());
        }
        api.setValue(item.value());
        api.setPriority(item.priority());
        return api;
    }
}
