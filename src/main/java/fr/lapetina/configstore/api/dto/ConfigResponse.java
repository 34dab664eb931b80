package fr.lapetina.configstore.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.configstore.domain.model.ProviderError;
import fr.lapetina.configstore.domain.model.ResolvedConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * API view of a full resolution: merged items plus per-provider errors.
 */
public class ConfigResponse {

    @JsonProperty("resolved_at")
    private Instant resolvedAt;

    private Map<String, ItemResponse> items = new LinkedHashMap<>();

    private List<ErrorEntry> errors = new ArrayList<>();

    public Instant getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }

    public Map<String, ItemResponse> getItems() { return items; }
    public void setItems(Map<String, ItemResponse> items) { this.items = items; }

    public List<ErrorEntry> getErrors() { return errors; }
    public void setErrors(List<ErrorEntry> errors) { this.errors = errors; }

    /**
     * Creates from a domain resolution.
     */
    public static ConfigResponse fromResolvedConfig(ResolvedConfig resolved) {
        ConfigResponse api = new ConfigResponse();
        api.setResolvedAt(resolved.resolvedAt());
        resolved.items().forEach((key, item) -> api.items.put(key, ItemResponse.fromItem(item, false)));
        for (ProviderError error : resolved.errors()) {
            api.errors.add(new ErrorEntry(error.providerName(), error.message()));
        }
        return api;
    }

    /**
     * A provider failure.
     */
    public static class ErrorEntry {
        private String provider;
        private String error;

        public ErrorEntry() {
        }

        public ErrorEntry(String provider, String error) {
            this.provider = provider;
            this.error = error;
        }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }
}
