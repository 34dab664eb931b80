package fr.lapetina.configstore.domain.model;

import java.util.Objects;

/**
 * Failure reported by one provider during a resolution.
 */
public record ProviderError(
        String providerName,
        Throwable cause
) {
    public ProviderError {
        Objects.requireNonNull(providerName, "Provider name is required");
        Objects.requireNonNull(cause, "Cause is required");
    }

    public String message() {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
