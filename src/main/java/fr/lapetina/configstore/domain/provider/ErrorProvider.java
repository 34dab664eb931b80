package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.ItemList;

import java.util.Objects;

/**
 * Stands in for a source that could not be set up.
 *
 * Returns no items and the captured error on every invocation, so the
 * failed source keeps showing up in resolution errors instead of vanishing.
 */
public final class ErrorProvider implements Provider {

    private final String name;
    private final Throwable error;

    public ErrorProvider(String name, Throwable error) {
        this.name = Objects.requireNonNull(name, "Provider name is required");
        this.error = Objects.requireNonNull(error, "Error is required");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ItemList load() {
        return ItemList.failed(error);
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return "ErrorProvider{name='" + name + "', error=" + error.getMessage() + '}';
    }
}
