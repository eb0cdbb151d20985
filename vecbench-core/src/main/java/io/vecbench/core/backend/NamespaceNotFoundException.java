package io.vecbench.core.backend;

public final class NamespaceNotFoundException extends BackendException {
    public NamespaceNotFoundException(String message) {
        super(404, message);
    }
}
