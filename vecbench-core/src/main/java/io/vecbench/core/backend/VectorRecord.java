package io.vecbench.core.backend;

import java.util.Objects;

public record VectorRecord(String id, String title, String text, float[] vector) {
    public VectorRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(vector, "vector must not be null");
        title = title == null ? "" : title;
        text = text == null ? "" : text;
    }
}
