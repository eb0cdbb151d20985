package io.vecbench.core.backend;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum BackendType {
    TURBOPUFFER("tpuf"),
    PINECONE("pinecone"),
    SUPABASE("supabase");

    private final String id;

    BackendType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static BackendType fromId(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (BackendType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid backend: " + raw + ". Valid backends: " + validIds());
    }

    public static String validIds() {
        return Arrays.stream(values()).map(BackendType::id).collect(Collectors.joining(", "));
    }
}
