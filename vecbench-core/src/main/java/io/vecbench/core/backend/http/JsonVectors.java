package io.vecbench.core.backend.http;

import com.fasterxml.jackson.databind.JsonNode;

public final class JsonVectors {

    private JsonVectors() {
    }

    /**
     * Reads a vector from a JSON array, or from pgvector's text form {@code "[0.1,0.2]"}.
     * Returns null when the node holds no vector.
     */
    public static float[] read(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            float[] vector = new float[node.size()];
            for (int i = 0; i < node.size(); i++) {
                vector[i] = (float) node.get(i).asDouble();
            }
            return vector.length == 0 ? null : vector;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.startsWith("[")) {
                text = text.substring(1);
            }
            if (text.endsWith("]")) {
                text = text.substring(0, text.length() - 1);
            }
            if (text.isBlank()) {
                return null;
            }
            String[] parts = text.split(",");
            float[] vector = new float[parts.length];
            for (int i = 0; i < parts.length; i++) {
                vector[i] = Float.parseFloat(parts[i].trim());
            }
            return vector;
        }
        return null;
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
