package io.vecbench.core.backend;

/**
 * One search hit. {@code score} is a cosine distance (0 means identical) regardless of how the
 * backend reports it; {@code vector} is null unless the caller asked for vectors.
 */
public record QueryResult(String id, double score, String title, String text, float[] vector) {
    public QueryResult {
        title = title == null || title.isBlank() ? "Unknown" : title;
        text = text == null ? "" : text;
    }

    public boolean hasVector() {
        return vector != null && vector.length > 0;
    }
}
