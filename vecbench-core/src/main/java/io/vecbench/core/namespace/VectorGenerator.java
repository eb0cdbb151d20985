package io.vecbench.core.namespace;

import io.vecbench.core.backend.VectorRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Synthetic unit-length vectors and benchmark documents.
 */
public final class VectorGenerator {
    static final String SYNTHETIC_TEXT = "This is synthetic benchmark document number %d. "
        + "It contains some text for testing upsert performance. "
        + "The content is meaningless but ensures we're testing realistic document sizes with typical metadata. "
        + "Lorem ipsum dolor sit amet, consectetur adipiscing elit.";

    private final Random random;

    public VectorGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public float[] unitVector(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        float[] vector = new float[dimensions];
        double squares = 0.0;
        for (int i = 0; i < dimensions; i++) {
            float value = (float) (random.nextDouble() * 2.0 - 1.0);
            vector[i] = value;
            squares += value * value;
        }
        double norm = Math.sqrt(squares);
        if (norm == 0.0) {
            vector[0] = 1.0f;
            return vector;
        }
        for (int i = 0; i < dimensions; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return vector;
    }

    public List<VectorRecord> syntheticRecords(int count, int dimensions, String idPrefix) {
        List<VectorRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(new VectorRecord(
                idPrefix + "-" + i,
                "Benchmark Document " + i,
                SYNTHETIC_TEXT.formatted(i),
                unitVector(dimensions)
            ));
        }
        return records;
    }
}
