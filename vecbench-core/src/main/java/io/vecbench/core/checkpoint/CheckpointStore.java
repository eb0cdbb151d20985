package io.vecbench.core.checkpoint;

import java.io.IOException;

public interface CheckpointStore {
    /**
     * Returns the persisted checkpoint, or {@link Checkpoint#empty()} when there is none or it
     * cannot be read.
     */
    Checkpoint load();

    void save(Checkpoint checkpoint) throws IOException;

    void clear() throws IOException;
}
