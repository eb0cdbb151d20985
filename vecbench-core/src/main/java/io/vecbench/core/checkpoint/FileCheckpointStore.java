package io.vecbench.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON file checkpoint. Not safe for two sweeps pointing at the same path.
 */
public final class FileCheckpointStore implements CheckpointStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileCheckpointStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized Checkpoint load() {
        if (!Files.exists(path)) {
            return Checkpoint.empty();
        }
        try {
            Checkpoint checkpoint = mapper.readValue(Files.readString(path), Checkpoint.class);
            return checkpoint == null ? Checkpoint.empty() : checkpoint;
        } catch (Exception e) {
            LOG.debug("Ignoring unreadable checkpoint {}: {}", path, e.getMessage());
            return Checkpoint.empty();
        }
    }

    @Override
    public synchronized void save(Checkpoint checkpoint) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(checkpoint);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public synchronized void clear() throws IOException {
        Files.deleteIfExists(path);
    }
}
