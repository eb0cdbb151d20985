package io.vecbench.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ResultWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);
    private static final DateTimeFormatter ISO_MILLIS = DateTimeFormatter
        .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
        .withZone(ZoneOffset.UTC);

    private final Path dataDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    public ResultWriter(Path dataDir, Clock clock) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
    }

    public Path dataDir() {
        return dataDir;
    }

    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public static String isoTimestamp(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    /**
     * ISO-8601 timestamp with {@code :} and {@code .} replaced by {@code -}, safe in file names.
     */
    public static String fileTimestamp(Instant instant) {
        return isoTimestamp(instant).replace(':', '-').replace('.', '-');
    }

    /**
     * The caller's output path when given, else {@code {dataDir}/{stem}-{timestamp}.json}.
     */
    public Path resolve(Path explicitOutput, String stem, Instant at) {
        if (explicitOutput != null) {
            return explicitOutput;
        }
        return dataDir.resolve(stem + "-" + fileTimestamp(at) + ".json");
    }

    public Path write(Path target, BenchmarkArtifact artifact) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(artifact);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.info("Results saved to {}", target);
        return target;
    }
}
