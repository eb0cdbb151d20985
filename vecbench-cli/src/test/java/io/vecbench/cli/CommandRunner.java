package io.vecbench.cli;

import io.vecbench.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import picocli.CommandLine;

final class CommandRunner {
    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T08:30:15.123Z"), ZoneOffset.UTC);

    record Outcome(int exitCode, String out, String err) {
    }

    private CommandRunner() {
    }

    static CliContext context(Path tempDir, BackendProvider provider) throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "benchmark": {
                "dataDir": "%s",
                "maxRetries": 0
              }
            }
            """.formatted(tempDir.resolve("data").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
        return new CliContext(new ConfigService(), configPath, Map.of(), provider, CLOCK);
    }

    static Outcome run(Object command, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).execute(args);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
        return new Outcome(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }
}
