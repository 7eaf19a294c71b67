package io.allocations.error;

import io.allocations.reconcile.AccountKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;

/**
 * Appends one JSON object per failure to a file (JSON lines).
 */
public class FileFailureSink implements FailureSink {
    private static final Logger log = LoggerFactory.getLogger(FileFailureSink.class);

    private final Path file;
    private final Clock clock;

    public FileFailureSink(Path file) throws IOException {
        this(file, Clock.systemUTC());
    }

    public FileFailureSink(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void acceptFailure(String stage, AccountKey key, Exception e) {
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"cluster\":\"%s\",\"account\":\"%s\",\"error\":\"%s\"}%n",
                clock.instant(), safe(stage), safe(key.cluster()), safe(key.account()), safe(e.toString()));
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            log.warn("Could not record failure of {} in {}", key, file, io);
        }
    }

    @Override
    public synchronized List<String> recent(int limit) {
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.removeIf(String::isBlank);
            int from = Math.max(0, lines.size() - Math.max(0, limit));
            return List.copyOf(lines.subList(from, lines.size()));
        } catch (IOException io) {
            log.warn("Could not read failure log {}", file, io);
            return List.of();
        }
    }

    private static String safe(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " ").replace("\r", " ");
    }
}
