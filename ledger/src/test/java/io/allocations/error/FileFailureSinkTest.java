package io.allocations.error;

import io.allocations.reconcile.AccountKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileFailureSinkTest {
    @TempDir
    Path tmp;

    @Test
    void appends_one_json_line_per_failure_and_returns_newest_last() throws Exception {
        Path file = tmp.resolve("logs/failures.jsonl");
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
        FileFailureSink sink = new FileFailureSink(file, clock);

        sink.acceptFailure("account", new AccountKey("smp", "physics"), new IllegalStateException("first\nline"));
        sink.acceptFailure("cluster", new AccountKey("gpu", "*"), new IllegalStateException("said \"no\""));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("{\"ts\":\"2024-06-15T12:00:00Z\",\"stage\":\"account\""));
        assertFalse(lines.get(0).contains("\n"));
        assertEquals(List.of(lines.get(1)), sink.recent(1));
        assertEquals(2, sink.recent(50).size());
    }
}
