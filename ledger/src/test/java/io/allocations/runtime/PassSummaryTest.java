package io.allocations.runtime;

import io.allocations.reconcile.AccountKey;
import io.allocations.reconcile.UnitResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PassSummaryTest {
    @Test
    void json_carries_counts_and_escaped_errors() {
        Instant now = Instant.parse("2024-06-15T12:00:00Z");
        PassSummary summary = new PassSummary(now, now, List.of("smp"), List.of(
                UnitResult.updated(new AccountKey("smp", "physics"), 1500, List.of()),
                UnitResult.failed(new AccountKey("smp", "chem"), new IllegalStateException("bad \"quote\""))));

        String json = summary.toJson();

        assertEquals(1, summary.failures());
        assertFalse(summary.isSuccessful());
        assertTrue(json.contains("\"UPDATED\":1"));
        assertTrue(json.contains("\"FAILED\":1"));
        assertTrue(json.contains("\"newLimit\":1500"));
        assertTrue(json.contains("bad \\\"quote\\\""));
    }
}
