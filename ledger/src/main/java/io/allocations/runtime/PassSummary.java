package io.allocations.runtime;

import io.allocations.reconcile.UnitResult;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one reconciliation pass over a set of clusters.
 */
public record PassSummary(Instant started, Instant finished, List<String> clusters, List<UnitResult> units) {

    public PassSummary {
        clusters = List.copyOf(clusters);
        units = List.copyOf(units);
    }

    public long count(UnitResult.Outcome outcome) {
        return units.stream().filter(u -> u.outcome() == outcome).count();
    }

    public long failures() {
        return units.stream().filter(UnitResult::isFailure).count();
    }

    public boolean isSuccessful() { return failures() == 0; }

    public String toJson() {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"started\":\"").append(started).append("\",\"finished\":\"").append(finished).append("\",\"clusters\":[");
        for (int i = 0; i < clusters.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append('"').append(escape(clusters.get(i))).append('"');
        }
        sb.append("],\"counts\":{");
        UnitResult.Outcome[] outcomes = UnitResult.Outcome.values();
        for (int i = 0; i < outcomes.length; i++) {
            if (i > 0) sb.append(',');
            sb.append('"').append(outcomes[i]).append("\":").append(count(outcomes[i]));
        }
        sb.append("},\"units\":[");
        for (int i = 0; i < units.size(); i++) {
            UnitResult u = units.get(i);
            if (i > 0) sb.append(',');
            sb.append("{\"cluster\":\"").append(escape(u.key().cluster()))
                    .append("\",\"account\":\"").append(escape(u.key().account()))
                    .append("\",\"outcome\":\"").append(u.outcome()).append('"');
            if (u.newLimit() != null) sb.append(",\"newLimit\":").append(u.newLimit());
            if (!u.closed().isEmpty()) sb.append(",\"closed\":").append(u.closed().size());
            if (u.error() != null) sb.append(",\"error\":\"").append(escape(u.error())).append('"');
            sb.append('}');
        }
        sb.append("]}");
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }
}
