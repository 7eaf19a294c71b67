package io.allocations.core;

import java.time.LocalDate;

/**
 * A team's proposal for service units on one or more clusters. Its allocations are only in force once the
 * request is approved and today falls in {@code [active, expire)}.
 */
public record AllocationRequest(
        long id,
        long teamId,
        String title,
        String description,
        LocalDate submitted,
        LocalDate approved,
        LocalDate active,
        LocalDate expire,
        Status status
) {
    public boolean isApproved() { return status == Status.APPROVED; }

    public enum Status {
        PENDING("PD"),
        APPROVED("AP"),
        DECLINED("DC"),
        CHANGES_REQUESTED("CR");

        private final String code;

        Status(String code) { this.code = code; }

        public String code() { return code; }

        public static Status fromCode(String code) {
            for (Status s : values()) {
                if (s.code.equals(code)) return s;
            }
            throw new IllegalArgumentException("Unknown request status: " + code);
        }
    }
}
