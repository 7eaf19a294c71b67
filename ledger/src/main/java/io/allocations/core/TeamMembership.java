package io.allocations.core;

public record TeamMembership(long id, long teamId, String userName, Role role) {

    public enum Role {
        OWNER("OW"),
        ADMIN("AD"),
        MEMBER("MB");

        private final String code;

        Role(String code) { this.code = code; }

        public String code() { return code; }

        public boolean isPrivileged() { return this == OWNER || this == ADMIN; }

        public static Role fromCode(String code) {
            for (Role r : values()) {
                if (r.code.equals(code)) return r;
            }
            throw new IllegalArgumentException("Unknown membership role: " + code);
        }
    }
}
