package io.allocations.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Settings of the reconciliation service. Each key is read as a system property ({@code allocations.workers})
 * and then as an environment variable ({@code ALLOCATIONS_WORKERS}) before falling back to its default.
 */
public record ReconcilerConfig(
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        int workers,
        Duration interval,
        Duration initialDelay,
        Duration taskTimeout,
        Duration callTimeout,
        int retryAttempts,
        long retryBaseMillis,
        long retryMaxMillis,
        Set<String> reservedAccounts,
        ZoneId zone,
        int adminPort,
        Path failureLog,
        String sacctmgr,
        String sshare
) {
    public ReconcilerConfig {
        reservedAccounts = Collections.unmodifiableSet(new LinkedHashSet<>(reservedAccounts));
    }

    public static ReconcilerConfig fromEnv() {
        return resolve(System::getProperty, System.getenv());
    }

    public static ReconcilerConfig from(Map<String, String> properties, Map<String, String> env) {
        return resolve(properties::get, env);
    }

    private static ReconcilerConfig resolve(Function<String, String> properties, Map<String, String> env) {
        Lookup l = new Lookup(properties, env);
        return new ReconcilerConfig(
                l.string("allocations.jdbc.url", "jdbc:h2:file:./data/allocations"),
                l.string("allocations.jdbc.user", ""),
                l.string("allocations.jdbc.password", ""),
                l.integer("allocations.workers", 4, 1),
                Duration.ofSeconds(l.longValue("allocations.interval.seconds", 3600, 1)),
                Duration.ofSeconds(l.longValue("allocations.initial.delay.seconds", 60, 0)),
                Duration.ofSeconds(l.longValue("allocations.task.timeout.seconds", 300, 1)),
                Duration.ofMillis(l.longValue("allocations.call.timeout.millis", 30_000, 0)),
                l.integer("allocations.retry.attempts", 3, 1),
                l.longValue("allocations.retry.base.millis", 500, 1),
                l.longValue("allocations.retry.max.millis", 5_000, 1),
                l.csv("allocations.reserved.accounts", "root"),
                l.zone("allocations.zone", "UTC"),
                l.integer("allocations.admin.port", 8080, 0),
                Path.of(l.string("allocations.failure.log", "./data/failures.jsonl")),
                l.string("allocations.slurm.sacctmgr", "sacctmgr"),
                l.string("allocations.slurm.sshare", "sshare"));
    }

    private static final class Lookup {
        private final Function<String, String> properties;
        private final Map<String, String> env;

        Lookup(Function<String, String> properties, Map<String, String> env) {
            this.properties = properties;
            this.env = env;
        }

        String string(String key, String def) {
            String v = properties.apply(key);
            if (v == null) v = env.get(key.toUpperCase(Locale.ROOT).replace('.', '_'));
            return v == null ? def : v.trim();
        }

        long longValue(String key, long def, long min) {
            String v = string(key, null);
            if (v == null || v.isEmpty()) return def;
            long parsed;
            try {
                parsed = Long.parseLong(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
            }
            if (parsed < min) throw new IllegalArgumentException(key + " must be >= " + min + " but was " + parsed);
            return parsed;
        }

        int integer(String key, int def, int min) {
            long v = longValue(key, def, min);
            if (v > Integer.MAX_VALUE) throw new IllegalArgumentException(key + " is too large: " + v);
            return (int) v;
        }

        ZoneId zone(String key, String def) {
            String v = string(key, def);
            try {
                return ZoneId.of(v);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
            }
        }

        Set<String> csv(String key, String def) {
            return Arrays.stream(string(key, def).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
    }
}
