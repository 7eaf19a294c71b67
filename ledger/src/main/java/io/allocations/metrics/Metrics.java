package io.allocations.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String PASS_TIME = "reconcile.pass.time";
    public static final String UNIT_TIME = "reconcile.unit.time";
    public static final String UNIT_SUCCESS = "reconcile.unit.success";
    public static final String UNIT_FAILURE = "reconcile.unit.failure";
    public static final String UNIT_SKIPPED = "reconcile.unit.skipped";
    public static final String UNIT_TIMEOUT = "reconcile.unit.timeout";
    public static final String ALLOCATIONS_CLOSED = "reconcile.allocations.closed";
    public static final String ORPHANS_LOCKED = "reconcile.orphans.locked";
    public static final String LIMITS_SET = "reconcile.limits.set";
    public static final String SOURCE_RETRIES = "usage.source.retries";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
