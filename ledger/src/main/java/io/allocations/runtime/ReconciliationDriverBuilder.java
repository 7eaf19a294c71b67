package io.allocations.runtime;

import com.codahale.metrics.MetricRegistry;
import io.allocations.error.FailureSink;
import io.allocations.ledger.AllocationLedger;
import io.allocations.metrics.Metrics;
import io.allocations.reconcile.AccountReconciler;
import io.allocations.retry.RetryPolicy;
import io.allocations.source.RetryingUsageSource;
import io.allocations.source.UsageSourceFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;

public class ReconciliationDriverBuilder {
    private AllocationLedger ledger;
    private UsageSourceFactory sources;
    private RetryPolicy retryPolicy;
    private Duration callTimeout = Duration.ZERO;
    private ExecutorService callExecutor;
    private Set<String> reservedAccounts = Set.of("root");
    private Clock clock = Clock.systemUTC();
    private int workers = 4;
    private Duration taskTimeout = Duration.ofMinutes(5);
    private MetricRegistry metricRegistry = new MetricRegistry();
    private FailureSink failureSink;

    public ReconciliationDriverBuilder ledger(AllocationLedger l) { this.ledger = l; return this; }
    public ReconciliationDriverBuilder sources(UsageSourceFactory f) { this.sources = f; return this; }
    public ReconciliationDriverBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public ReconciliationDriverBuilder callTimeout(Duration d, ExecutorService executor) { this.callTimeout = d; this.callExecutor = executor; return this; }
    public ReconciliationDriverBuilder reservedAccounts(Set<String> accounts) { this.reservedAccounts = Set.copyOf(accounts); return this; }
    public ReconciliationDriverBuilder clock(Clock c) { this.clock = c; return this; }
    public ReconciliationDriverBuilder workers(int w) { this.workers = Math.max(1, w); return this; }
    public ReconciliationDriverBuilder taskTimeout(Duration d) { this.taskTimeout = d; return this; }
    public ReconciliationDriverBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public ReconciliationDriverBuilder failureSink(FailureSink s) { this.failureSink = s; return this; }

    public ReconciliationDriver build() {
        Objects.requireNonNull(ledger, "ledger");
        Objects.requireNonNull(sources, "sources");
        Metrics metrics = new Metrics(metricRegistry);
        UsageSourceFactory effective = sources;
        if (retryPolicy != null) {
            effective = RetryingUsageSource.decorate(sources, retryPolicy, callTimeout, callExecutor, metrics);
        }
        AccountReconciler reconciler = new AccountReconciler(ledger, reservedAccounts, clock, metrics);
        return new ReconciliationDriver(ledger, effective, reconciler, failureSink, workers, taskTimeout, clock, metrics);
    }
}
