package io.allocations.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.allocations.core.Cluster;
import io.allocations.error.FailureSink;
import io.allocations.ledger.AllocationLedger;
import io.allocations.ledger.LedgerException;
import io.allocations.metrics.Metrics;
import io.allocations.reconcile.AccountKey;
import io.allocations.reconcile.AccountReconciler;
import io.allocations.reconcile.UnitResult;
import io.allocations.source.UsageSource;
import io.allocations.source.UsageSourceException;
import io.allocations.source.UsageSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs reconciliation passes, on a fixed schedule or on demand. A pass lists the accounts of every enabled
 * cluster and reconciles each (cluster, account) pair as an independent unit on a worker pool. Units for
 * different accounts run in parallel with no ordering between them; a unit whose account is already being
 * reconciled is skipped. A failing or timed out unit is logged and recorded without affecting its siblings.
 * <p>
 * At most {@code workers} units run at once. A unit that overruns the task timeout is abandoned: its slot goes
 * to the next queued unit on a fresh thread, while the stuck thread keeps the account locked until it returns.
 */
public class ReconciliationDriver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationDriver.class);
    private static final long POLL_MILLIS = 20;
    private static final String ALL_ACCOUNTS = "*";

    private final AllocationLedger ledger;
    private final UsageSourceFactory sources;
    private final AccountReconciler reconciler;
    private final FailureSink failureSink;
    private final Duration taskTimeout;
    private final Clock clock;
    private final ExecutorService workerPool;
    private final Semaphore slots;
    private final ScheduledExecutorService scheduler;
    private final KeyedLocks<AccountKey> locks = new KeyedLocks<>();

    private final Timer passTimer;
    private final Timer unitTimer;
    private final Meter successMeter;
    private final Meter failureMeter;
    private final Meter skippedMeter;
    private final Meter timeoutMeter;

    private volatile ScheduledFuture<?> schedule;
    private volatile PassSummary lastPass;

    public ReconciliationDriver(AllocationLedger ledger,
                                UsageSourceFactory sources,
                                AccountReconciler reconciler,
                                FailureSink failureSink,
                                int workers,
                                Duration taskTimeout,
                                Clock clock,
                                Metrics metrics) {
        this.ledger = Objects.requireNonNull(ledger);
        this.sources = Objects.requireNonNull(sources);
        this.reconciler = Objects.requireNonNull(reconciler);
        this.failureSink = failureSink;
        this.taskTimeout = Objects.requireNonNull(taskTimeout);
        this.clock = Objects.requireNonNull(clock);
        this.workerPool = Executors.newCachedThreadPool(threadFactory("reconcile-worker"));
        this.slots = new Semaphore(Math.max(1, workers));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("reconcile-scheduler"));
        this.passTimer = metrics.timer(Metrics.PASS_TIME);
        this.unitTimer = metrics.timer(Metrics.UNIT_TIME);
        this.successMeter = metrics.meter(Metrics.UNIT_SUCCESS);
        this.failureMeter = metrics.meter(Metrics.UNIT_FAILURE);
        this.skippedMeter = metrics.meter(Metrics.UNIT_SKIPPED);
        this.timeoutMeter = metrics.meter(Metrics.UNIT_TIMEOUT);
    }

    /** Schedule {@link #reconcileAll()} with a fixed delay between the end of one pass and the start of the next. */
    public synchronized void start(Duration initialDelay, Duration interval) {
        if (schedule != null) return;
        log.info("Scheduling reconciliation every {} s after an initial delay of {} s, abandoning units after {} ms",
                interval.toSeconds(), initialDelay.toSeconds(), taskTimeout.toMillis());
        schedule = scheduler.scheduleWithFixedDelay(this::scheduledPass, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (schedule == null) return;
        schedule.cancel(false);
        schedule = null;
    }

    public boolean isRunning() { return schedule != null; }

    public Optional<PassSummary> lastPass() { return Optional.ofNullable(lastPass); }

    /** Reconcile every account on every enabled cluster. */
    public PassSummary reconcileAll() throws LedgerException {
        log.info("Begin updating limits for all enabled clusters");
        return runPass(ledger.enabledClusters());
    }

    /**
     * Reconcile every account on one cluster. A disabled cluster is left alone and yields an empty summary.
     *
     * @throws IllegalArgumentException if the ledger has no cluster with that name
     */
    public PassSummary reconcileCluster(String clusterName) throws LedgerException {
        Cluster cluster = ledger.findCluster(clusterName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown cluster " + clusterName));
        if (!cluster.enabled()) {
            log.warn("Cluster {} is disabled, not reconciling it", clusterName);
            return runPass(List.of());
        }
        return runPass(List.of(cluster));
    }

    private void scheduledPass() {
        try {
            reconcileAll();
        } catch (LedgerException e) {
            log.error("Scheduled pass could not read clusters from the ledger", e);
        } catch (RuntimeException e) {
            log.error("Scheduled pass failed", e);
        }
    }

    private PassSummary runPass(List<Cluster> clusters) {
        Instant started = clock.instant();
        List<String> names = new ArrayList<>();
        List<UnitResult> clusterFailures = new ArrayList<>();
        List<UnitTask> tasks = new ArrayList<>();
        try (Timer.Context ignored = passTimer.time()) {
            for (Cluster cluster : clusters) {
                names.add(cluster.name());
                UsageSource source = sources.forCluster(cluster);
                Set<String> accounts;
                try {
                    accounts = new TreeSet<>(source.listAccounts());
                } catch (UsageSourceException | RuntimeException e) {
                    AccountKey key = new AccountKey(cluster.name(), ALL_ACCOUNTS);
                    log.error("Could not list accounts on cluster {}", cluster.name(), e);
                    failureMeter.mark();
                    recordFailure("cluster", key, e);
                    clusterFailures.add(UnitResult.failed(key, e));
                    continue;
                }
                log.info("Updating limits for {} accounts on cluster {}", accounts.size(), cluster.name());
                for (String account : accounts) {
                    AccountKey key = new AccountKey(cluster.name(), account);
                    tasks.add(new UnitTask(key, () -> runUnit(cluster, source, key)));
                }
            }
            List<UnitResult> results = new ArrayList<>(clusterFailures);
            results.addAll(execute(tasks));
            PassSummary summary = new PassSummary(started, clock.instant(), names, results);
            lastPass = summary;
            log.info("Pass over {} finished: {} units, {} failed", names, results.size(), summary.failures());
            return summary;
        }
    }

    private UnitResult runUnit(Cluster cluster, UsageSource source, AccountKey key) {
        Optional<KeyedLocks<AccountKey>.Lease> lease = locks.tryAcquire(key);
        if (lease.isEmpty()) {
            log.warn("Reconciliation of {} is already in progress, skipping", key);
            skippedMeter.mark();
            return UnitResult.skippedBusy(key);
        }
        MDC.put("cluster", key.cluster());
        MDC.put("account", key.account());
        try (KeyedLocks<AccountKey>.Lease ignored = lease.get(); Timer.Context t = unitTimer.time()) {
            UnitResult result = reconciler.reconcile(cluster, source, key.account());
            successMeter.mark();
            return result;
        } catch (Exception e) {
            failureMeter.mark();
            log.error("Failed to update limit for {}", key, e);
            recordFailure("account", key, e);
            return UnitResult.failed(key, e);
        } finally {
            MDC.remove("cluster");
            MDC.remove("account");
        }
    }

    private List<UnitResult> execute(List<UnitTask> tasks) {
        UnitResult[] results = new UnitResult[tasks.size()];
        Deque<Integer> queued = new ArrayDeque<>();
        for (int i = 0; i < tasks.size(); i++) queued.add(i);
        List<Integer> running = new ArrayList<>();
        long timeoutNanos = taskTimeout.toNanos();
        while (!queued.isEmpty() || !running.isEmpty()) {
            while (!queued.isEmpty() && slots.tryAcquire()) {
                int i = queued.poll();
                UnitTask task = tasks.get(i);
                try {
                    task.start(workerPool);
                    running.add(i);
                } catch (RejectedExecutionException e) {
                    slots.release();
                    results[i] = UnitResult.failed(task.key, e);
                }
            }
            for (Iterator<Integer> it = running.iterator(); it.hasNext(); ) {
                int i = it.next();
                UnitTask task = tasks.get(i);
                if (task.future.isDone()) {
                    results[i] = task.result();
                } else if (task.hasRunLongerThan(timeoutNanos)) {
                    task.future.cancel(true);
                    String message = "Abandoned after " + taskTimeout.toMillis() + " ms";
                    log.warn("Reconciliation of {} timed out, abandoning it until the next pass", task.key);
                    timeoutMeter.mark();
                    recordFailure("account", task.key, new TimeoutException(message));
                    results[i] = UnitResult.timedOut(task.key, message);
                } else {
                    continue;
                }
                slots.release();
                it.remove();
            }
            if (queued.isEmpty() && running.isEmpty()) break;
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                for (int i : running) {
                    tasks.get(i).future.cancel(true);
                    results[i] = UnitResult.timedOut(tasks.get(i).key, "Pass interrupted");
                    slots.release();
                }
                for (int i : queued) {
                    results[i] = UnitResult.timedOut(tasks.get(i).key, "Pass interrupted");
                }
                break;
            }
        }
        return List.of(results);
    }

    private void recordFailure(String stage, AccountKey key, Exception e) {
        if (failureSink != null) failureSink.acceptFailure(stage, key, e);
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
        workerPool.shutdownNow();
    }

    private static java.util.concurrent.ThreadFactory threadFactory(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class UnitTask {
        final AccountKey key;
        final Callable<UnitResult> work;
        Future<UnitResult> future;
        long startedNanos;

        UnitTask(AccountKey key, Callable<UnitResult> work) {
            this.key = key;
            this.work = work;
        }

        void start(ExecutorService pool) {
            startedNanos = System.nanoTime();
            future = pool.submit(work);
        }

        boolean hasRunLongerThan(long nanos) {
            return System.nanoTime() - startedNanos > nanos;
        }

        UnitResult result() {
            try {
                return future.get();
            } catch (CancellationException e) {
                return UnitResult.timedOut(key, "Cancelled");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                return UnitResult.failed(key, cause instanceof Exception ex ? ex : new RuntimeException(cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return UnitResult.timedOut(key, "Interrupted");
            }
        }
    }
}
