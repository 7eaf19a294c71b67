package io.allocations.source;

import com.codahale.metrics.Meter;
import io.allocations.metrics.Metrics;
import io.allocations.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every call to the wrapped source by a timeout and retries the failures the policy accepts
 * (normally only {@link SourceUnavailableException}) with its backoff. A call that times out counts as
 * unavailable. {@link AccountNotFoundException} is passed through untouched. A zero timeout runs calls on the
 * caller's thread without a bound, and then no executor is needed.
 */
public class RetryingUsageSource implements UsageSource {
    private static final Logger log = LoggerFactory.getLogger(RetryingUsageSource.class);

    private final UsageSource delegate;
    private final RetryPolicy retryPolicy;
    private final Duration callTimeout;
    private final ExecutorService callExecutor;
    private final Meter retries;

    public RetryingUsageSource(UsageSource delegate, RetryPolicy retryPolicy, Duration callTimeout,
                               ExecutorService callExecutor, Metrics metrics) {
        this.delegate = Objects.requireNonNull(delegate);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.callTimeout = Objects.requireNonNull(callTimeout);
        this.callExecutor = callTimeout.isZero() ? callExecutor : Objects.requireNonNull(callExecutor, "callExecutor");
        this.retries = metrics.meter(Metrics.SOURCE_RETRIES);
    }

    /** Decorate every source the factory hands out. */
    public static UsageSourceFactory decorate(UsageSourceFactory factory, RetryPolicy retryPolicy, Duration callTimeout,
                                              ExecutorService callExecutor, Metrics metrics) {
        return cluster -> new RetryingUsageSource(factory.forCluster(cluster), retryPolicy, callTimeout, callExecutor, metrics);
    }

    @Override
    public String cluster() { return delegate.cluster(); }

    @Override
    public Set<String> listAccounts() throws UsageSourceException {
        return call("listAccounts", delegate::listAccounts);
    }

    @Override
    public long getUsage(String account) throws UsageSourceException {
        return call("getUsage(" + account + ")", () -> delegate.getUsage(account));
    }

    @Override
    public long getLimit(String account) throws UsageSourceException {
        return call("getLimit(" + account + ")", () -> delegate.getLimit(account));
    }

    @Override
    public void setLimit(String account, long limit) throws UsageSourceException {
        if (limit < 0) throw new IllegalArgumentException("Limit must not be negative: " + limit);
        call("setLimit(" + account + ", " + limit + ")", () -> {
            delegate.setLimit(account, limit);
            return null;
        });
    }

    @FunctionalInterface
    private interface SourceCall<T> {
        T call() throws UsageSourceException;
    }

    private <T> T call(String operation, SourceCall<T> call) throws UsageSourceException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return withTimeout(operation, call);
            } catch (UsageSourceException e) {
                if (Thread.currentThread().isInterrupted() || !retryPolicy.shouldRetry(attempt, e)) throw e;
                long backoff = retryPolicy.backoffMillis(attempt);
                retries.mark();
                log.warn("{} on cluster {} failed (attempt {}), retrying in {} ms: {}",
                        operation, delegate.cluster(), attempt, backoff, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    private <T> T withTimeout(String operation, SourceCall<T> call) throws UsageSourceException {
        if (callTimeout.isZero()) return call.call();
        Callable<T> task = call::call;
        Future<T> future = callExecutor.submit(task);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SourceUnavailableException(operation + " on cluster " + delegate.cluster() + " timed out after " + callTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(operation + " on cluster " + delegate.cluster() + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UsageSourceException use) throw use;
            if (cause instanceof RuntimeException re) throw re;
            throw new SourceUnavailableException(operation + " on cluster " + delegate.cluster() + " failed", cause);
        }
    }
}
