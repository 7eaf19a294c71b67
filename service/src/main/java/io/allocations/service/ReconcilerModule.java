package io.allocations.service;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.allocations.config.ReconcilerConfig;
import io.allocations.error.FailureSink;
import io.allocations.error.FileFailureSink;
import io.allocations.ledger.AllocationLedger;
import io.allocations.ledger.JdbcAllocationLedger;
import io.allocations.retry.ExponentialBackoffRetryPolicy;
import io.allocations.runtime.ReconciliationDriver;
import io.allocations.runtime.ReconciliationDriverBuilder;
import io.allocations.slurm.CommandRunner;
import io.allocations.slurm.ProcessCommandRunner;
import io.allocations.slurm.SlurmUsageSources;
import io.allocations.source.SourceUnavailableException;
import io.allocations.source.UsageSourceFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

public class ReconcilerModule extends AbstractModule {
    private final ReconcilerConfig config;

    public ReconcilerModule(ReconcilerConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(ReconcilerConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton HikariDataSource hikariDataSource() {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("allocations-ledger");
        hc.setJdbcUrl(config.jdbcUrl());
        if (!config.jdbcUser().isEmpty()) hc.setUsername(config.jdbcUser());
        if (!config.jdbcPassword().isEmpty()) hc.setPassword(config.jdbcPassword());
        hc.setMaximumPoolSize(config.workers() + 2);
        hc.setAutoCommit(true);
        return new HikariDataSource(hc);
    }

    @Provides DataSource dataSource(HikariDataSource ds) { return ds; }

    @Provides @Singleton AllocationLedger ledger(DataSource ds) { return new JdbcAllocationLedger(ds); }

    @Provides @Singleton FailureSink failureSink() throws IOException { return new FileFailureSink(config.failureLog()); }

    // The process runner kills a command that overruns, so the call timeout is enforced there.
    @Provides @Singleton CommandRunner commandRunner() {
        Duration timeout = config.callTimeout().isZero() ? config.taskTimeout() : config.callTimeout();
        return new ProcessCommandRunner(timeout);
    }

    @Provides @Singleton UsageSourceFactory usageSources(CommandRunner runner) {
        return new SlurmUsageSources(runner, config.sacctmgr(), config.sshare());
    }

    @Provides @Singleton ReconciliationDriver driver(AllocationLedger ledger, UsageSourceFactory sources,
                                                      MetricRegistry registry, FailureSink failureSink) {
        return new ReconciliationDriverBuilder()
                .ledger(ledger)
                .sources(sources)
                .retry(new ExponentialBackoffRetryPolicy(config.retryAttempts(), config.retryBaseMillis(),
                        config.retryMaxMillis(), SourceUnavailableException.class::isInstance))
                .reservedAccounts(config.reservedAccounts())
                .clock(Clock.system(config.zone()))
                .workers(config.workers())
                .taskTimeout(config.taskTimeout())
                .metrics(registry)
                .failureSink(failureSink)
                .build();
    }
}
