package io.allocations.service;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.zaxxer.hikari.HikariDataSource;
import io.allocations.admin.AdminServer;
import io.allocations.config.ReconcilerConfig;
import io.allocations.error.FailureSink;
import io.allocations.ledger.LedgerSchema;
import io.allocations.runtime.PassSummary;
import io.allocations.runtime.ReconciliationDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Command line entry point of the reconciliation service.
 */
@CommandLine.Command(name = "allocations", mixinStandardHelpOptions = true,
        description = "Reconcile allocation ledger usage with Slurm and enforce account limits",
        subcommands = {ReconcilerMain.Serve.class, ReconcilerMain.Reconcile.class, ReconcilerMain.InitSchema.class})
public final class ReconcilerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ReconcilerMain.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Supplier<ReconcilerConfig> config;
    private final Function<ReconcilerConfig, Module> modules;

    public ReconcilerMain() {
        this(ReconcilerConfig::fromEnv, ReconcilerModule::new);
    }

    public ReconcilerMain(Supplier<ReconcilerConfig> config, Function<ReconcilerConfig, Module> modules) {
        this.config = config;
        this.modules = modules;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ReconcilerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 2;
    }

    Injector injector() {
        return Guice.createInjector(modules.apply(config.get()));
    }

    @CommandLine.Command(name = "serve", description = "Run scheduled passes and the admin HTTP server until terminated")
    static final class Serve implements Callable<Integer> {
        @CommandLine.ParentCommand
        ReconcilerMain parent;

        @Override
        public Integer call() throws Exception {
            Injector injector = parent.injector();
            ReconcilerConfig cfg = injector.getInstance(ReconcilerConfig.class);
            ShutdownGate gate = new ShutdownGate(SHUTDOWN_TIMEOUT);
            try (HikariDataSource ds = injector.getInstance(HikariDataSource.class);
                 ReconciliationDriver driver = injector.getInstance(ReconciliationDriver.class);
                 AdminServer admin = new AdminServer(cfg.adminPort(), driver,
                         injector.getInstance(MetricRegistry.class), injector.getInstance(FailureSink.class))) {
                LedgerSchema.apply(ds);
                admin.start();
                driver.start(cfg.initialDelay(), cfg.interval());
                log.info("Reconciliation service up, admin server on port {}", admin.port());
                Runtime.getRuntime().addShutdownHook(gate.hook());
                gate.awaitStop();
                log.info("Shutting down");
            } finally {
                gate.closed();
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "reconcile", description = "Run one pass and print its summary; exits 1 if any unit failed")
    static final class Reconcile implements Callable<Integer> {
        @CommandLine.ParentCommand
        ReconcilerMain parent;

        @CommandLine.Option(names = {"-c", "--cluster"}, description = "Only reconcile this cluster")
        String cluster;

        @Override
        public Integer call() throws Exception {
            Injector injector = parent.injector();
            try (HikariDataSource ignored = injector.getInstance(HikariDataSource.class);
                 ReconciliationDriver driver = injector.getInstance(ReconciliationDriver.class)) {
                PassSummary summary;
                try {
                    summary = cluster == null ? driver.reconcileAll() : driver.reconcileCluster(cluster);
                } catch (IllegalArgumentException e) {
                    parent.spec.commandLine().getErr().println(e.getMessage());
                    return 2;
                }
                parent.spec.commandLine().getOut().println(summary.toJson());
                return summary.isSuccessful() ? 0 : 1;
            }
        }
    }

    @CommandLine.Command(name = "init-schema", description = "Create the ledger tables if they do not exist")
    static final class InitSchema implements Callable<Integer> {
        @CommandLine.ParentCommand
        ReconcilerMain parent;

        @Override
        public Integer call() throws Exception {
            try (HikariDataSource ds = parent.injector().getInstance(HikariDataSource.class)) {
                LedgerSchema.apply(ds);
            }
            parent.spec.commandLine().getOut().println("Ledger schema is up to date");
            return 0;
        }
    }
}
