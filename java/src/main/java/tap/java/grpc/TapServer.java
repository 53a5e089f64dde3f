package tap.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.bypass.BypassEvaluator;
import tap.core.bypass.BypasserFactory;
import tap.core.checkers.CheckerChain;
import tap.core.checkers.CheckerFactory;
import tap.core.clock.Clock;
import tap.core.clock.SystemClock;
import tap.java.config.ServerOptions;
import tap.java.config.TapConfig;
import tap.java.engine.QuotaEngine;
import tap.java.funder.FundingEngine;
import tap.java.funder.FundingReconciler;
import tap.java.funder.LocalChainClient;
import tap.java.funder.ReconcileReport;
import tap.java.pipeline.PipelineCoordinator;
import tap.java.storage.QuotaJournal;
import tap.java.storage.WalQuotaJournal;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the faucet.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090) and JSON configuration</li>
 *   <li>Quota state journaled to disk when a storage dir is configured</li>
 *   <li>Background reaping of idle quota windows and reconciliation of
 *       timed-out transactions</li>
 *   <li>Graceful shutdown with timeout</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * java -jar tap-java.jar --port 8080 --config tap.json
 * java -jar tap-java.jar --config tap.json --validate-config
 * </pre>
 */
public final class TapServer {
    private static final Logger log = LoggerFactory.getLogger(TapServer.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final Duration RECONCILE_RECHECK_TIMEOUT = Duration.ofSeconds(1);

    private final TapConfig config;
    private final Clock clock;
    private final QuotaEngine quotaEngine;
    private final LocalChainClient chain;
    private final FundingEngine fundingEngine;
    private final FundingReconciler reconciler;
    private final PipelineCoordinator coordinator;
    private final ScheduledExecutorService maintenance;
    private final Server server;

    /**
     * Wires every component from the configuration. Recovers journaled quota
     * state before the server accepts requests.
     *
     * @param port Port to listen on, 0 for any free port
     * @param config Validated configuration
     */
    public TapServer(int port, TapConfig config) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        this.config = config;
        this.clock = SystemClock.instance();

        QuotaJournal journal = config.storageDir() == null
            ? QuotaJournal.NOOP
            : WalQuotaJournal.open(config.storageDir(), config.walRotateBytes(), config.snapshotEveryOps());
        this.quotaEngine = new QuotaEngine(journal, config.reservationLease().toNanos(), clock);

        this.chain = new LocalChainClient(clock);
        chain.fund(config.funder().fundingAccount(), config.chainInitialBalance());

        this.fundingEngine = FundingEngine.create(chain, quotaEngine, config.funder(), clock);
        fundingEngine.sequencer().initialize();
        this.reconciler = FundingReconciler.forEngine(chain, quotaEngine, fundingEngine, clock,
            RECONCILE_RECHECK_TIMEOUT);

        BypassEvaluator bypassEvaluator = BypasserFactory.evaluator(config.bypassers());
        CheckerChain checkerChain = CheckerFactory.chain(config.checkers(), quotaEngine);
        this.coordinator = new PipelineCoordinator(bypassEvaluator, checkerChain, fundingEngine,
            Executors.newFixedThreadPool(config.workerThreads()));

        this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tap-maintenance");
            t.setDaemon(true);
            return t;
        });

        this.server = ServerBuilder.forPort(port)
            .addService(ServerInterceptors.intercept(
                new FundingServiceImpl(coordinator, clock),
                new RemoteAddressInterceptor()))
            .build();
    }

    /**
     * Starts the server and the maintenance tasks.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        scheduleMaintenance();
        log.info("TapServer started on port {} (funding account {}, {} checkers, {} bypassers, storage {})",
            server.getPort(), config.funder().fundingAccount(), config.checkers().size(),
            config.bypassers().size(), config.storageDir() == null ? "in-memory" : config.storageDir());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down (JVM shutdown hook)...");
            try {
                TapServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted", e);
            }
        }));
    }

    private void scheduleMaintenance() {
        long reapMillis = config.reapInterval().toMillis();
        maintenance.scheduleWithFixedDelay(() -> {
            try {
                int reaped = quotaEngine.reap(clock.nowNanos());
                if (reaped > 0) {
                    log.debug("Reaped {} idle quota windows, {} remain", reaped, quotaEngine.size());
                }
            } catch (RuntimeException e) {
                log.error("Quota reap failed", e);
            }
        }, reapMillis, reapMillis, TimeUnit.MILLISECONDS);

        long reconcileMillis = config.reconcileInterval().toMillis();
        maintenance.scheduleWithFixedDelay(() -> {
            try {
                ReconcileReport report = reconciler.reconcileOnce();
                if (report.examined() > report.stillPending()) {
                    log.info("Reconciled ambiguous attempts: {} confirmed, {} failed, {} expired, {} still pending",
                        report.confirmed(), report.failed(), report.expired(), report.stillPending());
                }
            } catch (RuntimeException e) {
                log.error("Reconciliation pass failed", e);
            }
        }, reconcileMillis, reconcileMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the server gracefully, then the workers, then the journal.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (server.isTerminated()) {
            return;
        }
        server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        maintenance.shutdownNow();
        coordinator.close();
        quotaEngine.close();
        log.info("TapServer stopped.");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    /**
     * Main entry point.
     *
     * @param args see {@link ServerOptions#USAGE}
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        ServerOptions options;
        try {
            options = ServerOptions.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ServerOptions.USAGE);
            System.exit(2);
            return;
        }
        if (options.help()) {
            System.out.println(ServerOptions.USAGE);
            return;
        }

        TapConfig config;
        try {
            config = options.configPath() == null ? TapConfig.defaults() : TapConfig.fromJsonFile(options.configPath());
        } catch (RuntimeException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        if (options.validateOnly()) {
            log.info("Configuration {} is valid", options.configPath());
            return;
        }

        TapServer server = new TapServer(options.port(), config);
        server.start();
        server.blockUntilShutdown();
    }
}
