package com.bank.aml.monitor;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.exception.ArchiveFailureException;
import com.bank.aml.exception.RuleEvaluationException;
import com.bank.aml.exception.StorageUnavailableException;
import com.bank.aml.service.ArchiveService;
import com.bank.aml.service.TransactionMonitoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Long-running supervisor: IDLE → RUNNING_PASS → SLEEPING → RUNNING_PASS … → SHUTTING_DOWN → STOPPED.
 *
 * A single worker thread runs the detection pass then the archiver, then sleeps for the
 * poll interval. Shutdown (context close, SIGINT/SIGTERM through the container's shutdown
 * hook) cancels the token: a sleep ends at once, an in-flight pass is allowed to finish.
 * The loop is stopped before the storage client bean is destroyed.
 */
@Component
@ConditionalOnProperty(prefix = "aml.monitoring", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MonitoringLoop implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MonitoringLoop.class);

    private final TransactionMonitoringService monitoringService;
    private final ArchiveService archiveService;
    private final MonitoringConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // Written only by the worker thread once started
    private volatile LoopState state = LoopState.IDLE;
    private volatile CancellationToken token;
    private volatile Thread worker;

    public MonitoringLoop(TransactionMonitoringService monitoringService,
                          ArchiveService archiveService,
                          MonitoringConfig config,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        this.monitoringService = monitoringService;
        this.archiveService = archiveService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (worker != null) return;

        token = new CancellationToken();
        worker = new Thread(() -> run(token), "aml-monitor");
        worker.start();
        log.info("Monitoring loop started: asset class {}, poll interval {}, retention {} days",
                config.getAssetClass(), config.getPollInterval(), config.getRetentionDays());
    }

    @Override
    public synchronized void stop() {
        Thread current = worker;
        if (current == null) return;

        log.info("Shutting down gracefully...");
        token.cancel();
        try {
            current.join(config.getMonitoring().getShutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.isAlive()) {
            log.warn("Monitoring pass still running after {}; leaving worker to finish",
                    config.getMonitoring().getShutdownTimeout());
        }
        worker = null;
    }

    @Override
    public boolean isRunning() {
        return worker != null;
    }

    public LoopState getState() {
        return state;
    }

    /**
     * One pass: detection then archive. Recoverable failures are logged and left for the
     * next interval; nothing a pass throws stops the loop.
     */
    public void runOnce() {
        try {
            monitoringService.runPass();
        } catch (StorageUnavailableException e) {
            metricsConfig.recordPass("storage_unavailable", 0, 0);
            log.warn("Transaction store unavailable, retrying next interval: {}", e.getMessage(), e);
        } catch (RuleEvaluationException e) {
            metricsConfig.recordPass("rule_failure", 0, 0);
            log.error("Rule {} failed, batch left unreviewed for the next pass: {}",
                    e.getRuleTag().getCode(), e.getMessage(), e);
        } catch (RuntimeException e) {
            metricsConfig.recordPass("error", 0, 0);
            log.error("Error processing transactions: {}", e.getMessage(), e);
        }

        try {
            archiveService.archive(config.getRetentionDays());
        } catch (ArchiveFailureException e) {
            metricsConfig.recordArchiveFailure();
            log.error("Archive move with cutoff {} rolled back, retrying next interval: {}",
                    Instant.ofEpochMilli(e.getCutoffMillis()), e.getMessage(), e);
        } catch (StorageUnavailableException e) {
            metricsConfig.recordArchiveFailure();
            log.warn("Archive skipped, transaction store unavailable: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            metricsConfig.recordArchiveFailure();
            log.error("Error archiving old transactions: {}", e.getMessage(), e);
        }

        log.info("Monitoring completed at {}", clock.instant());
    }

    private void run(CancellationToken cancellation) {
        try {
            if (cancellation.await(config.getMonitoring().getInitialDelay())) {
                return;
            }
            while (!cancellation.isCancelled()) {
                transition(LoopState.RUNNING_PASS);
                runOnce();

                if (cancellation.isCancelled()) break;
                transition(LoopState.SLEEPING);
                if (cancellation.await(config.getPollInterval())) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Monitoring loop interrupted. Exiting...");
        } finally {
            transition(LoopState.SHUTTING_DOWN);
            transition(LoopState.STOPPED);
            log.info("Monitoring loop stopped");
        }
    }

    private void transition(LoopState next) {
        log.debug("Monitoring loop {} -> {}", state, next);
        state = next;
        metricsConfig.updateLoopState(next.ordinal());
    }
}
