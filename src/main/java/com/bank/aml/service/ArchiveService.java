package com.bank.aml.service;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.repository.TransactionStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Moves transactions past the retention window to the archive, regardless of review state.
 */
@Service
public class ArchiveService {

    private static final Logger log = LoggerFactory.getLogger(ArchiveService.class);

    private final TransactionStore transactionStore;
    private final MonitoringConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ArchiveService(TransactionStore transactionStore, MonitoringConfig config,
                          MetricsConfig metricsConfig, Clock clock) {
        this.transactionStore = transactionStore;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Archive every transaction older than {@code retentionDays}, committed in chunks of at
     * most max-batch-size rows. The cutoff is recomputed on each call, so a retry after a
     * rolled-back chunk re-checks the current window.
     *
     * @return number of transactions moved
     * @throws com.bank.aml.exception.ArchiveFailureException if a chunk was rolled back
     */
    @Observed(name = "monitor.archive", contextualName = "archive-old-transactions")
    public int archive(int retentionDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int moved = transactionStore.moveToArchive(cutoff.toEpochMilli(), config.getMaxBatchSize());

        if (moved > 0) {
            metricsConfig.recordArchived(moved);
        }
        log.info("Archived {} transactions older than {} days (cutoff {})", moved, retentionDays, cutoff);
        return moved;
    }
}
