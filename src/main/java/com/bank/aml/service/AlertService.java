package com.bank.aml.service;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.exception.AmlMonitorException;
import com.bank.aml.model.Alert;
import com.bank.aml.model.RiskLevel;
import com.bank.aml.model.RuleTag;
import com.bank.aml.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Persists alerts and serves them to downstream report generation.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertStore alertStore;
    private final RiskScoringService riskScoringService;
    private final TwilioNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertService(AlertStore alertStore,
                        RiskScoringService riskScoringService,
                        TwilioNotificationService notificationService,
                        MetricsConfig metricsConfig,
                        Clock clock) {
        this.alertStore = alertStore;
        this.riskScoringService = riskScoringService;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Record one alert for a flagged transaction.
     *
     * A write failure is logged and reported as {@code false}; it never propagates, so
     * the rest of the batch is still alerted and marked reviewed. An alert already on
     * file for the transaction (a retried pass) counts as recorded.
     *
     * @param batchId pass the transaction was flagged in, carried into every log entry
     */
    public boolean recordAlert(String batchId, String txnId, Set<RuleTag> matchedTags, int riskScore) {
        RiskLevel riskLevel = riskScoringService.riskLevelOf(riskScore);
        Alert alert = Alert.builder()
                .alertId(UUID.randomUUID().toString())
                .txnId(txnId)
                .alertType(Alert.alertTypeOf(matchedTags))
                .ruleTags(matchedTags.isEmpty() ? EnumSet.noneOf(RuleTag.class) : EnumSet.copyOf(matchedTags))
                .riskScore(riskScore)
                .riskLevel(riskLevel)
                .createdAt(clock.millis())
                .build();

        try {
            if (!alertStore.insert(alert)) {
                log.info("Batch {}: alert for txn {} already recorded, skipping", batchId, txnId);
                return true;
            }
        } catch (AmlMonitorException e) {
            metricsConfig.recordAlertFailure();
            log.error("Batch {}: failed to log alert for txn {}: {}", batchId, txnId, e.getMessage(), e);
            return false;
        }

        metricsConfig.recordAlert(riskLevel.name());
        log.info("Batch {}: alert logged for txn {}: {} ({} risk, score {})",
                batchId, txnId, alert.getAlertType(), riskLevel, riskScore);

        if (notificationService.shouldNotify(riskLevel)) {
            notificationService.notifyAlert(alert);
        }
        return true;
    }

    /**
     * Alerts created at or after {@code sinceMillis} whose required fields are all present,
     * in creation order. Incomplete records are left out rather than handed downstream.
     */
    public List<Alert> completeAlertsSince(long sinceMillis) {
        return alertStore.findCreatedSince(sinceMillis).stream()
                .filter(Alert::isComplete)
                .toList();
    }
}
