package com.bank.aml.service;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.engine.RuleEngine;
import com.bank.aml.exception.StorageUnavailableException;
import com.bank.aml.model.CounterpartyPair;
import com.bank.aml.model.DetectionResult;
import com.bank.aml.model.PassSummary;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import com.bank.aml.model.ValidationWarning;
import com.bank.aml.repository.TransactionStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Main orchestrator for one detection pass.
 *
 * Flow:
 * 1. Fetch the oldest unreviewed transactions, up to max-batch-size (plus known counterparties
 *    for the new-counterparty rule); a larger backlog drains over several passes
 * 2. Validate them; warnings are logged, no row is dropped
 * 3. Run every enabled rule and the graph detector over the same snapshot
 * 4. Score each flagged transaction from the tags it matched
 * 5. Record one alert per flagged transaction; a failed alert does not stop the batch
 * 6. Mark the whole batch reviewed, once, after all alerts
 *
 * Storage and rule failures propagate before step 6, leaving the batch unreviewed
 * for the next pass.
 */
@Service
public class TransactionMonitoringService {

    private static final Logger log = LoggerFactory.getLogger(TransactionMonitoringService.class);

    private final TransactionStore transactionStore;
    private final TransactionValidator validator;
    private final RuleEngine ruleEngine;
    private final RiskScoringService riskScoringService;
    private final AlertService alertService;
    private final MonitoringConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public TransactionMonitoringService(TransactionStore transactionStore,
                                        TransactionValidator validator,
                                        RuleEngine ruleEngine,
                                        RiskScoringService riskScoringService,
                                        AlertService alertService,
                                        MonitoringConfig config,
                                        MetricsConfig metricsConfig,
                                        Clock clock) {
        this.transactionStore = transactionStore;
        this.validator = validator;
        this.ruleEngine = ruleEngine;
        this.riskScoringService = riskScoringService;
        this.alertService = alertService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "monitor.pass", contextualName = "monitoring-pass")
    public PassSummary runPass() {
        long start = clock.millis();
        String batchId = UUID.randomUUID().toString();

        // 1. Fetch, oldest first, at most max-batch-size rows
        List<Transaction> transactions = transactionStore.fetchUnreviewed(config.getMaxBatchSize());
        if (transactions.isEmpty()) {
            log.info("Batch {}: no new transactions to process", batchId);
            metricsConfig.recordPass("empty", 0, clock.millis() - start);
            return PassSummary.empty(batchId);
        }
        TransactionBatch batch = new TransactionBatch(batchId, transactions, knownCounterparties(transactions));

        // 2. Validate (advisory)
        List<ValidationWarning> warnings = validator.validate(batch);
        if (!warnings.isEmpty()) {
            metricsConfig.recordValidationWarnings(warnings.size());
        }

        // 3. Detect
        DetectionResult detection = ruleEngine.evaluateAll(batch);

        // 4 + 5. Score and alert
        int recorded = 0;
        int failed = 0;
        for (Map.Entry<String, Set<RuleTag>> match : detection.getMatches().entrySet()) {
            int score = riskScoringService.score(match.getValue());
            if (alertService.recordAlert(batchId, match.getKey(), match.getValue(), score)) {
                recorded++;
            } else {
                failed++;
            }
        }

        // 6. Mark reviewed, flagged or not
        Set<String> batchIds = transactions.stream()
                .map(Transaction::getTxnId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        try {
            transactionStore.markReviewed(batchIds);
        } catch (StorageUnavailableException e) {
            // The loop logs it; the batch id is what ties the failure to this pass's alerts
            throw new StorageUnavailableException("Batch " + batchId + ": " + e.getMessage(), e);
        }

        long durationMs = clock.millis() - start;
        PassSummary summary = PassSummary.builder()
                .batchId(batchId)
                .batchSize(transactions.size())
                .validationWarnings(warnings.size())
                .flagged(detection.flaggedCount())
                .alertsRecorded(recorded)
                .alertFailures(failed)
                .markedReviewed(batchIds.size())
                .graphSkipped(detection.isGraphSkipped())
                .durationMs(durationMs)
                .build();

        metricsConfig.recordPass(failed > 0 ? "partial_alerts" : "success", transactions.size(), durationMs);
        log.info("Batch {}: {} txns, {} warnings, {} flagged, {} alerts recorded, {} alert failures, "
                        + "{} marked reviewed in {}ms",
                batchId, summary.getBatchSize(), summary.getValidationWarnings(), summary.getFlagged(),
                recorded, failed, summary.getMarkedReviewed(), durationMs);
        return summary;
    }

    private Set<CounterpartyPair> knownCounterparties(List<Transaction> transactions) {
        if (!config.isNewCounterpartyUsesHistory() || !config.isRuleEnabled(RuleTag.NEW_COUNTERPARTY)) {
            return Set.of();
        }
        Set<String> sources = transactions.stream()
                .map(Transaction::getSourceEntity)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return transactionStore.findReviewedCounterparties(sources);
    }
}
