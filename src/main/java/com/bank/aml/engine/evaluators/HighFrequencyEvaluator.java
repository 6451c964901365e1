package com.bank.aml.engine.evaluators;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.engine.RuleEvaluator;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags every transaction of a source that sends more than the daily limit on one
 * calendar day (in the configured zone).
 */
@Component
public class HighFrequencyEvaluator implements RuleEvaluator {

    @Override
    public RuleTag getSupportedRuleTag() {
        return RuleTag.HIGH_FREQUENCY;
    }

    @Override
    public Set<String> evaluate(TransactionBatch batch, MonitoringConfig config) {
        ZoneId zone = config.getZone();
        int limit = config.getDailyFrequencyLimit();

        Map<SourceDay, List<Transaction>> groups = batch.transactions().stream()
                .filter(t -> t.getSourceEntity() != null && t.getTimestamp() != null)
                .collect(Collectors.groupingBy(t -> new SourceDay(t.getSourceEntity(),
                        LocalDate.ofInstant(Instant.ofEpochMilli(t.getTimestamp()), zone))));

        Set<String> flagged = new HashSet<>();
        for (List<Transaction> group : groups.values()) {
            if (group.size() > limit) {
                group.forEach(t -> flagged.add(t.getTxnId()));
            }
        }
        return flagged;
    }

    private record SourceDay(String sourceEntity, LocalDate day) {
    }
}
