package com.bank.aml.engine.evaluators;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.engine.RuleEvaluator;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detects bursts of transfers from the same source.
 *
 * Transactions are grouped by source entity and ordered by timestamp; one is flagged
 * when the gap to the previous transaction of the same source is below the configured
 * frequency gap. The first transaction of each source has no predecessor and is
 * never flagged. Rows without a source or timestamp cannot be placed and are ignored.
 */
@Component
public class RapidSuccessionEvaluator implements RuleEvaluator {

    private static final Comparator<Transaction> BY_TIME =
            Comparator.comparing(Transaction::getTimestamp);

    @Override
    public RuleTag getSupportedRuleTag() {
        return RuleTag.RAPID_SUCCESSION;
    }

    @Override
    public Set<String> evaluate(TransactionBatch batch, MonitoringConfig config) {
        long gapMillis = config.getFrequencyGap().toMillis();

        Map<String, List<Transaction>> bySource = batch.transactions().stream()
                .filter(t -> t.getSourceEntity() != null && t.getTimestamp() != null)
                .collect(Collectors.groupingBy(Transaction::getSourceEntity, LinkedHashMap::new, Collectors.toList()));

        Set<String> flagged = new HashSet<>();
        for (List<Transaction> txns : bySource.values()) {
            // Stable sort: equal timestamps keep batch order
            List<Transaction> ordered = txns.stream().sorted(BY_TIME).toList();
            for (int i = 1; i < ordered.size(); i++) {
                long gap = ordered.get(i).getTimestamp() - ordered.get(i - 1).getTimestamp();
                if (gap < gapMillis) {
                    flagged.add(ordered.get(i).getTxnId());
                }
            }
        }
        return flagged;
    }
}
