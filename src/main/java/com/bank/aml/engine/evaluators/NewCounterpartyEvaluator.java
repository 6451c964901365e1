package com.bank.aml.engine.evaluators;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.engine.RuleEvaluator;
import com.bank.aml.model.CounterpartyPair;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Flags first-ever pairings: the (source, destination) pair occurs exactly once in the
 * visible history, i.e. once in the batch and, when history is enabled, never in
 * previously reviewed transactions.
 */
@Component
public class NewCounterpartyEvaluator implements RuleEvaluator {

    @Override
    public RuleTag getSupportedRuleTag() {
        return RuleTag.NEW_COUNTERPARTY;
    }

    @Override
    public Set<String> evaluate(TransactionBatch batch, MonitoringConfig config) {
        Map<CounterpartyPair, Long> pairCounts = batch.transactions().stream()
                .map(Transaction::getCounterpartyPair)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        Set<CounterpartyPair> known = config.isNewCounterpartyUsesHistory()
                ? batch.priorCounterparties()
                : Set.of();

        Set<String> flagged = new HashSet<>();
        for (Transaction txn : batch.transactions()) {
            CounterpartyPair pair = txn.getCounterpartyPair();
            if (pair != null && pairCounts.get(pair) == 1 && !known.contains(pair)) {
                flagged.add(txn.getTxnId());
            }
        }
        return flagged;
    }
}
