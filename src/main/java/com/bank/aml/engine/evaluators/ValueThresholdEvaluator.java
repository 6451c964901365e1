package com.bank.aml.engine.evaluators;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.engine.RuleEvaluator;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags transactions whose amount is strictly above the configured USD threshold.
 */
@Component
public class ValueThresholdEvaluator implements RuleEvaluator {

    @Override
    public RuleTag getSupportedRuleTag() {
        return RuleTag.HIGH_VALUE;
    }

    @Override
    public Set<String> evaluate(TransactionBatch batch, MonitoringConfig config) {
        return batch.transactions().stream()
                .filter(t -> t.getAmount() != null && t.getAmount().compareTo(config.getThresholdUsd()) > 0)
                .map(Transaction::getTxnId)
                .collect(Collectors.toSet());
    }
}
