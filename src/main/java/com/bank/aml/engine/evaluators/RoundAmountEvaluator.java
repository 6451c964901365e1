package com.bank.aml.engine.evaluators;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.engine.RuleEvaluator;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags amounts that are an exact multiple of the configured unit (e.g. 1000),
 * a common trait of structured cash movements.
 */
@Component
public class RoundAmountEvaluator implements RuleEvaluator {

    @Override
    public RuleTag getSupportedRuleTag() {
        return RuleTag.ROUND_AMOUNT;
    }

    @Override
    public Set<String> evaluate(TransactionBatch batch, MonitoringConfig config) {
        BigDecimal unit = config.getRoundAmountUnit();
        if (unit == null || unit.signum() <= 0) return Set.of();

        return batch.transactions().stream()
                .filter(t -> t.getAmount() != null && t.getAmount().remainder(unit).signum() == 0)
                .map(Transaction::getTxnId)
                .collect(Collectors.toSet());
    }
}
