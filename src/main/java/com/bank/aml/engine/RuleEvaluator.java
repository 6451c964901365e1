package com.bank.aml.engine;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.TransactionBatch;

import java.util.Set;

/**
 * Interface for all batch detection rules.
 * Implementations are pure: no side effects, no dependence on evaluation order.
 */
public interface RuleEvaluator {

    /**
     * The tag recorded on alerts for transactions this rule flags.
     */
    RuleTag getSupportedRuleTag();

    /**
     * Evaluate the whole batch.
     *
     * @param batch  immutable snapshot shared by every rule of the pass
     * @param config thresholds and lists
     * @return ids of the flagged transactions
     */
    Set<String> evaluate(TransactionBatch batch, MonitoringConfig config);
}
