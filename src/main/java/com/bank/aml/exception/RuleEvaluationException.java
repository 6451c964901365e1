package com.bank.aml.exception;

import com.bank.aml.model.RuleTag;

/**
 * A rule evaluator failed, so the batch's rule set is incomplete and the pass is abandoned.
 */
public class RuleEvaluationException extends AmlMonitorException {

    private final RuleTag ruleTag;

    public RuleEvaluationException(RuleTag ruleTag, String batchId, Throwable cause) {
        super("Rule " + ruleTag.getCode() + " failed for batch " + batchId, cause);
        this.ruleTag = ruleTag;
    }

    public RuleTag getRuleTag() {
        return ruleTag;
    }
}
