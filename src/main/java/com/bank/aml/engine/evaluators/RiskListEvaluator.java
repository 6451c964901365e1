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
 * Flags transactions touching a high-risk entity.
 *
 * The risk list holds wallet addresses or account ids, and for fiat deployments the
 * sanctioned-country names as well, so a transaction matches when its source,
 * destination or jurisdiction is listed.
 */
@Component
public class RiskListEvaluator implements RuleEvaluator {

    @Override
    public RuleTag getSupportedRuleTag() {
        return RuleTag.HIGH_RISK_COUNTERPARTY;
    }

    @Override
    public Set<String> evaluate(TransactionBatch batch, MonitoringConfig config) {
        Set<String> riskList = config.getRiskList();
        if (riskList.isEmpty()) return Set.of();

        return batch.transactions().stream()
                .filter(t -> listed(riskList, t.getSourceEntity())
                        || listed(riskList, t.getDestinationEntity())
                        || listed(riskList, t.getJurisdiction()))
                .map(Transaction::getTxnId)
                .collect(Collectors.toSet());
    }

    private static boolean listed(Set<String> riskList, String value) {
        return value != null && riskList.contains(value);
    }
}
