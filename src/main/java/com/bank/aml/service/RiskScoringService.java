package com.bank.aml.service;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.model.RiskLevel;
import com.bank.aml.model.RuleTag;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Additive risk score from the rule tags a transaction matched in the current pass.
 *
 * score = Σ weight(tag), clamped to [0, score-cap]; the cap never exceeds 100.
 * Cluster membership counts only when the transaction was flagged by the current
 * batch's graph analysis: the scorer never runs a detector itself.
 */
@Service
public class RiskScoringService {

    static final int MAX_SCORE = 100;

    private final MonitoringConfig config;

    public RiskScoringService(MonitoringConfig config) {
        this.config = config;
    }

    public int score(Set<RuleTag> matchedTags) {
        int total = 0;
        for (RuleTag tag : matchedTags) {
            total += config.weightOf(tag);
        }
        int cap = Math.max(0, Math.min(MAX_SCORE, config.getScoreCap()));
        return Math.max(0, Math.min(total, cap));
    }

    public RiskLevel riskLevelOf(int score) {
        return RiskLevel.fromScore(score, config.getHighRiskThreshold());
    }
}
