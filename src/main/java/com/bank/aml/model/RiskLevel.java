package com.bank.aml.model;

public enum RiskLevel {
    MODERATE,
    HIGH;

    public static RiskLevel fromScore(int score, int highRiskThreshold) {
        return score >= highRiskThreshold ? HIGH : MODERATE;
    }
}
