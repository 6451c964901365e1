package com.bank.aml.model;

import java.util.Arrays;

/**
 * Identifies which detection rule flagged a transaction.
 * The code is what gets persisted in the alert type.
 */
public enum RuleTag {
    HIGH_VALUE("high-value"),
    HIGH_RISK_COUNTERPARTY("high-risk-counterparty"),
    RAPID_SUCCESSION("rapid-succession"),
    ROUND_AMOUNT("round-amount"),
    HIGH_FREQUENCY("high-frequency"),
    NEW_COUNTERPARTY("new-counterparty"),
    CLUSTER_MEMBER("cluster-member");

    private final String code;

    RuleTag(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static RuleTag fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rule tag: " + code));
    }
}
