package com.bank.aml.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One alert per flagged transaction. Never mutated once written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String alertId;

    private String txnId;

    // Comma-joined rule tag codes, e.g. "high-value,high-risk-counterparty"
    private String alertType;

    @Builder.Default
    private Set<RuleTag> ruleTags = EnumSet.noneOf(RuleTag.class);

    private int riskScore;

    private RiskLevel riskLevel;

    // Epoch millis
    private long createdAt;

    public static String alertTypeOf(Set<RuleTag> tags) {
        return tags.stream()
                .sorted()
                .map(RuleTag::getCode)
                .collect(Collectors.joining(","));
    }

    /**
     * Whether every field a downstream report generator relies on is populated.
     */
    public boolean isComplete() {
        return alertId != null && txnId != null && alertType != null
                && !alertType.isBlank() && riskLevel != null && createdAt > 0;
    }
}
