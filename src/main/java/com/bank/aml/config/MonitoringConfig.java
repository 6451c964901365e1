package com.bank.aml.config;

import com.bank.aml.model.AssetClass;
import com.bank.aml.model.RuleTag;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "aml")
public class MonitoringConfig {

    // Which rule set this instance runs; profiles application-fiat / application-crypto set it.
    private AssetClass assetClass = AssetClass.FIAT;

    // Value threshold rule: flag amount strictly above this
    private BigDecimal thresholdUsd = new BigDecimal("10000");

    // Entity ids (accounts, wallet addresses) or jurisdiction codes considered high risk
    private Set<String> riskList = new HashSet<>();

    // Rapid succession: gap to the previous txn of the same source below this is flagged
    private Duration frequencyGap = Duration.ofMinutes(10);

    private BigDecimal roundAmountUnit = new BigDecimal("1000");

    // High frequency: more than this many txns per source per calendar day
    private int dailyFrequencyLimit = 10;

    // Calendar-day boundary for the daily frequency rule
    private ZoneId zone = ZoneId.of("UTC");

    // Graph analysis is skipped above this many distinct entities
    private int graphNodeLimit = 100;

    // Optional edge (transaction) cap for graph analysis; 0 disables it
    private int graphEdgeLimit = 0;

    // Components with more entities than this are suspicious clusters
    private int clusterSizeLimit = 5;

    // Whether pairings seen in already reviewed transactions count as known counterparties
    private boolean newCounterpartyUsesHistory = true;

    private int retentionDays = 30;

    // Upper bound on rows per pass and per archive commit, so every multi-record
    // transaction stays within the server's transaction duration and size limits
    private int maxBatchSize = 1000;

    private Duration pollInterval = Duration.ofSeconds(300);

    private Set<RuleTag> enabledRules = EnumSet.allOf(RuleTag.class);

    private Map<RuleTag, Integer> weights = defaultWeights();

    private int scoreCap = 100;

    // Alerts scoring at or above this are HIGH risk, otherwise MODERATE
    private int highRiskThreshold = 70;

    private Monitoring monitoring = new Monitoring();

    public int weightOf(RuleTag tag) {
        return weights.getOrDefault(tag, 0);
    }

    public boolean isRuleEnabled(RuleTag tag) {
        return enabledRules.contains(tag);
    }

    private static Map<RuleTag, Integer> defaultWeights() {
        Map<RuleTag, Integer> w = new EnumMap<>(RuleTag.class);
        w.put(RuleTag.HIGH_VALUE, 30);
        w.put(RuleTag.HIGH_RISK_COUNTERPARTY, 50);
        w.put(RuleTag.CLUSTER_MEMBER, 20);
        w.put(RuleTag.RAPID_SUCCESSION, 15);
        w.put(RuleTag.HIGH_FREQUENCY, 15);
        w.put(RuleTag.ROUND_AMOUNT, 10);
        w.put(RuleTag.NEW_COUNTERPARTY, 10);
        return w;
    }

    @Data
    public static class Monitoring {
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(5);
        // How long stop() waits for an in-flight pass before giving up
        private Duration shutdownTimeout = Duration.ofSeconds(60);
    }
}
