package com.bank.aml.service;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.model.RiskLevel;
import com.bank.aml.model.RuleTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RiskScoringServiceTest {

    private MonitoringConfig config;
    private RiskScoringService scoringService;

    @BeforeEach
    void setUp() {
        config = new MonitoringConfig();
        scoringService = new RiskScoringService(config);
    }

    @Test
    void score_noTags_isZero() {
        assertThat(scoringService.score(Set.of())).isZero();
    }

    @Test
    void score_highValueAndRiskList_isEighty() {
        int score = scoringService.score(EnumSet.of(RuleTag.HIGH_VALUE, RuleTag.HIGH_RISK_COUNTERPARTY));

        assertThat(score).isEqualTo(80);
        assertThat(scoringService.riskLevelOf(score)).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void score_singleRoundAmount_isModerate() {
        int score = scoringService.score(EnumSet.of(RuleTag.ROUND_AMOUNT));

        assertThat(score).isEqualTo(10);
        assertThat(scoringService.riskLevelOf(score)).isEqualTo(RiskLevel.MODERATE);
    }

    @Test
    void score_allTags_cappedAtHundred() {
        assertThat(scoringService.score(EnumSet.allOf(RuleTag.class))).isEqualTo(100);
    }

    @Test
    void score_clusterMembership_addsTwenty() {
        assertThat(scoringService.score(EnumSet.of(RuleTag.HIGH_VALUE, RuleTag.CLUSTER_MEMBER))).isEqualTo(50);
    }

    @Test
    void score_lowerConfiguredCap_applied() {
        config.setScoreCap(60);

        assertThat(scoringService.score(EnumSet.of(RuleTag.HIGH_VALUE, RuleTag.HIGH_RISK_COUNTERPARTY))).isEqualTo(60);
    }

    @Test
    void score_capAboveHundred_stillClampedToHundred() {
        config.setScoreCap(150);

        assertThat(scoringService.score(EnumSet.allOf(RuleTag.class))).isEqualTo(100);
    }

    @Test
    void score_negativeWeight_neverBelowZero() {
        config.getWeights().put(RuleTag.ROUND_AMOUNT, -40);

        assertThat(scoringService.score(EnumSet.of(RuleTag.ROUND_AMOUNT))).isZero();
    }

    @Test
    void riskLevelOf_thresholdIsInclusive() {
        assertThat(scoringService.riskLevelOf(69)).isEqualTo(RiskLevel.MODERATE);
        assertThat(scoringService.riskLevelOf(70)).isEqualTo(RiskLevel.HIGH);
    }
}
