package com.bank.aml.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

@Value
@Builder
public class ClusterDetectionResult {

    Set<String> flaggedTxnIds;

    List<Cluster> clusters;

    boolean skipped;

    // Why analysis was skipped; null when it ran
    String skipReason;

    int nodeCount;

    int edgeCount;

    public static ClusterDetectionResult skipped(String reason, int nodeCount, int edgeCount) {
        return ClusterDetectionResult.builder()
                .flaggedTxnIds(Set.of())
                .clusters(List.of())
                .skipped(true)
                .skipReason(reason)
                .nodeCount(nodeCount)
                .edgeCount(edgeCount)
                .build();
    }

    /**
     * A connected component of the entity graph larger than the cluster-size limit.
     */
    @Value
    @Builder
    public static class Cluster {
        Set<String> entities;
        Set<String> txnIds;
        BigDecimal totalAmount;
    }
}
