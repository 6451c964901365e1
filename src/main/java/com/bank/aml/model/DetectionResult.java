package com.bank.aml.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Union of every rule's flagged set for one batch, keyed by transaction id
 * in batch order. A transaction flagged by several rules appears once.
 */
public class DetectionResult {

    private final Map<String, Set<RuleTag>> matches = new LinkedHashMap<>();

    // Null when graph clustering is disabled
    private ClusterDetectionResult clusterResult;

    public void add(String txnId, RuleTag tag) {
        matches.computeIfAbsent(txnId, k -> EnumSet.noneOf(RuleTag.class)).add(tag);
    }

    public Map<String, Set<RuleTag>> getMatches() {
        return Collections.unmodifiableMap(matches);
    }

    public Set<RuleTag> tagsFor(String txnId) {
        Set<RuleTag> tags = matches.get(txnId);
        return tags == null ? EnumSet.noneOf(RuleTag.class) : Collections.unmodifiableSet(tags);
    }

    public boolean isFlagged(String txnId) {
        return matches.containsKey(txnId);
    }

    public ClusterDetectionResult getClusterResult() {
        return clusterResult;
    }

    public void setClusterResult(ClusterDetectionResult clusterResult) {
        this.clusterResult = clusterResult;
    }

    public boolean isGraphSkipped() {
        return clusterResult != null && clusterResult.isSkipped();
    }

    public int flaggedCount() {
        return matches.size();
    }
}
