package com.bank.aml.engine.graph;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.model.ClusterDetectionResult;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detects clusters of related transfers in a batch.
 *
 * Builds the batch's entity graph and flags every transaction inside a connected
 * component with more entities than {@code cluster-size-limit}. Batches above the
 * node (or edge) cap are not analysed at all: the result is empty and marked skipped.
 */
@Component
public class GraphClusterDetector {

    private static final Logger log = LoggerFactory.getLogger(GraphClusterDetector.class);

    private final MetricsConfig metricsConfig;

    public GraphClusterDetector(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    public ClusterDetectionResult detect(TransactionBatch batch, MonitoringConfig config) {
        List<Transaction> transactions = batch.transactions();

        int edgeCount = (int) transactions.stream()
                .filter(t -> t.getSourceEntity() != null && t.getDestinationEntity() != null)
                .count();
        if (config.getGraphEdgeLimit() > 0 && edgeCount > config.getGraphEdgeLimit()) {
            return skip(batch, String.format("%d edges exceed graph-edge-limit %d",
                    edgeCount, config.getGraphEdgeLimit()), countNodes(transactions), edgeCount);
        }

        int nodeCount = countNodes(transactions);
        if (nodeCount > config.getGraphNodeLimit()) {
            return skip(batch, String.format("%d nodes exceed graph-node-limit %d",
                    nodeCount, config.getGraphNodeLimit()), nodeCount, edgeCount);
        }

        EntityGraph graph = EntityGraph.of(transactions);
        Set<String> flagged = new HashSet<>();
        List<ClusterDetectionResult.Cluster> clusters = new ArrayList<>();

        for (EntityGraph.ConnectedComponent component : graph.components().values()) {
            if (component.nodes().size() <= config.getClusterSizeLimit()) continue;

            Set<String> txnIds = component.edges().stream()
                    .map(EntityGraph.Edge::txnId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            flagged.addAll(txnIds);
            clusters.add(ClusterDetectionResult.Cluster.builder()
                    .entities(component.nodes())
                    .txnIds(txnIds)
                    .totalAmount(component.totalWeight())
                    .build());

            log.info("Batch {}: cluster of {} entities over {} txns, total amount {}",
                    batch.batchId(), component.nodes().size(), txnIds.size(), component.totalWeight());
        }

        log.info("Batch {}: graph analysis over {} nodes / {} edges flagged {} cluster txns",
                batch.batchId(), graph.nodeCount(), graph.edgeCount(), flagged.size());

        return ClusterDetectionResult.builder()
                .flaggedTxnIds(flagged)
                .clusters(clusters)
                .skipped(false)
                .nodeCount(graph.nodeCount())
                .edgeCount(graph.edgeCount())
                .build();
    }

    private ClusterDetectionResult skip(TransactionBatch batch, String reason, int nodeCount, int edgeCount) {
        log.info("Batch {}: skipping graph analysis, {}", batch.batchId(), reason);
        metricsConfig.recordGraphSkipped();
        return ClusterDetectionResult.skipped(reason, nodeCount, edgeCount);
    }

    private static int countNodes(List<Transaction> transactions) {
        Set<String> nodes = new HashSet<>();
        for (Transaction t : transactions) {
            if (t.getSourceEntity() == null || t.getDestinationEntity() == null) continue;
            nodes.add(t.getSourceEntity());
            nodes.add(t.getDestinationEntity());
        }
        return nodes.size();
    }
}
