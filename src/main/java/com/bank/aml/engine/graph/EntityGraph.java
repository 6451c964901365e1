package com.bank.aml.engine.graph;

import com.bank.aml.model.Transaction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undirected multigraph of one batch: entities are nodes, each transaction is an
 * edge between its source and destination weighted by amount. Parallel edges are
 * kept so that every transaction stays addressable.
 *
 * Connected components come from a union-find with path compression, so the
 * partition does not depend on insertion order.
 */
class EntityGraph {

    private final Map<String, String> parent = new HashMap<>();
    private final Map<String, Integer> rank = new HashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    static EntityGraph of(List<Transaction> transactions) {
        EntityGraph graph = new EntityGraph();
        for (Transaction txn : transactions) {
            if (txn.getSourceEntity() == null || txn.getDestinationEntity() == null) continue;
            graph.addEdge(txn.getSourceEntity(), txn.getDestinationEntity(), txn.getTxnId(),
                    txn.getAmount() != null ? txn.getAmount() : BigDecimal.ZERO);
        }
        return graph;
    }

    void addEdge(String from, String to, String txnId, BigDecimal weight) {
        addNode(from);
        addNode(to);
        union(from, to);
        edges.add(new Edge(from, to, txnId, weight));
    }

    int nodeCount() {
        return parent.size();
    }

    int edgeCount() {
        return edges.size();
    }

    /**
     * Components keyed by their root entity, each with its member entities and edges.
     */
    Map<String, ConnectedComponent> components() {
        Map<String, ConnectedComponent> components = new LinkedHashMap<>();
        for (String node : parent.keySet()) {
            components.computeIfAbsent(find(node), k -> new ConnectedComponent()).nodes.add(node);
        }
        for (Edge edge : edges) {
            components.get(find(edge.from())).edges.add(edge);
        }
        return components;
    }

    private void addNode(String node) {
        if (parent.putIfAbsent(node, node) == null) {
            rank.put(node, 0);
        }
    }

    private String find(String node) {
        String root = node;
        while (!root.equals(parent.get(root))) {
            root = parent.get(root);
        }
        // Path compression
        String current = node;
        while (!current.equals(root)) {
            String next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    private void union(String a, String b) {
        String rootA = find(a);
        String rootB = find(b);
        if (rootA.equals(rootB)) return;

        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA < rankB) {
            parent.put(rootA, rootB);
        } else if (rankA > rankB) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootB, rootA);
            rank.put(rootA, rankA + 1);
        }
    }

    record Edge(String from, String to, String txnId, BigDecimal weight) {
    }

    static class ConnectedComponent {
        private final Set<String> nodes = new LinkedHashSet<>();
        private final List<Edge> edges = new ArrayList<>();

        Set<String> nodes() {
            return Collections.unmodifiableSet(nodes);
        }

        List<Edge> edges() {
            return Collections.unmodifiableList(edges);
        }

        BigDecimal totalWeight() {
            return edges.stream().map(Edge::weight).reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    }
}
