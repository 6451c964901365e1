package com.bank.aml.engine;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.engine.graph.GraphClusterDetector;
import com.bank.aml.exception.RuleEvaluationException;
import com.bank.aml.model.ClusterDetectionResult;
import com.bank.aml.model.DetectionResult;
import com.bank.aml.model.RuleTag;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs every enabled rule over the same batch snapshot and unions the flagged sets.
 * Uses the Strategy pattern: each RuleTag is handled by a registered RuleEvaluator;
 * graph clustering runs alongside through {@link GraphClusterDetector}.
 *
 * Any rule failure aborts the whole evaluation: alerts are never derived from a
 * partial rule set.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<RuleTag, RuleEvaluator> evaluatorMap;
    private final GraphClusterDetector graphClusterDetector;
    private final MonitoringConfig config;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public RuleEngine(List<RuleEvaluator> evaluators, GraphClusterDetector graphClusterDetector,
                      MonitoringConfig config, Tracer tracer, MetricsConfig metricsConfig) {
        this.evaluatorMap = new EnumMap<>(RuleTag.class);
        this.graphClusterDetector = graphClusterDetector;
        this.config = config;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all evaluator implementations
        for (RuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedRuleTag(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedRuleTag(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate all enabled rules against the batch.
     *
     * @return txn id to matched rule tags, in batch order
     * @throws RuleEvaluationException if any rule fails
     */
    public DetectionResult evaluateAll(TransactionBatch batch) {
        Map<RuleTag, Set<String>> flaggedByRule = new EnumMap<>(RuleTag.class);

        for (Map.Entry<RuleTag, RuleEvaluator> entry : evaluatorMap.entrySet()) {
            RuleTag tag = entry.getKey();
            if (!config.isRuleEnabled(tag)) {
                continue;
            }
            flaggedByRule.put(tag, runTraced(tag, batch, () -> entry.getValue().evaluate(batch, config)));
        }

        ClusterDetectionResult clusterResult = null;
        if (config.isRuleEnabled(RuleTag.CLUSTER_MEMBER)) {
            clusterResult = runTraced(RuleTag.CLUSTER_MEMBER, batch,
                    () -> graphClusterDetector.detect(batch, config));
            flaggedByRule.put(RuleTag.CLUSTER_MEMBER, clusterResult.getFlaggedTxnIds());
        }

        return union(batch, flaggedByRule, clusterResult);
    }

    public Set<RuleTag> getRegisteredRuleTags() {
        return evaluatorMap.keySet();
    }

    private <T> T runTraced(RuleTag tag, TransactionBatch batch, Supplier<T> rule) {
        Span ruleSpan = tracer.nextSpan()
                .name("rule.evaluate." + tag.getCode())
                .tag("rule.tag", tag.getCode())
                .tag("batch.id", batch.batchId())
                .tag("batch.size", String.valueOf(batch.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
            return rule.get();
        } catch (RuntimeException e) {
            ruleSpan.error(e);
            log.error("Error evaluating rule {} for batch {}: {}", tag.getCode(), batch.batchId(), e.getMessage(), e);
            throw new RuleEvaluationException(tag, batch.batchId(), e);
        } finally {
            ruleSpan.end();
        }
    }

    private DetectionResult union(TransactionBatch batch, Map<RuleTag, Set<String>> flaggedByRule,
                                  ClusterDetectionResult clusterResult) {
        DetectionResult result = new DetectionResult();
        result.setClusterResult(clusterResult);

        // Invert rule -> ids into id -> rules, walking the batch so the result keeps batch order
        Set<String> seen = new HashSet<>();
        for (Transaction txn : batch.transactions()) {
            if (!seen.add(txn.getTxnId())) continue;
            for (Map.Entry<RuleTag, Set<String>> entry : flaggedByRule.entrySet()) {
                if (entry.getValue().contains(txn.getTxnId())) {
                    result.add(txn.getTxnId(), entry.getKey());
                }
            }
        }

        for (Map.Entry<RuleTag, Set<String>> entry : flaggedByRule.entrySet()) {
            int count = entry.getValue().size();
            if (count > 0) {
                metricsConfig.recordRuleFlagged(entry.getKey().getCode(), count);
                log.debug("Rule {} flagged {} txns in batch {}", entry.getKey().getCode(), count, batch.batchId());
            }
        }
        return result;
    }
}
