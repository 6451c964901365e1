package com.bank.aml.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.aml.config.AerospikeConfig;
import com.bank.aml.exception.AlertWriteException;
import com.bank.aml.exception.StorageUnavailableException;
import com.bank.aml.model.Alert;
import com.bank.aml.model.RiskLevel;
import com.bank.aml.model.RuleTag;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Alerts keyed by transaction id and written create-only, so a transaction can
 * never carry two alerts even when a pass is retried.
 */
@Repository
public class AlertRepository implements AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createPolicy;
    private final ObjectMapper objectMapper;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.createPolicy = new WritePolicy(writePolicy);
        this.createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public boolean insert(Alert alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alert.getTxnId());

        Bin alertIdBin = new Bin("alertId", alert.getAlertId());
        Bin txnIdBin = new Bin("txnId", alert.getTxnId());
        Bin alertTypeBin = new Bin("alertType", alert.getAlertType());
        Bin ruleTagsBin = new Bin("ruleTags", serializeTags(alert.getTxnId(), alert.getRuleTags()));
        Bin scoreBin = new Bin("riskScore", alert.getRiskScore());
        Bin riskLevelBin = new Bin("riskLevel", alert.getRiskLevel().name());
        Bin createdAtBin = new Bin("createdAt", alert.getCreatedAt());

        try {
            client.put(createPolicy, key,
                    alertIdBin, txnIdBin, alertTypeBin, ruleTagsBin,
                    scoreBin, riskLevelBin, createdAtBin);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw new AlertWriteException(alert.getTxnId(), e);
        }
    }

    @Override
    public List<Alert> findCreatedSince(long sinceMillis) {
        List<Alert> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                    (key, record) -> {
                        if (record.getLong("createdAt") < sinceMillis) return;
                        try {
                            Alert alert = mapRecord(record);
                            synchronized (results) {
                                results.add(alert);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read alert record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Scan of " + AerospikeConfig.SET_ALERTS + " failed", e);
        }

        results.sort(Comparator.comparingLong(Alert::getCreatedAt)
                .thenComparing(Alert::getAlertId, Comparator.nullsLast(Comparator.naturalOrder())));
        return results;
    }

    private Alert mapRecord(Record record) {
        String riskLevel = record.getString("riskLevel");
        return Alert.builder()
                .alertId(record.getString("alertId"))
                .txnId(record.getString("txnId"))
                .alertType(record.getString("alertType"))
                .ruleTags(deserializeTags(record.getString("ruleTags")))
                .riskScore(record.getInt("riskScore"))
                .riskLevel(riskLevel != null ? RiskLevel.valueOf(riskLevel) : null)
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String serializeTags(String txnId, Set<RuleTag> tags) {
        List<String> codes = tags.stream().sorted().map(RuleTag::getCode).toList();
        try {
            return objectMapper.writeValueAsString(codes);
        } catch (JsonProcessingException e) {
            throw new AlertWriteException(txnId, e);
        }
    }

    private Set<RuleTag> deserializeTags(String json) {
        Set<RuleTag> tags = EnumSet.noneOf(RuleTag.class);
        if (json == null || json.isEmpty()) return tags;
        try {
            List<String> codes = objectMapper.readValue(json, new TypeReference<List<String>>() {});
            codes.forEach(code -> tags.add(RuleTag.fromCode(code)));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize rule tags: {}", json, e);
        }
        return tags;
    }
}
