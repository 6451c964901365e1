package com.bank.aml.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.aml.config.AerospikeConfig;
import com.bank.aml.exception.AlertWriteException;
import com.bank.aml.model.Alert;
import com.bank.aml.model.RiskLevel;
import com.bank.aml.model.RuleTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AlertRepositoryTest {

    private static final String NAMESPACE = "test";

    @Mock private AerospikeClient client;

    private AlertRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AlertRepository(client, NAMESPACE, new WritePolicy());
    }

    private static Alert alert(String txnId) {
        return Alert.builder()
                .alertId("A-" + txnId)
                .txnId(txnId)
                .alertType("high-value,high-risk-counterparty")
                .ruleTags(EnumSet.of(RuleTag.HIGH_VALUE, RuleTag.HIGH_RISK_COUNTERPARTY))
                .riskScore(80)
                .riskLevel(RiskLevel.HIGH)
                .createdAt(1_000L)
                .build();
    }

    @Test
    void insert_writesCreateOnlyKeyedByTxnId() {
        assertThat(repository.insert(alert("T1"))).isTrue();

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Key> key = ArgumentCaptor.forClass(Key.class);
        verify(client).put(policy.capture(), key.capture(), any(Bin[].class));
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);
        assertThat(key.getValue().setName).isEqualTo(AerospikeConfig.SET_ALERTS);
        assertThat(key.getValue().userKey.toString()).isEqualTo("T1");
    }

    @Test
    void insert_alertAlreadyExists_returnsFalse() {
        doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThat(repository.insert(alert("T1"))).isFalse();
    }

    @Test
    void insert_otherFailure_throwsAlertWriteException() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.insert(alert("T1")))
                .isInstanceOf(AlertWriteException.class)
                .satisfies(e -> assertThat(((AlertWriteException) e).getTxnId()).isEqualTo("T1"));
    }

    @Test
    void findCreatedSince_filtersAndOrdersByCreationTime() {
        Record late = alertRecord("A-2", "T2", 3_000L);
        Record early = alertRecord("A-1", "T1", 2_000L);
        Record tooOld = alertRecord("A-0", "T0", 500L);
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (Record r : List.of(late, early, tooOld)) {
                callback.scanCallback(new Key(NAMESPACE, AerospikeConfig.SET_ALERTS, r.getString("txnId")), r);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq(NAMESPACE), eq(AerospikeConfig.SET_ALERTS),
                any(ScanCallback.class));

        List<Alert> alerts = repository.findCreatedSince(1_000L);

        assertThat(alerts).extracting(Alert::getAlertId).containsExactly("A-1", "A-2");
        assertThat(alerts.get(0).getRuleTags())
                .containsExactlyInAnyOrder(RuleTag.HIGH_VALUE, RuleTag.ROUND_AMOUNT);
        assertThat(alerts.get(0).getRiskLevel()).isEqualTo(RiskLevel.MODERATE);
    }

    private static Record alertRecord(String alertId, String txnId, long createdAt) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("alertId", alertId);
        bins.put("txnId", txnId);
        bins.put("alertType", "high-value,round-amount");
        bins.put("ruleTags", "[\"high-value\",\"round-amount\"]");
        bins.put("riskScore", 40L);
        bins.put("riskLevel", "MODERATE");
        bins.put("createdAt", createdAt);
        return new Record(bins, 1, 0);
    }
}
