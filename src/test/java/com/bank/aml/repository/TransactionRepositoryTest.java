package com.bank.aml.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.Txn;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.aml.config.AerospikeConfig;
import com.bank.aml.exception.ArchiveFailureException;
import com.bank.aml.exception.StorageUnavailableException;
import com.bank.aml.model.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionRepositoryTest {

    private static final String NAMESPACE = "test";
    private static final Instant NOW = Instant.parse("2026-04-15T12:00:00Z");

    @Mock private AerospikeClient client;

    private TransactionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new TransactionRepository(client, NAMESPACE, new Policy(), new WritePolicy(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Record record(String txnId, Long timestamp, boolean reviewed) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("txnId", txnId);
        bins.put("source", "ACC-1");
        bins.put("dest", "PAYEE-" + txnId);
        bins.put("amount", "1500.25");
        if (timestamp != null) bins.put("timestamp", timestamp);
        bins.put("assetClass", "FIAT");
        bins.put("reviewed", reviewed);
        return new Record(bins, 1, 0);
    }

    private void givenActiveRecords(Record... records) {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (Record r : records) {
                callback.scanCallback(new Key(NAMESPACE, AerospikeConfig.SET_TRANSACTIONS, String.valueOf(r.getValue("txnId"))), r);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq(NAMESPACE), eq(AerospikeConfig.SET_TRANSACTIONS),
                any(ScanCallback.class));
    }

    @Test
    void fetchUnreviewed_returnsUnreviewedInTimestampOrder() {
        givenActiveRecords(
                record("T2", 2000L, false),
                record("T9", null, false),
                record("T1", 1000L, false),
                record("T0", 500L, true));

        List<Transaction> result = repository.fetchUnreviewed(10);

        assertThat(result).extracting(Transaction::getTxnId).containsExactly("T1", "T2", "T9");
        assertThat(result.get(0).getAmount()).isEqualByComparingTo("1500.25");
        assertThat(result.get(2).getTimestamp()).isNull();
    }

    @Test
    void fetchUnreviewed_backlogAboveLimit_returnsOldestRows() {
        givenActiveRecords(
                record("T4", 4000L, false),
                record("T1", 1000L, false),
                record("T3", 3000L, false),
                record("T2", 2000L, false));

        assertThat(repository.fetchUnreviewed(2)).extracting(Transaction::getTxnId).containsExactly("T1", "T2");
    }

    @Test
    void fetchUnreviewed_numericBins_mappedWithoutFailing() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("txnId", "T1");
        bins.put("source", 4711L);
        bins.put("dest", "PAYEE-1");
        bins.put("amount", 1500L);
        bins.put("fee", 0.25d);
        bins.put("timestamp", 1000L);
        bins.put("assetClass", "GOLD");
        bins.put("reviewed", false);
        givenActiveRecords(new Record(bins, 1, 0));

        Transaction txn = repository.fetchUnreviewed(10).get(0);

        assertThat(txn.getSourceEntity()).isEqualTo("4711");
        assertThat(txn.getAmount()).isEqualByComparingTo("1500");
        assertThat(txn.getFee()).isEqualByComparingTo("0.25");
        assertThat(txn.getAssetClass()).isNull();
    }

    @Test
    void fetchUnreviewed_unparseableAmount_mappedAsMissing() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("txnId", "T1");
        bins.put("amount", "12,000");
        bins.put("timestamp", 1000L);
        bins.put("reviewed", false);
        givenActiveRecords(new Record(bins, 1, 0));

        assertThat(repository.fetchUnreviewed(10).get(0).getAmount()).isNull();
    }

    @Test
    void fetchUnreviewed_scanFails_storageUnavailable() {
        doAnswer(invocation -> {
            throw new AerospikeException(ResultCode.TIMEOUT, "timeout");
        }).when(client).scanAll(any(ScanPolicy.class), eq(NAMESPACE), eq(AerospikeConfig.SET_TRANSACTIONS),
                any(ScanCallback.class));

        assertThatThrownBy(() -> repository.fetchUnreviewed(10)).isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void findReviewedCounterparties_onlyReviewedPairsOfRequestedSources() {
        givenActiveRecords(record("T1", 1000L, true), record("T2", 1000L, false));

        assertThat(repository.findReviewedCounterparties(Set.of("ACC-1")))
                .extracting(p -> p.destinationEntity())
                .containsExactly("PAYEE-T1");
    }

    @Test
    void markReviewed_updatesEveryIdThenCommits() {
        repository.markReviewed(new LinkedHashSet<>(List.of("T1", "T2")));

        ArgumentCaptor<WritePolicy> policyCaptor = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client, times(2)).operate(policyCaptor.capture(), any(Key.class), any(Operation.class));
        WritePolicy policy = policyCaptor.getValue();
        assertThat(policy.txn).isNotNull();
        assertThat(policy.recordExistsAction).isEqualTo(RecordExistsAction.UPDATE_ONLY);
        verify(client).commit(policy.txn);
        verify(client, never()).abort(any(Txn.class));
    }

    @Test
    void markReviewed_writeFails_abortsAndThrows() {
        when(client.operate(any(WritePolicy.class), any(Key.class), any(Operation.class)))
                .thenReturn(null)
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"));

        assertThatThrownBy(() -> repository.markReviewed(new LinkedHashSet<>(List.of("T1", "T2"))))
                .isInstanceOf(StorageUnavailableException.class);

        verify(client).abort(any(Txn.class));
        verify(client, never()).commit(any(Txn.class));
    }

    @Test
    void markReviewed_emptySet_noWrites() {
        repository.markReviewed(Set.of());

        verify(client, never()).commit(any(Txn.class));
    }

    @Test
    void moveToArchive_copiesAndDeletesExpiredRowsInOneTransaction() {
        long cutoff = NOW.minusSeconds(86_400).toEpochMilli();
        givenActiveRecords(
                record("OLD", cutoff - 1, true),
                record("EDGE", cutoff, false),
                record("UNDATED", null, false));

        int moved = repository.moveToArchive(cutoff, 100);

        assertThat(moved).isEqualTo(1);
        ArgumentCaptor<Key> archiveKey = ArgumentCaptor.forClass(Key.class);
        verify(client).put(any(WritePolicy.class), archiveKey.capture(), any(Bin[].class));
        assertThat(archiveKey.getValue().setName).isEqualTo(AerospikeConfig.SET_TRANSACTIONS_ARCHIVE);
        assertThat(archiveKey.getValue().userKey.toString()).isEqualTo("OLD");

        ArgumentCaptor<WritePolicy> deletePolicy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Key> deleteKey = ArgumentCaptor.forClass(Key.class);
        verify(client).delete(deletePolicy.capture(), deleteKey.capture());
        assertThat(deleteKey.getValue().setName).isEqualTo(AerospikeConfig.SET_TRANSACTIONS);
        verify(client).commit(deletePolicy.getValue().txn);
    }

    @Test
    void moveToArchive_moreExpiredThanChunkSize_oneCommitPerChunk() {
        long cutoff = NOW.toEpochMilli();
        givenActiveRecords(
                record("OLD-3", cutoff - 1, true),
                record("OLD-1", cutoff - 3, false),
                record("OLD-2", cutoff - 2, true));

        int moved = repository.moveToArchive(cutoff, 2);

        assertThat(moved).isEqualTo(3);
        ArgumentCaptor<WritePolicy> deletePolicy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Key> deleteKey = ArgumentCaptor.forClass(Key.class);
        verify(client, times(3)).delete(deletePolicy.capture(), deleteKey.capture());
        assertThat(deleteKey.getAllValues()).extracting(k -> k.userKey.toString())
                .containsExactly("OLD-1", "OLD-2", "OLD-3");
        List<WritePolicy> policies = deletePolicy.getAllValues();
        assertThat(policies.get(0).txn).isSameAs(policies.get(1).txn);
        assertThat(policies.get(2).txn).isNotSameAs(policies.get(0).txn);
        verify(client).commit(policies.get(0).txn);
        verify(client).commit(policies.get(2).txn);
    }

    @Test
    void moveToArchive_laterChunkFails_earlierChunkStaysCommitted() {
        long cutoff = NOW.toEpochMilli();
        givenActiveRecords(
                record("OLD-1", cutoff - 3, false),
                record("OLD-2", cutoff - 2, false),
                record("OLD-3", cutoff - 1, false));
        when(client.delete(any(WritePolicy.class), any(Key.class)))
                .thenReturn(true)
                .thenReturn(true)
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"));

        assertThatThrownBy(() -> repository.moveToArchive(cutoff, 2)).isInstanceOf(ArchiveFailureException.class);

        verify(client, times(1)).commit(any(Txn.class));
        verify(client, times(1)).abort(any(Txn.class));
    }

    @Test
    void moveToArchive_nothingExpired_noTransaction() {
        givenActiveRecords(record("NEW", NOW.toEpochMilli(), false));

        assertThat(repository.moveToArchive(NOW.minusSeconds(60).toEpochMilli(), 100)).isZero();

        verify(client, never()).commit(any(Txn.class));
    }

    @Test
    void moveToArchive_deleteFails_abortsAndThrowsArchiveFailure() {
        long cutoff = NOW.toEpochMilli();
        givenActiveRecords(record("OLD", cutoff - 1, true));
        when(client.delete(any(WritePolicy.class), any(Key.class)))
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"));

        assertThatThrownBy(() -> repository.moveToArchive(cutoff, 100))
                .isInstanceOf(ArchiveFailureException.class)
                .satisfies(e -> assertThat(((ArchiveFailureException) e).getCutoffMillis()).isEqualTo(cutoff));

        verify(client).abort(any(Txn.class));
        verify(client, never()).commit(any(Txn.class));
    }
}
