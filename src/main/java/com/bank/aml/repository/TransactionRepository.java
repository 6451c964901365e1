package com.bank.aml.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.Txn;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.aml.config.AerospikeConfig;
import com.bank.aml.exception.ArchiveFailureException;
import com.bank.aml.exception.StorageUnavailableException;
import com.bank.aml.model.AssetClass;
import com.bank.aml.model.CounterpartyPair;
import com.bank.aml.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aerospike-backed {@link TransactionStore}. Mark-reviewed and archive moves run inside a
 * multi-record transaction, which requires a strong-consistency namespace.
 */
@Repository
public class TransactionRepository implements TransactionStore {

    private static final Logger log = LoggerFactory.getLogger(TransactionRepository.class);

    // Bin names are limited to 15 characters
    static final String BIN_TXN_ID = "txnId";
    static final String BIN_SOURCE = "source";
    static final String BIN_DEST = "dest";
    static final String BIN_AMOUNT = "amount";
    static final String BIN_TIMESTAMP = "timestamp";
    static final String BIN_JURISDICTION = "jurisdiction";
    static final String BIN_ASSET_CLASS = "assetClass";
    static final String BIN_TXN_TYPE = "txnType";
    static final String BIN_FEE = "fee";
    static final String BIN_REVIEWED = "reviewed";
    static final String BIN_ARCHIVED_AT = "archivedAt";

    static final Comparator<Transaction> FETCH_ORDER = Comparator
            .comparing(Transaction::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Transaction::getTxnId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final Clock clock;

    public TransactionRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 Clock clock) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.clock = clock;
    }

    @Override
    public void save(Transaction txn) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, txn.getTxnId());
        try {
            client.put(writePolicy, key, toBins(txn).toArray(new Bin[0]));
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Failed to save txn " + txn.getTxnId(), e);
        }
    }

    public Transaction findByTxnId(String txnId) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, txnId);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) return null;
            return mapRecord(record);
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Failed to read txn " + txnId, e);
        }
    }

    @Override
    public List<Transaction> fetchUnreviewed(int maxRows) {
        List<Transaction> results = new ArrayList<>();
        scanActive((key, record) -> {
            if (!record.getBoolean(BIN_REVIEWED)) {
                Transaction txn = mapRecord(record);
                synchronized (results) {
                    results.add(txn);
                }
            }
        });
        results.sort(FETCH_ORDER);
        if (maxRows > 0 && results.size() > maxRows) {
            log.info("{} unreviewed txns pending, fetching the oldest {}", results.size(), maxRows);
            return new ArrayList<>(results.subList(0, maxRows));
        }
        return results;
    }

    @Override
    public Set<CounterpartyPair> findReviewedCounterparties(Set<String> sourceEntities) {
        Set<CounterpartyPair> pairs = new HashSet<>();
        if (sourceEntities.isEmpty()) return pairs;

        scanActive((key, record) -> {
            if (!record.getBoolean(BIN_REVIEWED)) return;
            String source = record.getString(BIN_SOURCE);
            String dest = record.getString(BIN_DEST);
            if (source != null && dest != null && sourceEntities.contains(source)) {
                synchronized (pairs) {
                    pairs.add(new CounterpartyPair(source, dest));
                }
            }
        });
        return pairs;
    }

    @Override
    public void markReviewed(Set<String> txnIds) {
        if (txnIds.isEmpty()) return;

        Txn txn = new Txn();
        WritePolicy policy = txnWritePolicy(txn);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        try {
            for (String txnId : txnIds) {
                Key key = new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, txnId);
                client.operate(policy, key, Operation.put(new Bin(BIN_REVIEWED, true)));
            }
            client.commit(txn);
        } catch (AerospikeException e) {
            abort(txn);
            throw new StorageUnavailableException(
                    "Mark-reviewed of " + txnIds.size() + " txns rolled back", e);
        }
        log.debug("Committed reviewed flag for {} txns", txnIds.size());
    }

    @Override
    public int moveToArchive(long cutoffMillis, int chunkSize) {
        List<Transaction> expired = new ArrayList<>();
        scanActive((key, record) -> {
            Long timestamp = timestampOf(record);
            if (timestamp != null && timestamp < cutoffMillis) {
                Transaction txn = mapRecord(record);
                synchronized (expired) {
                    expired.add(txn);
                }
            }
        });
        if (expired.isEmpty()) return 0;

        expired.sort(FETCH_ORDER);
        int size = chunkSize > 0 ? chunkSize : expired.size();
        int moved = 0;
        for (int from = 0; from < expired.size(); from += size) {
            List<Transaction> chunk = expired.subList(from, Math.min(from + size, expired.size()));
            archiveChunk(chunk, cutoffMillis);
            moved += chunk.size();
            log.debug("Archived chunk of {} txns ({} of {})", chunk.size(), moved, expired.size());
        }
        return moved;
    }

    private void archiveChunk(List<Transaction> chunk, long cutoffMillis) {
        long archivedAt = clock.millis();
        Txn txn = new Txn();
        WritePolicy archivePolicy = txnWritePolicy(txn);
        archivePolicy.recordExistsAction = RecordExistsAction.REPLACE;
        WritePolicy deletePolicy = txnWritePolicy(txn);
        try {
            for (Transaction t : chunk) {
                List<Bin> bins = toBins(t);
                bins.add(new Bin(BIN_ARCHIVED_AT, archivedAt));
                client.put(archivePolicy,
                        new Key(namespace, AerospikeConfig.SET_TRANSACTIONS_ARCHIVE, t.getTxnId()),
                        bins.toArray(new Bin[0]));
                client.delete(deletePolicy,
                        new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, t.getTxnId()));
            }
            client.commit(txn);
        } catch (AerospikeException e) {
            abort(txn);
            throw new ArchiveFailureException(cutoffMillis, e);
        }
    }

    private void scanActive(ScanCallback callback) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRANSACTIONS, callback);
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Scan of " + AerospikeConfig.SET_TRANSACTIONS + " failed", e);
        }
    }

    private WritePolicy txnWritePolicy(Txn txn) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.txn = txn;
        return policy;
    }

    private void abort(Txn txn) {
        try {
            client.abort(txn);
        } catch (AerospikeException e) {
            // Best effort: the server expires an uncommitted transaction on its own.
            log.warn("Abort of transaction {} failed: {}", txn.getId(), e.getMessage());
        }
    }

    private List<Bin> toBins(Transaction txn) {
        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin(BIN_TXN_ID, txn.getTxnId()));
        bins.add(new Bin(BIN_REVIEWED, txn.isReviewed()));
        if (txn.getSourceEntity() != null) bins.add(new Bin(BIN_SOURCE, txn.getSourceEntity()));
        if (txn.getDestinationEntity() != null) bins.add(new Bin(BIN_DEST, txn.getDestinationEntity()));
        // Decimal amounts are stored as plain strings to keep exact values
        if (txn.getAmount() != null) bins.add(new Bin(BIN_AMOUNT, txn.getAmount().toPlainString()));
        if (txn.getTimestamp() != null) bins.add(new Bin(BIN_TIMESTAMP, txn.getTimestamp().longValue()));
        if (txn.getJurisdiction() != null) bins.add(new Bin(BIN_JURISDICTION, txn.getJurisdiction()));
        if (txn.getAssetClass() != null) bins.add(new Bin(BIN_ASSET_CLASS, txn.getAssetClass().name()));
        if (txn.getTxnType() != null) bins.add(new Bin(BIN_TXN_TYPE, txn.getTxnType()));
        if (txn.getFee() != null) bins.add(new Bin(BIN_FEE, txn.getFee().toPlainString()));
        return bins;
    }

    private Transaction mapRecord(Record record) {
        String assetClass = stringOf(record, BIN_ASSET_CLASS);
        return Transaction.builder()
                .txnId(stringOf(record, BIN_TXN_ID))
                .sourceEntity(stringOf(record, BIN_SOURCE))
                .destinationEntity(stringOf(record, BIN_DEST))
                .amount(decimalOf(record, BIN_AMOUNT))
                .timestamp(timestampOf(record))
                .jurisdiction(stringOf(record, BIN_JURISDICTION))
                .assetClass(assetClassOf(assetClass))
                .txnType(stringOf(record, BIN_TXN_TYPE))
                .fee(decimalOf(record, BIN_FEE))
                .reviewed(record.getBoolean(BIN_REVIEWED))
                .build();
    }

    private static AssetClass assetClassOf(String name) {
        if (name == null) return null;
        try {
            return AssetClass.valueOf(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown asset class {}, ignoring", name);
            return null;
        }
    }

    private static Long timestampOf(Record record) {
        Object value = record.getValue(BIN_TIMESTAMP);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    // Upstream writers may store ids as integers; anything else is unusable
    private static String stringOf(Record record, String bin) {
        Object value = record.getValue(bin);
        if (value == null || value instanceof String) return (String) value;
        if (value instanceof Number) return value.toString();
        log.warn("Unexpected {} in bin {}, ignoring", value.getClass().getSimpleName(), bin);
        return null;
    }

    private static BigDecimal decimalOf(Record record, String bin) {
        Object value = record.getValue(bin);
        if (value == null) return null;
        if (value instanceof Long || value instanceof Integer) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            String text = (String) value;
            if (text.isBlank()) return null;
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                log.warn("Unparseable decimal in bin {}: {}", bin, text);
                return null;
            }
        }
        log.warn("Unexpected {} in bin {}, ignoring", value.getClass().getSimpleName(), bin);
        return null;
    }
}
