package com.bank.aml.repository;

import com.bank.aml.model.CounterpartyPair;
import com.bank.aml.model.Transaction;

import java.util.List;
import java.util.Set;

/**
 * Active transaction store plus its archive area.
 * Multi-record writes are all-or-nothing per call.
 */
public interface TransactionStore {

    /**
     * The oldest {@code maxRows} transactions with {@code reviewed=false}, ordered by timestamp
     * then id (rows without a timestamp last). Rows beyond the limit stay for later passes.
     *
     * @throws com.bank.aml.exception.StorageUnavailableException on connectivity or query failure
     */
    List<Transaction> fetchUnreviewed(int maxRows);

    /**
     * Pairings already present in reviewed active transactions sent by the given sources.
     */
    Set<CounterpartyPair> findReviewedCounterparties(Set<String> sourceEntities);

    /**
     * Marks every given transaction reviewed in one transaction. Either all ids are
     * marked or none is.
     *
     * @throws com.bank.aml.exception.StorageUnavailableException when the write was not committed
     */
    void markReviewed(Set<String> txnIds);

    /**
     * Copies every active transaction with {@code timestamp < cutoffMillis} to the archive
     * and deletes it from the active store, oldest first, committing at most {@code chunkSize}
     * rows per transaction. Each row is in exactly one of the two stores at any time.
     *
     * @return number of transactions moved
     * @throws com.bank.aml.exception.ArchiveFailureException when a chunk was rolled back;
     *         chunks committed before it stay archived
     */
    int moveToArchive(long cutoffMillis, int chunkSize);

    void save(Transaction txn);
}
