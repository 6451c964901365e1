package com.bank.aml.model;

import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot that every rule evaluator of a pass reads.
 *
 * @param batchId              identifier carried in log entries of the pass
 * @param transactions         unreviewed transactions, in stable fetch order
 * @param priorCounterparties  pairings already seen in reviewed transactions
 */
public record TransactionBatch(String batchId,
                               List<Transaction> transactions,
                               Set<CounterpartyPair> priorCounterparties) {

    public TransactionBatch {
        transactions = List.copyOf(transactions);
        priorCounterparties = Set.copyOf(priorCounterparties);
    }

    public static TransactionBatch of(String batchId, List<Transaction> transactions) {
        return new TransactionBatch(batchId, transactions, Set.of());
    }

    public int size() {
        return transactions.size();
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }
}
