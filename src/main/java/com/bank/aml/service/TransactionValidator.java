package com.bank.aml.service;

import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionBatch;
import com.bank.aml.model.ValidationWarning;
import com.bank.aml.model.ValidationWarning.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Screens a batch for malformed rows. Purely advisory: nothing is removed from the
 * batch, flagged rows still go through every detection rule.
 */
@Component
public class TransactionValidator {

    private static final Logger log = LoggerFactory.getLogger(TransactionValidator.class);

    public List<ValidationWarning> validate(TransactionBatch batch) {
        List<ValidationWarning> warnings = new ArrayList<>();
        for (Transaction txn : batch.transactions()) {
            if (txn.getAmount() != null && txn.getAmount().signum() <= 0) {
                warnings.add(new ValidationWarning(txn.getTxnId(), Reason.NON_POSITIVE_AMOUNT, "amount",
                        "Invalid transaction amount: " + txn.getAmount().toPlainString()));
            }
            requirePresent(warnings, txn, "timestamp", txn.getTimestamp());
            requirePresent(warnings, txn, "amount", txn.getAmount());
            requirePresent(warnings, txn, "sourceEntity", txn.getSourceEntity());
            requirePresent(warnings, txn, "destinationEntity", txn.getDestinationEntity());
        }

        for (ValidationWarning w : warnings) {
            log.warn("Batch {}: txn {} {} ({})", batch.batchId(), w.txnId(), w.detail(), w.reason());
        }
        return warnings;
    }

    private static void requirePresent(List<ValidationWarning> warnings, Transaction txn, String field, Object value) {
        boolean missing = value == null || (value instanceof String && ((String) value).isBlank());
        if (missing) {
            warnings.add(new ValidationWarning(txn.getTxnId(), Reason.MISSING_FIELD, field,
                    "Missing " + field));
        }
    }
}
