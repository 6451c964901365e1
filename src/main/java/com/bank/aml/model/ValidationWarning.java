package com.bank.aml.model;

/**
 * Advisory finding about a malformed transaction. The transaction is still evaluated.
 */
public record ValidationWarning(String txnId, Reason reason, String field, String detail) {

    public enum Reason {
        NON_POSITIVE_AMOUNT,
        MISSING_FIELD
    }
}
