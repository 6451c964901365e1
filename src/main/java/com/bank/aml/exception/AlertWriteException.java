package com.bank.aml.exception;

public class AlertWriteException extends AmlMonitorException {

    private final String txnId;

    public AlertWriteException(String txnId, Throwable cause) {
        super("Failed to write alert for txn " + txnId, cause);
        this.txnId = txnId;
    }

    public String getTxnId() {
        return txnId;
    }
}
