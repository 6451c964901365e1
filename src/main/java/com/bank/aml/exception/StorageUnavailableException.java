package com.bank.aml.exception;

/**
 * Connection or query failure against the transaction or alert store.
 * Recoverable: the pass is retried on the next interval.
 */
public class StorageUnavailableException extends AmlMonitorException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
