package com.bank.aml.exception;

/**
 * Base type for failures raised inside a monitoring pass.
 */
public class AmlMonitorException extends RuntimeException {

    public AmlMonitorException(String message) {
        super(message);
    }

    public AmlMonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
