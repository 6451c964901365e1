package com.bank.aml.exception;

/**
 * The archive copy and delete could not be committed together. Nothing was applied.
 */
public class ArchiveFailureException extends AmlMonitorException {

    private final long cutoffMillis;

    public ArchiveFailureException(long cutoffMillis, Throwable cause) {
        super("Archive move with cutoff " + cutoffMillis + " was rolled back", cause);
        this.cutoffMillis = cutoffMillis;
    }

    public long getCutoffMillis() {
        return cutoffMillis;
    }
}
