package com.bank.aml.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one detection pass, logged by the monitoring loop.
 */
@Value
@Builder
public class PassSummary {

    String batchId;

    int batchSize;

    int validationWarnings;

    int flagged;

    int alertsRecorded;

    int alertFailures;

    int markedReviewed;

    boolean graphSkipped;

    long durationMs;

    public static PassSummary empty(String batchId) {
        return PassSummary.builder().batchId(batchId).build();
    }
}
