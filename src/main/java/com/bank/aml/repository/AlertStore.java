package com.bank.aml.repository;

import com.bank.aml.model.Alert;

import java.util.List;

public interface AlertStore {

    /**
     * Inserts the alert unless one already exists for the same transaction.
     *
     * @return true if written, false if an alert for this transaction was already present
     * @throws com.bank.aml.exception.AlertWriteException on any other write failure
     */
    boolean insert(Alert alert);

    /**
     * Alerts created at or after {@code sinceMillis}, ordered by creation time then alert id.
     */
    List<Alert> findCreatedSince(long sinceMillis);
}
