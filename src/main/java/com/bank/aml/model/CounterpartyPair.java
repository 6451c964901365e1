package com.bank.aml.model;

/**
 * Directed (source, destination) pairing used by the new-counterparty rule.
 */
public record CounterpartyPair(String sourceEntity, String destinationEntity) {
}
