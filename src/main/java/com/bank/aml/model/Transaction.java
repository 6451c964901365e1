package com.bank.aml.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A transfer awaiting (or having completed) one monitoring pass.
 * Amount and timestamp are nullable: malformed upstream rows still flow
 * through detection and only raise validation warnings.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    private String txnId;

    // Fiat: account id. Crypto: sending wallet address.
    private String sourceEntity;

    // Fiat: payee id. Crypto: receiving wallet address.
    private String destinationEntity;

    private BigDecimal amount;

    // Epoch millis
    private Long timestamp;

    // Country code (fiat) or network tag (crypto)
    private String jurisdiction;

    private AssetClass assetClass;

    // Fiat only, e.g. WIRE, ACH
    private String txnType;

    // Crypto only, network fee in USD
    private BigDecimal fee;

    private boolean reviewed;

    /**
     * Canonical key of the (source, destination) pairing, or null when either side is absent.
     */
    public CounterpartyPair getCounterpartyPair() {
        if (sourceEntity == null || destinationEntity == null) return null;
        return new CounterpartyPair(sourceEntity, destinationEntity);
    }
}
