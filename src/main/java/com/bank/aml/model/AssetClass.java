package com.bank.aml.model;

/**
 * Asset class of a monitored transaction. Decides how entity and jurisdiction
 * fields are read: account/payee and country code for FIAT, wallet addresses
 * and network tag for CRYPTO.
 */
public enum AssetClass {
    FIAT,
    CRYPTO
}
