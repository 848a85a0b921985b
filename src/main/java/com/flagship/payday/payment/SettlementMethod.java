package com.flagship.payday.payment;

/**
 * How a payment settles: over the Lightning Network or with an on-chain transaction.
 */
public enum SettlementMethod {
    LIGHTNING,
    ON_CHAIN
}
