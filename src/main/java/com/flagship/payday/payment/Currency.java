package com.flagship.payday.payment;

/**
 * Currencies an {@link Amount} can be expressed in.
 * Payments and invoices are always BTC; USD only appears on rejected requests.
 */
public enum Currency {
    BTC,
    USD
}
