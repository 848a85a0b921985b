package com.flagship.payday.payment;

public enum PaymentDirection {
    /** Invoice issued by us, paid by someone else. */
    INCOMING,
    /** Payment sent by us. */
    OUTGOING
}
