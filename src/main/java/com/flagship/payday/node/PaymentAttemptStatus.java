package com.flagship.payday.node;

/**
 * What the node knows about an outgoing payment.
 */
public enum PaymentAttemptStatus {
    SUCCEEDED,
    FAILED,
    IN_FLIGHT,
    /** The node has no record of the payment. */
    UNKNOWN;

    public boolean isDefinitive() {
        return this == SUCCEEDED || this == FAILED;
    }
}
