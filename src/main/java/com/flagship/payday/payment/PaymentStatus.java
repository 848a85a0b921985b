package com.flagship.payday.payment;

/**
 * Status of a payment aggregate.
 *
 * An empty stream (no events yet) has no status. The first event moves an incoming invoice to
 * AWAITING_PAYMENT and an outgoing payment to IN_FLIGHT.
 *
 * Transitions:
 * - AWAITING_PAYMENT → SETTLED / EXPIRED / FAILED / CANCELED
 * - IN_FLIGHT → SETTLED / FAILED
 * Terminal states never transition again.
 */
public enum PaymentStatus {
    /**
     * Invoice handed out, waiting for the payer.
     */
    AWAITING_PAYMENT,

    /**
     * Outgoing attempt recorded and submitted (or about to be submitted) to the node.
     */
    IN_FLIGHT,

    /**
     * Funds received (incoming) or delivered (outgoing).
     * Terminal state.
     */
    SETTLED,

    /**
     * Invoice expired before it was paid.
     * Terminal state.
     */
    EXPIRED,

    /**
     * Underpaid invoice or failed outgoing attempt; see {@link FailureReason}.
     * Terminal state.
     */
    FAILED,

    /**
     * Invoice withdrawn by the merchant.
     * Terminal state.
     */
    CANCELED;

    public boolean isTerminal() {
        return this == SETTLED || this == EXPIRED || this == FAILED || this == CANCELED;
    }
}
