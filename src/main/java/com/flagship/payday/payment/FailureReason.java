package com.flagship.payday.payment;

/**
 * Why a payment ended in {@link PaymentStatus#FAILED}.
 */
public enum FailureReason {
    /** Incoming invoice settled for less than requested. */
    UNDERPAID,
    ROUTE_NOT_FOUND,
    INSUFFICIENT_BALANCE,
    TIMEOUT,
    NODE_ERROR
}
