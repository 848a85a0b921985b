package com.flagship.payday.node;

import com.flagship.payday.node.notification.InvoiceSettlementNotification;
import com.flagship.payday.payment.Amount;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Lightning node backend. Implementations wrap a vendor RPC client.
 *
 * All methods may throw {@link NodeException}; {@link NodeTimeoutException} when the outcome
 * is unknown.
 */
public interface LightningNode {

    String nodeId();

    NodeInvoice createInvoice(Amount amount, Duration expiry, String memo);

    /**
     * Decodes a payment request without side effects.
     */
    DecodedPaymentRequest decodePaymentRequest(String paymentRequest);

    /**
     * Pays a request. {@code amount} is required for amountless requests and ignored otherwise.
     */
    PaymentAttempt pay(String paymentRequest, Amount amount);

    /**
     * Current status of an outgoing payment, {@link PaymentAttemptStatus#UNKNOWN} if the node
     * never saw it.
     */
    PaymentAttempt getPaymentStatus(String paymentHash);

    /**
     * Delivers every settlement with a settle index greater than {@code fromSettleIndex}, then
     * new settlements as they happen.
     */
    NodeSubscription subscribeSettlements(long fromSettleIndex, Consumer<InvoiceSettlementNotification> listener);
}
