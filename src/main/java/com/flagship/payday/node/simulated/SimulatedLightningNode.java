package com.flagship.payday.node.simulated;

import com.flagship.payday.node.DecodedPaymentRequest;
import com.flagship.payday.node.LightningNode;
import com.flagship.payday.node.NodeException;
import com.flagship.payday.node.NodeInvoice;
import com.flagship.payday.node.NodeSubscription;
import com.flagship.payday.node.PaymentAttempt;
import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.node.notification.InvoiceSettlementNotification;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.FailureReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process Lightning node for development and tests.
 *
 * Payment requests have the form {@code lnsim1:<hash>:<sats>:<expiresEpochSecond>:<destination>};
 * 0 sats means amountless. Payments succeed unless a failure was queued with
 * {@link #failNextCall(NodeException)} or {@link #nextPaymentOutcome(PaymentAttemptStatus, FailureReason)}.
 */
@Component
@ConditionalOnProperty(name = "payday.node.type", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedLightningNode implements LightningNode {

    private static final String PREFIX = "lnsim1";

    private final String nodeId;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, NodeInvoice> invoices = new HashMap<>();
    private final Map<String, PaymentAttempt> payments = new HashMap<>();
    private final List<InvoiceSettlementNotification> settlements = new ArrayList<>();
    private final List<Consumer<InvoiceSettlementNotification>> listeners = new CopyOnWriteArrayList<>();
    private final Deque<NodeException> queuedFailures = new ArrayDeque<>();
    private final Deque<PaymentAttempt> queuedOutcomes = new ArrayDeque<>();

    public SimulatedLightningNode(@Value("${payday.node.simulated.lightning-node-id:sim-lightning}") String nodeId,
                                  Clock clock) {
        this.nodeId = nodeId;
        this.clock = clock;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public NodeInvoice createInvoice(Amount amount, Duration expiry, String memo) {
        throwQueuedFailure();
        String hash = newHash();
        Instant expiresAt = clock.instant().plus(expiry);
        String request = String.join(":", PREFIX, hash, Long.toString(amount.value()),
            Long.toString(expiresAt.getEpochSecond()), nodeId);
        NodeInvoice invoice = new NodeInvoice(hash, request, amount, expiresAt);
        synchronized (lock) {
            invoices.put(hash, invoice);
        }
        log.debug("Simulated invoice created: hash={}, amount={}", hash, amount);
        return invoice;
    }

    @Override
    public DecodedPaymentRequest decodePaymentRequest(String paymentRequest) {
        String[] parts = paymentRequest != null ? paymentRequest.split(":") : new String[0];
        if (parts.length != 5 || !PREFIX.equals(parts[0])) {
            throw new NodeException(nodeId, "Invalid payment request: " + paymentRequest);
        }
        try {
            long sats = Long.parseLong(parts[2]);
            return new DecodedPaymentRequest(
                parts[1],
                sats > 0 ? Amount.sats(sats) : null,
                parts[4],
                null,
                Instant.ofEpochSecond(Long.parseLong(parts[3]))
            );
        } catch (NumberFormatException e) {
            throw new NodeException(nodeId, "Invalid payment request: " + paymentRequest, e);
        }
    }

    @Override
    public PaymentAttempt pay(String paymentRequest, Amount amount) {
        DecodedPaymentRequest decoded = decodePaymentRequest(paymentRequest);
        Amount toPay = decoded.getAmount() != null ? decoded.getAmount() : amount;
        if (toPay == null) {
            throw new NodeException(nodeId, "Amount required for amountless payment request");
        }

        PaymentAttempt attempt;
        synchronized (lock) {
            PaymentAttempt previous = payments.get(decoded.getPaymentHash());
            if (previous != null && previous.getStatus() == PaymentAttemptStatus.SUCCEEDED) {
                return previous;
            }

            PaymentAttempt queued = queuedOutcomes.poll();
            attempt = queued != null
                ? queued.toBuilder().paymentHash(decoded.getPaymentHash()).amount(toPay).build()
                : succeeded(decoded.getPaymentHash(), toPay);
            payments.put(decoded.getPaymentHash(), attempt);
        }

        // A queued failure still leaves the payment recorded, like a node that times out after sending
        throwQueuedFailure();
        return attempt;
    }

    @Override
    public PaymentAttempt getPaymentStatus(String paymentHash) {
        throwQueuedFailure();
        synchronized (lock) {
            PaymentAttempt attempt = payments.get(paymentHash);
            return attempt != null ? attempt : PaymentAttempt.unknown(paymentHash);
        }
    }

    @Override
    public NodeSubscription subscribeSettlements(long fromSettleIndex, Consumer<InvoiceSettlementNotification> listener) {
        List<InvoiceSettlementNotification> backlog;
        synchronized (lock) {
            backlog = settlements.stream()
                .filter(settlement -> settlement.getSettleIndex() > fromSettleIndex)
                .toList();
            listeners.add(listener);
        }
        backlog.forEach(listener);
        return new ListenerSubscription<>(listeners, listener);
    }

    // ==================== Simulation hooks ====================

    /**
     * Marks an invoice as paid with the given amount and notifies subscribers.
     */
    public InvoiceSettlementNotification settleInvoice(String paymentHash, Amount amount) {
        InvoiceSettlementNotification settlement;
        synchronized (lock) {
            if (!invoices.containsKey(paymentHash)) {
                throw new NodeException(nodeId, "Unknown invoice " + paymentHash);
            }
            settlement = InvoiceSettlementNotification.builder()
                .paymentHash(paymentHash)
                .amountSettled(amount)
                .settleIndex(settlements.size() + 1L)
                .settledAt(clock.instant())
                .build();
            settlements.add(settlement);
        }
        listeners.forEach(listener -> listener.accept(settlement));
        return settlement;
    }

    /**
     * Makes the next node call throw {@code failure}.
     */
    public void failNextCall(NodeException failure) {
        synchronized (lock) {
            queuedFailures.add(failure);
        }
    }

    /**
     * Makes the next {@link #pay} end with the given status instead of succeeding.
     */
    public void nextPaymentOutcome(PaymentAttemptStatus status, FailureReason reason) {
        synchronized (lock) {
            queuedOutcomes.add(PaymentAttempt.builder()
                .status(status)
                .failureReason(reason)
                .message(reason != null ? "simulated " + reason.name().toLowerCase() : null)
                .build());
        }
    }

    /**
     * Resolves a payment left in flight.
     */
    public void completePayment(String paymentHash, PaymentAttemptStatus status, FailureReason reason) {
        synchronized (lock) {
            PaymentAttempt current = payments.get(paymentHash);
            if (current == null) {
                throw new NodeException(nodeId, "Unknown payment " + paymentHash);
            }
            payments.put(paymentHash, current.toBuilder()
                .status(status)
                .failureReason(reason)
                .fee(status == PaymentAttemptStatus.SUCCEEDED ? fee(current.getAmount()) : null)
                .build());
        }
    }

    private void throwQueuedFailure() {
        NodeException failure;
        synchronized (lock) {
            failure = queuedFailures.poll();
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static PaymentAttempt succeeded(String paymentHash, Amount amount) {
        return PaymentAttempt.builder()
            .paymentHash(paymentHash)
            .status(PaymentAttemptStatus.SUCCEEDED)
            .amount(amount)
            .fee(fee(amount))
            .preimage(newHash())
            .build();
    }

    private static Amount fee(Amount amount) {
        return Amount.sats(amount != null ? amount.value() / 1000 : 0);
    }

    private static String newHash() {
        return (UUID.randomUUID().toString() + UUID.randomUUID()).replace("-", "");
    }
}
