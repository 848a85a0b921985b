package com.flagship.payday.payment;

import com.flagship.payday.payment.event.InvoiceCanceled;
import com.flagship.payday.payment.event.InvoiceCreated;
import com.flagship.payday.payment.event.InvoiceExpired;
import com.flagship.payday.payment.event.InvoicePaymentDetected;
import com.flagship.payday.payment.event.InvoiceSettled;
import com.flagship.payday.payment.event.PaymentEvent;
import com.flagship.payday.payment.event.PaymentFailed;
import com.flagship.payday.payment.event.PaymentInFlight;
import com.flagship.payday.payment.event.PaymentInitiated;
import com.flagship.payday.payment.event.PaymentSucceeded;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * State machine of a payment aggregate.
 *
 * Pure: the next state depends only on the current state, the event and its sequence. The
 * same stream always replays to the same state.
 *
 * Each event is either applied, ignored (node-side duplicates and late notifications for an
 * invoice that already reached a terminal state) or rejected with
 * {@link InvalidTransitionException}.
 */
@Component
public class PaymentReducer {

    public Transition apply(PaymentAggregate state, PaymentEvent event, long sequence) {
        Objects.requireNonNull(event, "event");

        if (event instanceof InvoiceCreated created) {
            return applyInvoiceCreated(state, created, sequence);
        } else if (event instanceof InvoicePaymentDetected detected) {
            return applyPaymentDetected(state, detected, sequence);
        } else if (event instanceof InvoiceSettled settled) {
            return applyInvoiceSettled(state, settled, sequence);
        } else if (event instanceof InvoiceExpired expired) {
            return applyInvoiceExpired(state, expired, sequence);
        } else if (event instanceof InvoiceCanceled canceled) {
            return applyInvoiceCanceled(state, canceled, sequence);
        } else if (event instanceof PaymentInitiated initiated) {
            return applyPaymentInitiated(state, initiated, sequence);
        } else if (event instanceof PaymentInFlight inFlight) {
            return applyPaymentInFlight(state, inFlight, sequence);
        } else if (event instanceof PaymentSucceeded succeeded) {
            return applyPaymentSucceeded(state, succeeded, sequence);
        } else if (event instanceof PaymentFailed failed) {
            return applyPaymentFailed(state, failed, sequence);
        }
        throw invalid(state, event, sequence, "unknown event type");
    }

    // ==================== Incoming ====================

    private Transition applyInvoiceCreated(PaymentAggregate state, InvoiceCreated event, long sequence) {
        if (!state.isEmpty()) {
            throw invalid(state, event, sequence, "stream already exists");
        }
        requireBtc(state, event, sequence, event.getAmount());

        return Transition.applied(state.toBuilder()
            .direction(PaymentDirection.INCOMING)
            .method(event.getMethod())
            .status(PaymentStatus.AWAITING_PAYMENT)
            .amountRequested(event.getAmount())
            .amountSettled(Amount.zero(Currency.BTC))
            .amountPending(Amount.zero(Currency.BTC))
            .nodeId(event.getNodeId())
            .nodeReference(event.getNodeReference())
            .paymentRequest(event.getPaymentRequest())
            .memo(event.getMemo())
            .expiresAt(event.getExpiresAt())
            .createdAt(event.getCreatedAt())
            .version(sequence)
            .build());
    }

    private Transition applyPaymentDetected(PaymentAggregate state, InvoicePaymentDetected event, long sequence) {
        requireIncoming(state, event, sequence);
        if (state.getMethod() != SettlementMethod.ON_CHAIN) {
            throw invalid(state, event, sequence, "pending payments only exist on-chain");
        }
        requireBtc(state, event, sequence, event.getAmount());
        if (state.isTerminal()) {
            return Transition.ignored(state.atVersion(sequence),
                "payment detected for invoice already " + state.getStatus());
        }
        if (event.getTransactionId() != null && event.getTransactionId().equals(state.getTransactionId())) {
            return Transition.ignored(state.atVersion(sequence),
                "transaction " + event.getTransactionId() + " already detected");
        }

        return Transition.applied(state.toBuilder()
            .amountPending(event.getAmount())
            .transactionId(event.getTransactionId())
            .version(sequence)
            .build());
    }

    private Transition applyInvoiceSettled(PaymentAggregate state, InvoiceSettled event, long sequence) {
        requireIncoming(state, event, sequence);
        requireBtc(state, event, sequence, event.getAmountSettled());
        if (state.isTerminal()) {
            return Transition.ignored(state.atVersion(sequence),
                "settlement for invoice already " + state.getStatus());
        }

        Amount settled = event.getAmountSettled();
        Amount requested = state.getAmountRequested();
        PaymentAggregate.PaymentAggregateBuilder next = state.toBuilder()
            .amountSettled(settled)
            .amountPending(Amount.zero(Currency.BTC))
            .transactionId(event.getTransactionId() != null ? event.getTransactionId() : state.getTransactionId())
            .version(sequence);

        // Lightning has no partial settlement; an underpayment is a failure of the invoice
        if (settled.isLessThan(requested)) {
            return Transition.applied(next
                .status(PaymentStatus.FAILED)
                .failureReason(FailureReason.UNDERPAID)
                .failureMessage(String.format("Received %s of %s", settled, requested))
                .build());
        }

        return Transition.applied(next
            .status(PaymentStatus.SETTLED)
            .overpaid(settled.isGreaterThan(requested))
            .settledAt(event.getSettledAt())
            .build());
    }

    private Transition applyInvoiceExpired(PaymentAggregate state, InvoiceExpired event, long sequence) {
        requireIncoming(state, event, sequence);
        if (state.isTerminal()) {
            return Transition.ignored(state.atVersion(sequence),
                "expiry for invoice already " + state.getStatus());
        }
        if (state.getExpiresAt() != null && event.getExpiredAt().isBefore(state.getExpiresAt())) {
            throw invalid(state, event, sequence, "invoice expires at " + state.getExpiresAt());
        }

        return Transition.applied(state.toBuilder()
            .status(PaymentStatus.EXPIRED)
            .version(sequence)
            .build());
    }

    private Transition applyInvoiceCanceled(PaymentAggregate state, InvoiceCanceled event, long sequence) {
        requireIncoming(state, event, sequence);
        if (state.getStatus() != PaymentStatus.AWAITING_PAYMENT) {
            throw invalid(state, event, sequence, "only unpaid invoices can be canceled");
        }

        return Transition.applied(state.toBuilder()
            .status(PaymentStatus.CANCELED)
            .failureMessage(event.getReason())
            .version(sequence)
            .build());
    }

    // ==================== Outgoing ====================

    private Transition applyPaymentInitiated(PaymentAggregate state, PaymentInitiated event, long sequence) {
        if (!state.isEmpty()) {
            throw invalid(state, event, sequence, "stream already exists");
        }
        requireBtc(state, event, sequence, event.getAmount());

        return Transition.applied(state.toBuilder()
            .direction(PaymentDirection.OUTGOING)
            .method(event.getMethod())
            .status(PaymentStatus.IN_FLIGHT)
            .amountRequested(event.getAmount())
            .amountSettled(Amount.zero(Currency.BTC))
            .amountPending(Amount.zero(Currency.BTC))
            .paymentRequest(event.getPaymentRequest())
            .destination(event.getDestination())
            .nodeId(event.getNodeId())
            .nodeReference(event.getNodeReference())
            .createdAt(event.getInitiatedAt())
            .version(sequence)
            .build());
    }

    private Transition applyPaymentInFlight(PaymentAggregate state, PaymentInFlight event, long sequence) {
        requireOutgoingInFlight(state, event, sequence);

        PaymentAggregate.PaymentAggregateBuilder next = state.toBuilder()
            .nodeReference(event.getNodeReference())
            .version(sequence);
        if (state.getMethod() == SettlementMethod.ON_CHAIN) {
            next.transactionId(event.getNodeReference());
        }
        return Transition.applied(next.build());
    }

    private Transition applyPaymentSucceeded(PaymentAggregate state, PaymentSucceeded event, long sequence) {
        requireOutgoingInFlight(state, event, sequence);

        return Transition.applied(state.toBuilder()
            .status(PaymentStatus.SETTLED)
            .amountSettled(event.getAmount() != null ? event.getAmount() : state.getAmountRequested())
            .fee(event.getFee())
            .transactionId(event.getTransactionId() != null ? event.getTransactionId() : state.getTransactionId())
            .settledAt(event.getSettledAt())
            .version(sequence)
            .build());
    }

    private Transition applyPaymentFailed(PaymentAggregate state, PaymentFailed event, long sequence) {
        requireOutgoingInFlight(state, event, sequence);
        if (event.getReason() == FailureReason.UNDERPAID) {
            throw invalid(state, event, sequence, "UNDERPAID is not an outgoing failure reason");
        }

        return Transition.applied(state.toBuilder()
            .status(PaymentStatus.FAILED)
            .failureReason(event.getReason())
            .failureMessage(event.getMessage())
            .version(sequence)
            .build());
    }

    // ==================== Guards ====================

    private void requireIncoming(PaymentAggregate state, PaymentEvent event, long sequence) {
        if (state.isEmpty()) {
            throw invalid(state, event, sequence, "no invoice in this stream");
        }
        if (!state.isIncoming()) {
            throw invalid(state, event, sequence, "stream is an outgoing payment");
        }
    }

    private void requireOutgoingInFlight(PaymentAggregate state, PaymentEvent event, long sequence) {
        if (state.isEmpty()) {
            throw invalid(state, event, sequence, "no payment in this stream");
        }
        if (!state.isOutgoing()) {
            throw invalid(state, event, sequence, "stream is an incoming invoice");
        }
        if (state.getStatus() != PaymentStatus.IN_FLIGHT) {
            throw invalid(state, event, sequence, "payment is no longer in flight");
        }
    }

    private void requireBtc(PaymentAggregate state, PaymentEvent event, long sequence, Amount amount) {
        if (amount == null || !amount.isBtc()) {
            throw invalid(state, event, sequence, "invalid currency " + (amount != null ? amount.currency() : null));
        }
    }

    private static InvalidTransitionException invalid(PaymentAggregate state, PaymentEvent event,
                                                      long sequence, String detail) {
        return new InvalidTransitionException(state.getId(), sequence, event.getEventType(),
            state.getStatus(), detail);
    }
}
