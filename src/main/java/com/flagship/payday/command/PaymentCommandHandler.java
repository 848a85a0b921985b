package com.flagship.payday.command;

import com.flagship.payday.eventstore.ConcurrencyConflictException;
import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.node.DecodedPaymentRequest;
import com.flagship.payday.node.LightningNode;
import com.flagship.payday.node.NodeException;
import com.flagship.payday.node.NodeInvoice;
import com.flagship.payday.node.NodeTimeoutException;
import com.flagship.payday.node.OnChainNode;
import com.flagship.payday.node.PaymentAttempt;
import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.observability.CorrelationContext;
import com.flagship.payday.observability.PaymentMetrics;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.AppendResult;
import com.flagship.payday.payment.FailureReason;
import com.flagship.payday.payment.PaymentAggregate;
import com.flagship.payday.payment.PaymentAggregateRepository;
import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.payment.SettlementMethod;
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
import com.flagship.payday.reconcile.PaymentReferenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Validates commands against the replayed aggregate, talks to the node and appends the
 * resulting events.
 *
 * Commit ordering:
 * - Invoices: the node creates the invoice first, then the reference is registered, then
 *   InvoiceCreated is appended. A node failure leaves the stream untouched.
 * - Outgoing payments: PaymentInitiated is appended before the node is asked to pay, and only
 *   the writer that won that append calls the node. A crash after the node call leaves the
 *   payment IN_FLIGHT until recovery asks the node for its status.
 *
 * Every append runs in a bounded retry loop: on a concurrency conflict the aggregate is
 * reloaded and the decision made again. No lock is held across node calls or storage I/O.
 */
@Service
@Slf4j
public class PaymentCommandHandler {

    private final PaymentAggregateRepository repository;
    private final LightningNode lightningNode;
    private final OnChainNode onChainNode;
    private final PaymentReferenceService references;
    private final PaymentMetrics paymentMetrics;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration defaultExpiry;

    public PaymentCommandHandler(PaymentAggregateRepository repository,
                                 LightningNode lightningNode,
                                 OnChainNode onChainNode,
                                 PaymentReferenceService references,
                                 PaymentMetrics paymentMetrics,
                                 Clock clock,
                                 @Value("${payday.command.max-attempts:3}") int maxAttempts,
                                 @Value("${payday.invoice.default-expiry:PT1H}") Duration defaultExpiry) {
        this.repository = repository;
        this.lightningNode = lightningNode;
        this.onChainNode = onChainNode;
        this.references = references;
        this.paymentMetrics = paymentMetrics;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.defaultExpiry = defaultExpiry;
    }

    public CommandResult handle(PaymentCommand command) {
        return handle(command, EventMetadata.SOURCE_API);
    }

    /**
     * Handles a command on behalf of {@code source} (recorded in the event metadata).
     *
     * @throws CommandRejectedException if the command is not valid for the current state
     * @throws CommandConflictException if every append attempt lost to a concurrent writer
     * @throws com.flagship.payday.payment.InvalidTransitionException if the node reported an
     *         outcome that contradicts the recorded one
     * @throws NodeException if a node call needed before any append failed
     */
    public CommandResult handle(PaymentCommand command, String source) {
        if (command == null || command.getAggregateId() == null) {
            throw new CommandRejectedException("Command and aggregate id are required");
        }

        long startTime = System.currentTimeMillis();
        String commandName = command.getClass().getSimpleName();
        EventMetadata metadata = EventMetadata.of(CorrelationContext.currentId(), source);
        CorrelationContext.tagAggregate(command.getAggregateId());

        try {
            CommandResult result = dispatch(command, metadata);

            long duration = System.currentTimeMillis() - startTime;
            paymentMetrics.recordCommand(commandName, result.isNoop() ? "noop" : "applied", duration);
            result.getAppended().forEach(event -> paymentMetrics.recordEventAppended(event.getEventType()));
            if (result.isNoop()) {
                log.info("{} was a no-op: {}", commandName, result.getAnomaly());
            } else {
                log.info("{} handled: status={}, version={}, duration={}ms", commandName,
                    result.getState().getStatus(), result.getState().getVersion(), duration);
            }
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            paymentMetrics.recordCommand(commandName, outcomeOf(e), duration);
            log.warn("{} failed: error={}, duration={}ms", commandName, e.getMessage(), duration);
            throw e;
        } finally {
            CorrelationContext.untagAggregate();
        }
    }

    private CommandResult dispatch(PaymentCommand command, EventMetadata metadata) {
        if (command instanceof CreateInvoice createInvoice) {
            return createInvoice(createInvoice, metadata);
        } else if (command instanceof CancelInvoice cancelInvoice) {
            return cancelInvoice(cancelInvoice, metadata);
        } else if (command instanceof ExpireInvoice expireInvoice) {
            return expireInvoice(expireInvoice, metadata);
        } else if (command instanceof SettleInvoice settleInvoice) {
            return settleInvoice(settleInvoice, metadata);
        } else if (command instanceof RecordPendingPayment recordPendingPayment) {
            return recordPendingPayment(recordPendingPayment, metadata);
        } else if (command instanceof PayInvoice payInvoice) {
            return payInvoice(payInvoice, metadata);
        } else if (command instanceof RecordPaymentOutcome recordPaymentOutcome) {
            return appendWithRetry(recordPaymentOutcome.getAggregateId(), metadata,
                current -> decideOutcome(current, recordPaymentOutcome));
        }
        throw new CommandRejectedException("Unsupported command " + command.getClass().getSimpleName());
    }

    // ==================== Invoices ====================

    private CommandResult createInvoice(CreateInvoice command, EventMetadata metadata) {
        UUID id = command.getAggregateId();
        Amount amount = requirePositiveBtc(command.getAmount());
        if (command.getMethod() == null) {
            throw new CommandRejectedException("Settlement method is required");
        }
        Duration expiry = command.getExpiry() != null ? command.getExpiry() : defaultExpiry;
        if (expiry.isNegative() || expiry.isZero()) {
            throw new CommandRejectedException("Invoice expiry must be positive");
        }

        PaymentAggregate existing = repository.load(id);
        if (!existing.isEmpty()) {
            return CommandResult.noop(existing, "invoice already exists");
        }

        Instant now = clock.instant();
        InvoiceCreated.InvoiceCreatedBuilder event = InvoiceCreated.builder()
            .method(command.getMethod())
            .amount(amount)
            .memo(command.getMemo())
            .createdAt(now);

        String nodeId;
        String reference;
        if (command.getMethod() == SettlementMethod.LIGHTNING) {
            NodeInvoice invoice = timedNodeCall("create_invoice",
                () -> lightningNode.createInvoice(amount, expiry, command.getMemo()));
            nodeId = lightningNode.nodeId();
            reference = invoice.getPaymentHash();
            event.paymentRequest(invoice.getPaymentRequest()).expiresAt(invoice.getExpiresAt());
        } else {
            String address = timedNodeCall("new_address", onChainNode::newAddress);
            nodeId = onChainNode.nodeId();
            reference = address;
            event.paymentRequest(address).expiresAt(now.plus(expiry));
        }
        event.nodeId(nodeId).nodeReference(reference);

        registerReference(reference, id);

        InvoiceCreated created = event.build();
        CommandResult result = appendWithRetry(id, metadata.withNodeId(nodeId),
            current -> current.isEmpty() ? Decision.append(created) : Decision.noop("invoice already exists"));
        if (result.isNoop()) {
            log.warn("Lost the race to create invoice {}; node invoice {} stays unused", id, reference);
        }
        return result;
    }

    private CommandResult cancelInvoice(CancelInvoice command, EventMetadata metadata) {
        return appendWithRetry(command.getAggregateId(), metadata, current -> {
            requireIncoming(current);
            if (current.getStatus() == PaymentStatus.CANCELED) {
                return Decision.noop("invoice already canceled");
            }
            if (current.getStatus() != PaymentStatus.AWAITING_PAYMENT) {
                throw new CommandRejectedException(String.format(
                    "Cannot cancel invoice %s in %s status", current.getId(), current.getStatus()));
            }
            return Decision.append(InvoiceCanceled.builder()
                .reason(command.getReason())
                .canceledAt(clock.instant())
                .build());
        });
    }

    private CommandResult expireInvoice(ExpireInvoice command, EventMetadata metadata) {
        return appendWithRetry(command.getAggregateId(), metadata, current -> {
            requireIncoming(current);
            if (current.isTerminal()) {
                return Decision.noop("invoice already " + current.getStatus());
            }
            Instant now = clock.instant();
            if (current.getExpiresAt() != null && now.isBefore(current.getExpiresAt())) {
                throw new CommandRejectedException(String.format(
                    "Invoice %s does not expire until %s", current.getId(), current.getExpiresAt()));
            }
            return Decision.append(InvoiceExpired.builder().expiredAt(now).build());
        });
    }

    private CommandResult settleInvoice(SettleInvoice command, EventMetadata metadata) {
        Amount amount = requirePositiveBtc(command.getAmount());
        return appendWithRetry(command.getAggregateId(), metadata, current -> {
            requireIncoming(current);
            return Decision.append(InvoiceSettled.builder()
                .amountSettled(amount)
                .transactionId(command.getTransactionId())
                .settledAt(clock.instant())
                .build());
        });
    }

    private CommandResult recordPendingPayment(RecordPendingPayment command, EventMetadata metadata) {
        Amount amount = requirePositiveBtc(command.getAmount());
        return appendWithRetry(command.getAggregateId(), metadata, current -> {
            requireIncoming(current);
            if (current.getMethod() != SettlementMethod.ON_CHAIN) {
                throw new CommandRejectedException("Pending payments only apply to on-chain invoices");
            }
            return Decision.append(InvoicePaymentDetected.builder()
                .amount(amount)
                .transactionId(command.getTransactionId())
                .confirmations(command.getConfirmations())
                .detectedAt(clock.instant())
                .build());
        });
    }

    // ==================== Outgoing payments ====================

    private CommandResult payInvoice(PayInvoice command, EventMetadata metadata) {
        if (command.getMethod() == null) {
            throw new CommandRejectedException("Settlement method is required");
        }

        PaymentAggregate existing = repository.load(command.getAggregateId());
        if (!existing.isEmpty()) {
            return CommandResult.noop(existing, "payment already initiated");
        }

        return command.getMethod() == SettlementMethod.LIGHTNING
            ? payLightning(command, metadata.withNodeId(lightningNode.nodeId()))
            : payOnChain(command, metadata.withNodeId(onChainNode.nodeId()));
    }

    private CommandResult payLightning(PayInvoice command, EventMetadata metadata) {
        UUID id = command.getAggregateId();
        if (command.getPaymentRequest() == null || command.getPaymentRequest().isBlank()) {
            throw new CommandRejectedException("Payment request is required");
        }

        DecodedPaymentRequest decoded = decode(command.getPaymentRequest());
        Amount amount = resolveAmount(decoded, command.getAmount());
        Instant now = clock.instant();
        if (decoded.getExpiresAt() != null && !now.isBefore(decoded.getExpiresAt())) {
            throw new CommandRejectedException("Payment request expired at " + decoded.getExpiresAt());
        }

        claimPaymentHash(decoded.getPaymentHash(), id);

        PaymentInitiated initiated = PaymentInitiated.builder()
            .method(SettlementMethod.LIGHTNING)
            .amount(amount)
            .paymentRequest(command.getPaymentRequest())
            .destination(decoded.getDestination())
            .nodeId(lightningNode.nodeId())
            .nodeReference(decoded.getPaymentHash())
            .initiatedAt(now)
            .build();
        CommandResult initiatedResult = appendWithRetry(id, metadata, current -> current.isEmpty()
            ? Decision.append(initiated)
            : Decision.noop("payment already initiated"));
        if (initiatedResult.isNoop()) {
            return initiatedResult;
        }

        PaymentAttempt attempt = sendLightning(command.getPaymentRequest(), decoded.getPaymentHash(), amount);
        RecordPaymentOutcome outcome = RecordPaymentOutcome.builder()
            .aggregateId(id)
            .status(attempt.getStatus())
            .amount(attempt.getAmount() != null ? attempt.getAmount() : amount)
            .fee(attempt.getFee())
            .nodeReference(attempt.getPaymentHash())
            .failureReason(attempt.getFailureReason())
            .message(attempt.getMessage())
            .build();
        CommandResult outcomeResult = appendWithRetry(id, metadata, current -> decideOutcome(current, outcome));
        return merge(initiatedResult, outcomeResult);
    }

    private CommandResult payOnChain(PayInvoice command, EventMetadata metadata) {
        UUID id = command.getAggregateId();
        if (command.getDestination() == null || command.getDestination().isBlank()) {
            throw new CommandRejectedException("Destination address is required");
        }
        Amount amount = requirePositiveBtc(command.getAmount());

        PaymentInitiated initiated = PaymentInitiated.builder()
            .method(SettlementMethod.ON_CHAIN)
            .amount(amount)
            .destination(command.getDestination())
            .nodeId(onChainNode.nodeId())
            .initiatedAt(clock.instant())
            .build();
        CommandResult initiatedResult = appendWithRetry(id, metadata, current -> current.isEmpty()
            ? Decision.append(initiated)
            : Decision.noop("payment already initiated"));
        if (initiatedResult.isNoop()) {
            return initiatedResult;
        }

        RecordPaymentOutcome outcome;
        try {
            String txid = timedNodeCall("send", () -> onChainNode.send(command.getDestination(), amount));
            registerReference(txid, id);
            outcome = RecordPaymentOutcome.builder()
                .aggregateId(id)
                .status(PaymentAttemptStatus.IN_FLIGHT)
                .nodeReference(txid)
                .build();
        } catch (NodeException e) {
            log.warn("On-chain send for payment {} failed: {}", id, e.getMessage());
            outcome = failedOutcome(id, e);
        }

        RecordPaymentOutcome decided = outcome;
        CommandResult outcomeResult = appendWithRetry(id, metadata, current -> decideOutcome(current, decided));
        return merge(initiatedResult, outcomeResult);
    }

    private PaymentAttempt sendLightning(String paymentRequest, String paymentHash, Amount amount) {
        try {
            return timedNodeCall("pay", () -> lightningNode.pay(paymentRequest, amount));
        } catch (NodeException e) {
            log.warn("Lightning payment {} failed at the node, querying its status: {}", paymentHash, e.getMessage());
            try {
                PaymentAttempt status = timedNodeCall("get_payment_status", () -> lightningNode.getPaymentStatus(paymentHash));
                if (status.getStatus().isDefinitive() || status.getStatus() == PaymentAttemptStatus.IN_FLIGHT) {
                    return status;
                }
            } catch (NodeException statusError) {
                log.warn("Status query for payment {} failed: {}", paymentHash, statusError.getMessage());
            }
            return PaymentAttempt.builder()
                .paymentHash(paymentHash)
                .status(PaymentAttemptStatus.FAILED)
                .failureReason(e instanceof NodeTimeoutException ? FailureReason.TIMEOUT : FailureReason.NODE_ERROR)
                .message(e.getMessage())
                .build();
        }
    }

    private RecordPaymentOutcome failedOutcome(UUID id, NodeException e) {
        return RecordPaymentOutcome.builder()
            .aggregateId(id)
            .status(PaymentAttemptStatus.FAILED)
            .failureReason(e instanceof NodeTimeoutException ? FailureReason.TIMEOUT : FailureReason.NODE_ERROR)
            .message(e.getMessage())
            .build();
    }

    /**
     * Turns a node-reported outcome into the next event. Repeating an outcome that is already
     * recorded is a no-op; contradicting it reaches the reducer and is rejected there.
     */
    private Decision decideOutcome(PaymentAggregate current, RecordPaymentOutcome outcome) {
        if (current.isEmpty()) {
            throw new PaymentNotFoundException(current.getId());
        }
        if (!current.isOutgoing()) {
            throw new CommandRejectedException(String.format("Payment %s is an incoming invoice", current.getId()));
        }
        if (outcome.getStatus() == null) {
            throw new CommandRejectedException("Outcome status is required");
        }

        Instant now = clock.instant();
        switch (outcome.getStatus()) {
            case SUCCEEDED:
                if (current.getStatus() == PaymentStatus.SETTLED) {
                    return Decision.noop("payment already settled");
                }
                return Decision.append(PaymentSucceeded.builder()
                    .amount(outcome.getAmount() != null ? outcome.getAmount() : current.getAmountRequested())
                    .fee(outcome.getFee())
                    .transactionId(outcome.getTransactionId())
                    .settledAt(now)
                    .build());
            case FAILED:
                if (current.getStatus() == PaymentStatus.FAILED) {
                    return Decision.noop("payment already failed");
                }
                return Decision.append(PaymentFailed.builder()
                    .reason(outcome.getFailureReason() != null ? outcome.getFailureReason() : FailureReason.NODE_ERROR)
                    .message(outcome.getMessage())
                    .failedAt(now)
                    .build());
            case IN_FLIGHT:
                if (current.getStatus() != PaymentStatus.IN_FLIGHT) {
                    return Decision.noop("payment already " + current.getStatus());
                }
                if (outcome.getNodeReference() == null || outcome.getNodeReference().equals(current.getNodeReference())) {
                    return Decision.noop("payment already in flight");
                }
                return Decision.append(PaymentInFlight.builder()
                    .nodeReference(outcome.getNodeReference())
                    .submittedAt(now)
                    .build());
            default:
                return Decision.noop("node has no record of the payment");
        }
    }

    // ==================== Append loop ====================

    private CommandResult appendWithRetry(UUID id, EventMetadata metadata, Function<PaymentAggregate, Decision> decide) {
        for (int attempt = 1; ; attempt++) {
            PaymentAggregate current = repository.load(id);
            Decision decision = decide.apply(current);
            if (decision.isNoop()) {
                return CommandResult.noop(current, decision.getReason());
            }

            try {
                AppendResult result = repository.append(current, decision.getEvents(), metadata);
                if (result.isIgnored()) {
                    paymentMetrics.recordAnomaly(decision.getEvents().get(0).getEventType());
                    return CommandResult.noop(result.getState(), result.getAnomaly());
                }
                return CommandResult.applied(result.getState(), result.getStored());
            } catch (ConcurrencyConflictException e) {
                paymentMetrics.recordConcurrencyConflict();
                if (attempt >= maxAttempts) {
                    throw new CommandConflictException(id, attempt, e);
                }
                log.info("Concurrent write to payment {} (attempt {}/{}), reloading", id, attempt, maxAttempts);
            }
        }
    }

    private static CommandResult merge(CommandResult first, CommandResult second) {
        List<StoredEvent> appended = new ArrayList<>(first.getAppended());
        appended.addAll(second.getAppended());
        return CommandResult.applied(second.getState(), appended);
    }

    // ==================== Helpers ====================

    private DecodedPaymentRequest decode(String paymentRequest) {
        try {
            return timedNodeCall("decode_payment_request", () -> lightningNode.decodePaymentRequest(paymentRequest));
        } catch (NodeTimeoutException e) {
            throw e;
        } catch (NodeException e) {
            throw new CommandRejectedException("Invalid payment request: " + e.getMessage());
        }
    }

    private Amount resolveAmount(DecodedPaymentRequest decoded, Amount requested) {
        if (decoded.getAmount() == null) {
            if (requested == null) {
                throw new CommandRejectedException("Amount is required for an amountless payment request");
            }
            return requirePositiveBtc(requested);
        }
        if (requested != null && !requested.equals(decoded.getAmount())) {
            throw new CommandRejectedException(String.format(
                "Amount %s does not match the payment request amount %s", requested, decoded.getAmount()));
        }
        return requirePositiveBtc(decoded.getAmount());
    }

    /**
     * A payment hash belongs to one outgoing payment at a time. It can only be taken over
     * from a previous payment that failed.
     */
    private void claimPaymentHash(String paymentHash, UUID id) {
        UUID owner = references.register(paymentHash, id);
        if (owner.equals(id)) {
            return;
        }
        PaymentAggregate previous = repository.load(owner);
        if (previous.getStatus() == PaymentStatus.FAILED && references.reassign(paymentHash, owner, id)) {
            log.info("Retrying payment request of failed payment {} as payment {}", owner, id);
            return;
        }
        throw new CommandRejectedException(String.format(
            "Payment request is already being paid by payment %s", owner));
    }

    private void registerReference(String reference, UUID id) {
        UUID owner = references.register(reference, id);
        if (!owner.equals(id)) {
            throw new IllegalStateException(String.format(
                "Node reference %s already belongs to payment %s", reference, owner));
        }
    }

    private static Amount requirePositiveBtc(Amount amount) {
        if (amount == null) {
            throw new CommandRejectedException("Amount is required");
        }
        if (!amount.isBtc()) {
            throw new CommandRejectedException("Invalid currency: " + amount.currency());
        }
        if (amount.value() <= 0) {
            throw new CommandRejectedException("Amount must be positive");
        }
        return amount;
    }

    private static void requireIncoming(PaymentAggregate current) {
        if (current.isEmpty()) {
            throw new PaymentNotFoundException(current.getId());
        }
        if (!current.isIncoming()) {
            throw new CommandRejectedException(String.format("Payment %s is not an invoice", current.getId()));
        }
    }

    private <T> T timedNodeCall(String operation, Supplier<T> call) {
        long startTime = System.currentTimeMillis();
        try {
            T result = call.get();
            paymentMetrics.recordNodeCall(operation, "success", System.currentTimeMillis() - startTime);
            return result;
        } catch (NodeException e) {
            paymentMetrics.recordNodeCall(operation, e instanceof NodeTimeoutException ? "timeout" : "error",
                System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    private static String outcomeOf(RuntimeException e) {
        if (e instanceof CommandRejectedException) {
            return "rejected";
        } else if (e instanceof CommandConflictException) {
            return "conflict";
        } else if (e instanceof NodeException) {
            return "node_error";
        }
        return "error";
    }

    @lombok.Value
    private static class Decision {
        List<PaymentEvent> events;
        String reason;

        static Decision append(PaymentEvent event) {
            return new Decision(List.of(event), null);
        }

        static Decision noop(String reason) {
            return new Decision(List.of(), reason);
        }

        boolean isNoop() {
            return events.isEmpty();
        }
    }
}
