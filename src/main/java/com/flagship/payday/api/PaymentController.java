package com.flagship.payday.api;

import com.flagship.payday.api.dto.EventResponse;
import com.flagship.payday.api.dto.PayInvoiceRequest;
import com.flagship.payday.api.dto.PaymentResponse;
import com.flagship.payday.command.CommandResult;
import com.flagship.payday.command.PayInvoice;
import com.flagship.payday.command.PaymentCommandHandler;
import com.flagship.payday.command.PaymentNotFoundException;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.observability.PaymentMetrics;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.PaymentAggregate;
import com.flagship.payday.payment.PaymentAggregateRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for outgoing payments, plus the event history of any payment.
 *
 * The node call happens inside the request. A 201 response can still be IN_FLIGHT; the final
 * outcome arrives through reconciliation.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String SCOPE = "payment";

    private final PaymentCommandHandler commandHandler;
    private final PaymentAggregateRepository repository;
    private final PaymentMetrics paymentMetrics;

    @PostMapping
    public ResponseEntity<PaymentResponse> payInvoice(
            @Valid @RequestBody PayInvoiceRequest request,
            @RequestHeader(IdempotencyKeys.HEADER) String idempotencyKey) {

        UUID id = IdempotencyKeys.aggregateId(SCOPE, idempotencyKey);
        log.info("Received payment request: idempotencyKey={}, id={}, method={}", idempotencyKey, id, request.getMethod());

        CommandResult result = commandHandler.handle(PayInvoice.builder()
                .aggregateId(id)
                .method(request.getMethod())
                .paymentRequest(request.getPaymentRequest())
                .destination(request.getDestination())
                .amount(request.getAmountSats() != null ? Amount.sats(request.getAmountSats()) : null)
                .build());

        if (result.isNoop()) {
            paymentMetrics.recordIdempotencyHit();
            return ResponseEntity.ok(PaymentResponse.from(result.getState()));
        }
        paymentMetrics.recordIdempotencyMiss();
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(result.getState()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("id") UUID id) {
        PaymentAggregate payment = repository.load(id);
        if (payment.isEmpty()) {
            throw new PaymentNotFoundException(id);
        }
        return ResponseEntity.ok(PaymentResponse.from(payment));
    }

    /**
     * Audit trail: every stored event of the payment, oldest first.
     */
    @GetMapping("/{id}/events")
    public ResponseEntity<List<EventResponse>> getEvents(@PathVariable("id") UUID id) {
        List<StoredEvent> history = repository.history(id);
        if (history.isEmpty()) {
            throw new PaymentNotFoundException(id);
        }
        return ResponseEntity.ok(history.stream().map(EventResponse::from).toList());
    }
}
