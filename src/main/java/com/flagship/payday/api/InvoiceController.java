package com.flagship.payday.api;

import com.flagship.payday.api.dto.CancelInvoiceRequest;
import com.flagship.payday.api.dto.CreateInvoiceRequest;
import com.flagship.payday.api.dto.PaymentResponse;
import com.flagship.payday.command.CancelInvoice;
import com.flagship.payday.command.CommandResult;
import com.flagship.payday.command.CreateInvoice;
import com.flagship.payday.command.PaymentCommandHandler;
import com.flagship.payday.command.PaymentNotFoundException;
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

import java.time.Duration;
import java.util.UUID;

/**
 * REST controller for incoming payments (invoices).
 *
 * Creating an invoice requires an Idempotency-Key header: the invoice id is derived from it,
 * so a retried request returns the invoice created the first time (200 instead of 201).
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private static final String SCOPE = "invoice";

    private final PaymentCommandHandler commandHandler;
    private final PaymentAggregateRepository repository;
    private final PaymentMetrics paymentMetrics;

    @PostMapping
    public ResponseEntity<PaymentResponse> createInvoice(
            @Valid @RequestBody CreateInvoiceRequest request,
            @RequestHeader(IdempotencyKeys.HEADER) String idempotencyKey) {

        UUID id = IdempotencyKeys.aggregateId(SCOPE, idempotencyKey);
        log.info("Received invoice request: idempotencyKey={}, id={}, method={}, amount={} sats",
                idempotencyKey, id, request.getMethod(), request.getAmountSats());

        CommandResult result = commandHandler.handle(CreateInvoice.builder()
                .aggregateId(id)
                .method(request.getMethod())
                .amount(Amount.sats(request.getAmountSats()))
                .expiry(request.getExpirySeconds() != null ? Duration.ofSeconds(request.getExpirySeconds()) : null)
                .memo(request.getMemo())
                .build());

        if (result.isNoop()) {
            paymentMetrics.recordIdempotencyHit();
            return ResponseEntity.ok(PaymentResponse.from(result.getState()));
        }
        paymentMetrics.recordIdempotencyMiss();
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(result.getState()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getInvoice(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(loadInvoice(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<PaymentResponse> cancelInvoice(
            @PathVariable("id") UUID id,
            @Valid @RequestBody(required = false) CancelInvoiceRequest request) {

        loadInvoice(id);
        CommandResult result = commandHandler.handle(new CancelInvoice(id, request != null ? request.getReason() : null));
        return ResponseEntity.ok(PaymentResponse.from(result.getState()));
    }

    private PaymentAggregate loadInvoice(UUID id) {
        PaymentAggregate invoice = repository.load(id);
        if (invoice.isEmpty() || !invoice.isIncoming()) {
            throw new PaymentNotFoundException(id);
        }
        return invoice;
    }
}
