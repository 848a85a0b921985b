package com.flagship.payday.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payday.payment.SettlementMethod;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for an outgoing payment.
 *
 * Lightning payments need {@code payment_request} ({@code amount_sats} only for amountless
 * requests); on-chain payments need {@code destination} and {@code amount_sats}.
 */
@Value
@Builder
@Jacksonized
public class PayInvoiceRequest {

    @NotNull(message = "Settlement method is required")
    @JsonProperty("method")
    SettlementMethod method;

    @JsonProperty("payment_request")
    String paymentRequest;

    @JsonProperty("destination")
    String destination;

    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount_sats")
    Long amountSats;
}
