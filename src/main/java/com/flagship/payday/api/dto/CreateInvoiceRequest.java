package com.flagship.payday.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payday.payment.SettlementMethod;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for creating an invoice. Amounts are in satoshis.
 */
@Value
@Builder
@Jacksonized
public class CreateInvoiceRequest {

    @NotNull(message = "Settlement method is required")
    @JsonProperty("method")
    SettlementMethod method;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount_sats")
    Long amountSats;

    @Positive(message = "Expiry must be greater than 0")
    @JsonProperty("expiry_seconds")
    Long expirySeconds;

    @Size(max = 640, message = "Memo must be at most 640 characters")
    @JsonProperty("memo")
    String memo;
}
