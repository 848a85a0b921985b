package com.flagship.payday.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CancelInvoiceRequest {

    @Size(max = 256, message = "Reason must be at most 256 characters")
    @JsonProperty("reason")
    String reason;
}
