package com.flagship.payment_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ReversePaymentRequest {

    @NotBlank(message = "Reversal reason is required")
    @Size(max = 500, message = "Reversal reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("reversed_by")
    String reversedBy;
}
