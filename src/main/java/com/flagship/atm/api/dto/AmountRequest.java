package com.flagship.atm.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Request DTO for deposits and withdrawals. The route decides the direction;
 * the amount is always a non-negative integer magnitude.
 */
@Value
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    Long amount;
}
