package com.inboxai.credit_core.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Administrative credit adjustment, also the manual path for compensating a failed action.
 */
@Value
public class GrantCreditsRequest {

    @NotNull(message = "Amount is required")
    @Min(value = 1, message = "Amount must be positive")
    @Max(value = 1_000_000, message = "Amount is too large")
    @JsonProperty("amount")
    Integer amount;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;
}
