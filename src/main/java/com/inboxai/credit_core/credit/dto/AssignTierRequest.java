package com.inboxai.credit_core.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class AssignTierRequest {

    @NotBlank(message = "Tier is required")
    @JsonProperty("tier")
    String tier;
}
