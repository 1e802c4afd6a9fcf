package com.inboxai.credit_core.action.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ExecuteActionRequest {

    /** Action code, e.g. "email_classification". */
    @NotBlank(message = "Action type is required")
    @JsonProperty("action_type")
    String actionType;

    /** Passed through to the AI worker unchanged. */
    @JsonProperty("input")
    JsonNode input;
}
