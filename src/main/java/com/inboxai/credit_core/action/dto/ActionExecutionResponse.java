package com.inboxai.credit_core.action.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.inboxai.credit_core.action.ActionExecution;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class ActionExecutionResponse {

    @JsonProperty("execution_id")
    UUID executionId;

    @JsonProperty("status")
    String status;

    @JsonProperty("action_type")
    String actionType;

    @JsonRawValue
    @JsonProperty("result")
    String result;

    @JsonProperty("credits_used")
    int creditsUsed;

    @JsonProperty("available_credits")
    Integer availableCredits;

    public static ActionExecutionResponse from(ActionExecution execution) {
        return ActionExecutionResponse.builder()
            .executionId(execution.getId())
            .status(execution.getStatus().name().toLowerCase())
            .actionType(execution.getActionType().code())
            .result(execution.getResult())
            .creditsUsed(execution.getCreditsUsed())
            .availableCredits(execution.getAvailableCredits())
            .build();
    }
}
