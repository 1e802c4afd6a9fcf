package com.inboxai.credit_core.schedule.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CancelScheduleRequest {

    @Size(max = 500, message = "Reason is too long")
    @JsonProperty("reason")
    String reason;
}
