package com.inboxai.credit_core.mailbox.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ConnectMailboxRequest {

    @NotBlank(message = "Email address is required")
    @Email(message = "Email address is invalid")
    @JsonProperty("email_address")
    String emailAddress;
}
