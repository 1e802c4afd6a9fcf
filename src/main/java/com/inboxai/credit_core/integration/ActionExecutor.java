package com.inboxai.credit_core.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxai.credit_core.credit.ActionType;

import java.util.UUID;

/**
 * Runs one AI action (classification, drafting, research, workflow) on the AI worker.
 */
public interface ActionExecutor {

    JsonNode execute(ActionType actionType, UUID userId, UUID orgId, JsonNode input);
}
