package com.inboxai.credit_core.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxai.credit_core.credit.ActionCostTable;
import com.inboxai.credit_core.credit.ActionExecutionException;
import com.inboxai.credit_core.credit.ActionGate;
import com.inboxai.credit_core.credit.ActionType;
import com.inboxai.credit_core.credit.GatedActionResult;
import com.inboxai.credit_core.credit.InsufficientCreditsException;
import com.inboxai.credit_core.integration.ActionExecutor;
import com.inboxai.credit_core.integration.IntegrationException;
import com.inboxai.credit_core.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs interactive AI actions through the {@link ActionGate}, at most once per Idempotency-Key.
 *
 * Steps for a new key:
 * 1. record a PENDING execution (the unique key rejects a concurrent duplicate)
 * 2. deduct and run the action through the gate
 * 3. record SUCCEEDED, FAILED or REJECTED
 *
 * A replayed key returns the recorded outcome, including a recorded failure, and never charges
 * again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionService {

    private final ActionGate actionGate;
    private final ActionExecutor actionExecutor;
    private final ActionCostTable costTable;
    private final ActionExecutionPersistenceService persistence;
    private final IdempotencyService idempotencyService;
    private final CreditMetrics creditMetrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @throws InsufficientCreditsException if the tenant cannot afford the action (or could not, on replay)
     * @throws ActionExecutionException if the action failed after charging (or did, on replay)
     * @throws IllegalStateException if the key is still being executed or belongs to another tenant
     */
    public ActionExecution execute(String idempotencyKey, UUID userId, UUID orgId,
                                   ActionType actionType, JsonNode input) {
        Optional<UUID> existingId = idempotencyService.findExecutionId(idempotencyKey);
        creditMetrics.recordIdempotencyLookup(existingId.isPresent());
        if (existingId.isPresent()) {
            ActionExecution existing = persistence.findById(existingId.get())
                .orElseThrow(() -> new IllegalStateException(
                    "Action execution found by idempotency key but not by ID: " + existingId.get()));
            return replay(existing, userId, orgId);
        }

        ActionExecution pending;
        try {
            pending = persistence.insert(ActionExecution.start(idempotencyKey, userId, orgId, actionType, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent request with the same idempotency key, replaying");
            ActionExecution existing = persistence.findByIdempotencyKey(idempotencyKey)
                .orElseThrow(() -> new IllegalStateException("Idempotency key conflict without a stored execution", e));
            return replay(existing, userId, orgId);
        }

        ActionExecution finished = run(pending, input);
        idempotencyService.remember(idempotencyKey, finished.getId());
        return finished;
    }

    private ActionExecution run(ActionExecution pending, JsonNode input) {
        ActionType actionType = pending.getActionType();
        GatedActionResult<JsonNode> result;
        try {
            result = actionGate.execute(pending.getUserId(), pending.getOrgId(), actionType,
                "AI action: " + actionType.code(),
                Map.of("execution_id", pending.getId().toString()),
                () -> actionExecutor.execute(actionType, pending.getUserId(), pending.getOrgId(), input));
        } catch (InsufficientCreditsException e) {
            persistence.update(pending.reject(e.getAvailableCredits(), clock.instant()));
            throw e;
        } catch (ActionExecutionException e) {
            String error = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            persistence.update(pending.fail(error, e.getCreditsUsed(), e.getAvailableCredits(), clock.instant()));
            throw e;
        } catch (RuntimeException e) {
            // Nothing was charged: free the key so the client can retry
            persistence.release(pending.getId());
            throw e;
        }

        ActionExecution succeeded = persistence.update(pending.succeed(
            toJson(result.getValue()), result.getCreditsUsed(), result.getAvailableCredits(), clock.instant()));
        log.info("Action {} succeeded: creditsUsed={}, available={}",
            actionType.code(), succeeded.getCreditsUsed(), succeeded.getAvailableCredits());
        return succeeded;
    }

    private ActionExecution replay(ActionExecution existing, UUID userId, UUID orgId) {
        if (!existing.belongsTo(userId, orgId)) {
            throw new IllegalStateException("Idempotency key already used by another tenant");
        }
        log.info("Idempotency key already used, replaying {} outcome of execution {}",
            existing.getStatus(), existing.getId());

        switch (existing.getStatus()) {
            case PENDING:
                throw new IllegalStateException("Action with this idempotency key is still in progress");
            case REJECTED:
                throw new InsufficientCreditsException(userId, orgId, existing.getActionType().code(),
                    costTable.costOf(existing.getActionType()), availableOrZero(existing));
            case FAILED:
                throw new ActionExecutionException(existing.getActionType(), existing.getCreditsUsed(),
                    availableOrZero(existing), new IntegrationException(existing.getErrorMessage()));
            default:
                return existing;
        }
    }

    private String toJson(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value != null ? value : objectMapper.nullNode());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize action result", e);
        }
    }

    private static int availableOrZero(ActionExecution execution) {
        return execution.getAvailableCredits() != null ? execution.getAvailableCredits() : 0;
    }
}
