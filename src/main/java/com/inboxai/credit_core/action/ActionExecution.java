package com.inboxai.credit_core.action;

import com.inboxai.credit_core.credit.ActionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The recorded outcome of one interactive action request, keyed by its Idempotency-Key.
 *
 * Created PENDING before any credit is spent and moved to exactly one finished status.
 */
@Value
@Builder(toBuilder = true)
public class ActionExecution {
    UUID id;
    String idempotencyKey;
    UUID userId;
    UUID orgId;
    ActionType actionType;
    ActionExecutionStatus status;
    int creditsUsed;
    Integer availableCredits;
    String result;              // raw JSON from the AI worker
    String errorMessage;
    Instant createdAt;
    Instant updatedAt;

    public static ActionExecution start(String idempotencyKey, UUID userId, UUID orgId,
                                        ActionType actionType, Instant now) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        return ActionExecution.builder()
            .id(UUID.randomUUID())
            .idempotencyKey(idempotencyKey)
            .userId(userId)
            .orgId(orgId)
            .actionType(actionType)
            .status(ActionExecutionStatus.PENDING)
            .creditsUsed(0)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean belongsTo(UUID userId, UUID orgId) {
        return this.userId.equals(userId) && this.orgId.equals(orgId);
    }

    public ActionExecution succeed(String result, int creditsUsed, int availableCredits, Instant now) {
        return finish(ActionExecutionStatus.SUCCEEDED, now)
            .result(result)
            .creditsUsed(creditsUsed)
            .availableCredits(availableCredits)
            .build();
    }

    public ActionExecution fail(String errorMessage, int creditsUsed, int availableCredits, Instant now) {
        return finish(ActionExecutionStatus.FAILED, now)
            .errorMessage(errorMessage)
            .creditsUsed(creditsUsed)
            .availableCredits(availableCredits)
            .build();
    }

    public ActionExecution reject(int availableCredits, Instant now) {
        return finish(ActionExecutionStatus.REJECTED, now)
            .errorMessage("Insufficient credits")
            .creditsUsed(0)
            .availableCredits(availableCredits)
            .build();
    }

    private ActionExecutionBuilder finish(ActionExecutionStatus target, Instant now) {
        if (status != ActionExecutionStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot move action execution %s from %s to %s", id, status, target));
        }
        return toBuilder().status(target).updatedAt(now);
    }
}
