package com.inboxai.credit_core.action;

import com.inboxai.credit_core.credit.ActionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "action_executions")
@Getter
@Setter
@NoArgsConstructor
public class ActionExecutionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "action_type", nullable = false, length = 50, updatable = false)
    private String actionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ActionExecutionStatus status;

    @Column(name = "credits_used", nullable = false)
    private int creditsUsed;

    @Column(name = "available_credits")
    private Integer availableCredits;

    @Column(name = "result", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String result;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ActionExecutionEntity fromDomain(ActionExecution execution) {
        ActionExecutionEntity entity = new ActionExecutionEntity();
        entity.setId(execution.getId());
        entity.setIdempotencyKey(execution.getIdempotencyKey());
        entity.setUserId(execution.getUserId());
        entity.setOrgId(execution.getOrgId());
        entity.setActionType(execution.getActionType().code());
        entity.updateFromDomain(execution);
        entity.setCreatedAt(execution.getCreatedAt());
        return entity;
    }

    public ActionExecution toDomain() {
        return ActionExecution.builder()
            .id(id)
            .idempotencyKey(idempotencyKey)
            .userId(userId)
            .orgId(orgId)
            .actionType(ActionType.fromCode(actionType))
            .status(status)
            .creditsUsed(creditsUsed)
            .availableCredits(availableCredits)
            .result(result)
            .errorMessage(errorMessage)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    public void updateFromDomain(ActionExecution execution) {
        this.status = execution.getStatus();
        this.creditsUsed = execution.getCreditsUsed();
        this.availableCredits = execution.getAvailableCredits();
        this.result = execution.getResult();
        this.errorMessage = execution.getErrorMessage();
        this.updatedAt = execution.getUpdatedAt();
    }
}
