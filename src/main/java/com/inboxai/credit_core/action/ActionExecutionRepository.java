package com.inboxai.credit_core.action;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActionExecutionRepository extends JpaRepository<ActionExecutionEntity, UUID> {

    Optional<ActionExecutionEntity> findByIdempotencyKey(String idempotencyKey);
}
