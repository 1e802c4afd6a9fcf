package com.inboxai.credit_core.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ActionExecutionPersistenceService {

    private final ActionExecutionRepository repository;

    /**
     * Inserts and flushes immediately so a duplicate Idempotency-Key fails here, before any
     * credit is spent.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the key is taken
     */
    @Transactional
    public ActionExecution insert(ActionExecution execution) {
        ActionExecutionEntity saved = repository.saveAndFlush(ActionExecutionEntity.fromDomain(execution));
        log.debug("Recorded action execution {} for key {}", saved.getId(), execution.getIdempotencyKey());
        return saved.toDomain();
    }

    @Transactional
    public ActionExecution update(ActionExecution execution) {
        ActionExecutionEntity existing = repository.findById(execution.getId())
            .orElseThrow(() -> new IllegalArgumentException("Action execution not found: " + execution.getId()));
        existing.updateFromDomain(execution);
        return repository.save(existing).toDomain();
    }

    /**
     * Removes a PENDING record whose action never reached the ledger, freeing its key for a retry.
     */
    @Transactional
    public void release(UUID id) {
        repository.findById(id)
            .filter(entity -> entity.getStatus() == ActionExecutionStatus.PENDING)
            .ifPresent(repository::delete);
    }

    @Transactional(readOnly = true)
    public Optional<ActionExecution> findById(UUID id) {
        return repository.findById(id).map(ActionExecutionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<ActionExecution> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(ActionExecutionEntity::toDomain);
    }
}
