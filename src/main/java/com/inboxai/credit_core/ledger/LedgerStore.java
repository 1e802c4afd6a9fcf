package com.inboxai.credit_core.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable store for credit balances and the append-only credit transaction log.
 *
 * {@link #applyDelta(LedgerMutation)} is the only way to change a balance. Each mutation
 * is one conditional statement on the balance row plus one transaction insert, committed
 * together:
 * 1. SPEND: UPDATE ... WHERE available_credits >= cost, so two concurrent spends can
 *    never both pass the affordability check
 * 2. GRANT: INSERT ... ON CONFLICT DO UPDATE, so the first grant creates the row
 *    (an opening grant uses DO NOTHING instead, so onboarding twice grants once)
 * 3. RESET: row lock, then compare-and-swap on credits_reset_at
 *
 * No JPA here: the atomicity lives in the SQL, not in the application.
 */
@Repository
@Slf4j
public class LedgerStore {

    private static final String BALANCE_COLUMNS =
        "id, user_id, org_id, total_credits, used_credits, available_credits, subscription_tier, credits_reset_at";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public LedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<CreditBalance> findBalance(UUID userId, UUID orgId) {
        return jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM credit_balances WHERE user_id = ? AND org_id = ?",
            balanceRowMapper(),
            userId,
            orgId
        ).stream().findFirst();
    }

    /**
     * Reads the balance row under a row lock held until the caller's transaction ends. Writers that
     * check a per-tenant limit before inserting take this lock first, so two of them cannot both
     * pass the check.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<CreditBalance> lockBalance(UUID userId, UUID orgId) {
        return jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM credit_balances WHERE user_id = ? AND org_id = ? FOR UPDATE",
            balanceRowMapper(),
            userId,
            orgId
        ).stream().findFirst();
    }

    /**
     * Applies a mutation atomically.
     *
     * @return the balance after the mutation, or empty when a SPEND could not be afforded
     *         (or the tenant has no balance), when an opening grant found an existing balance,
     *         and when a RESET lost its compare-and-swap.
     *         An empty result never leaves a transaction row behind.
     * @throws LedgerWriteConflictException if the database reports a lock or serialization conflict
     */
    @Transactional
    public Optional<CreditBalance> applyDelta(LedgerMutation mutation) {
        try {
            return switch (mutation.getEntryType()) {
                case SPEND -> applySpend(mutation);
                case GRANT -> mutation.isCreateOnly() ? applyOpening(mutation) : Optional.of(applyGrant(mutation));
                case RESET -> applyReset(mutation);
            };
        } catch (ConcurrencyFailureException e) {
            throw new LedgerWriteConflictException(
                String.format("Conflicting ledger write for user=%s org=%s type=%s",
                    mutation.getUserId(), mutation.getOrgId(), mutation.getEntryType()), e);
        }
    }

    private Optional<CreditBalance> applySpend(LedgerMutation mutation) {
        List<CreditBalance> updated = jdbcTemplate.query(
            "UPDATE credit_balances " +
            "SET used_credits = used_credits + ?, available_credits = available_credits - ?, updated_at = now() " +
            "WHERE user_id = ? AND org_id = ? AND available_credits >= ? " +
            "RETURNING " + BALANCE_COLUMNS,
            balanceRowMapper(),
            mutation.getAmount(),
            mutation.getAmount(),
            mutation.getUserId(),
            mutation.getOrgId(),
            mutation.getAmount()
        );

        if (updated.isEmpty()) {
            return Optional.empty();
        }

        insertTransaction(mutation, mutation.getAmount());
        return Optional.of(updated.get(0));
    }

    private CreditBalance applyGrant(LedgerMutation mutation) {
        CreditBalance balance = jdbcTemplate.queryForObject(
            "INSERT INTO credit_balances " +
            "(id, user_id, org_id, total_credits, used_credits, available_credits, subscription_tier, credits_reset_at, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, 0, ?, ?, ?, now(), now()) " +
            "ON CONFLICT (user_id, org_id) DO UPDATE " +
            "SET total_credits = credit_balances.total_credits + EXCLUDED.total_credits, " +
            "    available_credits = credit_balances.available_credits + EXCLUDED.available_credits, " +
            "    updated_at = now() " +
            "RETURNING " + BALANCE_COLUMNS,
            balanceRowMapper(),
            UUID.randomUUID(),
            mutation.getUserId(),
            mutation.getOrgId(),
            mutation.getAmount(),
            mutation.getAmount(),
            mutation.getTier().code(),
            toTimestamp(mutation.getResetAt())
        );

        insertTransaction(mutation, -mutation.getAmount());
        return balance;
    }

    private Optional<CreditBalance> applyOpening(LedgerMutation mutation) {
        Optional<CreditBalance> created = jdbcTemplate.query(
            "INSERT INTO credit_balances " +
            "(id, user_id, org_id, total_credits, used_credits, available_credits, subscription_tier, credits_reset_at, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, 0, ?, ?, ?, now(), now()) " +
            "ON CONFLICT (user_id, org_id) DO NOTHING " +
            "RETURNING " + BALANCE_COLUMNS,
            balanceRowMapper(),
            UUID.randomUUID(),
            mutation.getUserId(),
            mutation.getOrgId(),
            mutation.getAmount(),
            mutation.getAmount(),
            mutation.getTier().code(),
            toTimestamp(mutation.getResetAt())
        ).stream().findFirst();

        created.ifPresent(balance -> insertTransaction(mutation, -mutation.getAmount()));
        return created;
    }

    private Optional<CreditBalance> applyReset(LedgerMutation mutation) {
        Optional<CreditBalance> locked = jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM credit_balances WHERE user_id = ? AND org_id = ? FOR UPDATE",
            balanceRowMapper(),
            mutation.getUserId(),
            mutation.getOrgId()
        ).stream().findFirst();

        if (locked.isEmpty()) {
            return Optional.empty();
        }

        CreditBalance previous = locked.get();
        if (!Objects.equals(previous.getCreditsResetAt(), mutation.getExpectedResetAt())) {
            log.debug("Reset skipped, balance already advanced: user={}, org={}, resetAt={}",
                mutation.getUserId(), mutation.getOrgId(), previous.getCreditsResetAt());
            return Optional.empty();
        }

        int allotment = mutation.getAmount();
        CreditBalance reset = jdbcTemplate.queryForObject(
            "UPDATE credit_balances " +
            "SET total_credits = ?, used_credits = 0, available_credits = ?, subscription_tier = ?, " +
            "    credits_reset_at = ?, updated_at = now() " +
            "WHERE id = ? " +
            "RETURNING " + BALANCE_COLUMNS,
            balanceRowMapper(),
            allotment,
            allotment,
            mutation.getTier().code(),
            toTimestamp(mutation.getResetAt()),
            previous.getId()
        );

        // Net change keeps available_credits == -SUM(credits_used) across resets
        insertTransaction(mutation, previous.getAvailableCredits() - allotment);
        return Optional.of(reset);
    }

    /**
     * Changes the subscription tier only. Credits are untouched until the next reset.
     */
    @Transactional
    public Optional<CreditBalance> updateTier(UUID userId, UUID orgId, SubscriptionTier tier) {
        return jdbcTemplate.query(
            "UPDATE credit_balances SET subscription_tier = ?, updated_at = now() " +
            "WHERE user_id = ? AND org_id = ? RETURNING " + BALANCE_COLUMNS,
            balanceRowMapper(),
            tier.code(),
            userId,
            orgId
        ).stream().findFirst();
    }

    /**
     * Keyset page of balances due for reset, ordered by (credits_reset_at, id). Pass the last row of
     * the previous page as the cursor, or nulls for the first page.
     */
    public List<CreditBalance> findBalancesDueForReset(Instant now, Instant afterResetAt, UUID afterId, int limit) {
        if (afterResetAt == null || afterId == null) {
            return jdbcTemplate.query(
                "SELECT " + BALANCE_COLUMNS + " FROM credit_balances " +
                "WHERE credits_reset_at IS NOT NULL AND credits_reset_at <= ? " +
                "ORDER BY credits_reset_at ASC, id ASC LIMIT ?",
                balanceRowMapper(),
                Timestamp.from(now),
                limit
            );
        }
        return jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM credit_balances " +
            "WHERE credits_reset_at IS NOT NULL AND credits_reset_at <= ? " +
            "AND (credits_reset_at, id) > (?, ?) " +
            "ORDER BY credits_reset_at ASC, id ASC LIMIT ?",
            balanceRowMapper(),
            Timestamp.from(now),
            Timestamp.from(afterResetAt),
            afterId,
            limit
        );
    }

    public long countResetsOverdueSince(Instant before) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM credit_balances WHERE credits_reset_at IS NOT NULL AND credits_reset_at < ?",
            Long.class,
            Timestamp.from(before)
        );
        return count != null ? count : 0L;
    }

    public List<CreditTransaction> findTransactions(UUID userId, UUID orgId, int limit) {
        return jdbcTemplate.query(
            "SELECT id, user_id, org_id, action_type, credits_used, description, metadata, created_at, sequence_number " +
            "FROM credit_transactions WHERE user_id = ? AND org_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ?",
            transactionRowMapper(),
            userId,
            orgId,
            limit
        );
    }

    /**
     * Recomputes the balance from the transaction log, in one consistent read.
     */
    @Transactional(readOnly = true)
    public Optional<LedgerReconciliation> reconcile(UUID userId, UUID orgId) {
        return findBalance(userId, orgId).map(balance -> {
            Map<String, Object> sums = jdbcTemplate.queryForMap(
                "SELECT COALESCE(SUM(credits_used), 0) AS total, COUNT(*) AS count " +
                "FROM credit_transactions WHERE user_id = ? AND org_id = ?",
                userId,
                orgId
            );
            return new LedgerReconciliation(
                userId,
                orgId,
                balance.getAvailableCredits(),
                balance.getTotalCredits(),
                balance.getUsedCredits(),
                ((Number) sums.get("total")).longValue(),
                ((Number) sums.get("count")).longValue()
            );
        });
    }

    private void insertTransaction(LedgerMutation mutation, int signedCredits) {
        jdbcTemplate.update(
            "INSERT INTO credit_transactions (id, user_id, org_id, action_type, credits_used, description, metadata, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CAST(? AS jsonb), now())",
            UUID.randomUUID(),
            mutation.getUserId(),
            mutation.getOrgId(),
            mutation.getActionType(),
            signedCredits,
            mutation.getDescription(),
            writeMetadata(mutation.getMetadata())
        );
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Transaction metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable transaction metadata: {}", e.getMessage());
            return Map.of("raw", json);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private RowMapper<CreditBalance> balanceRowMapper() {
        return (rs, rowNum) -> new CreditBalance(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("user_id")),
            UUID.fromString(rs.getString("org_id")),
            rs.getInt("total_credits"),
            rs.getInt("used_credits"),
            rs.getInt("available_credits"),
            SubscriptionTier.fromCode(rs.getString("subscription_tier")),
            toInstant(rs.getTimestamp("credits_reset_at"))
        );
    }

    private RowMapper<CreditTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new CreditTransaction(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("user_id")),
            UUID.fromString(rs.getString("org_id")),
            rs.getString("action_type"),
            rs.getInt("credits_used"),
            rs.getString("description"),
            readMetadata(rs.getString("metadata")),
            toInstant(rs.getTimestamp("created_at")),
            rs.getLong("sequence_number")
        );
    }
}
