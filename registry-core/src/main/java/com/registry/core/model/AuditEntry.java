package com.registry.core.model;

import java.time.Instant;

/**
 * Immutable record of one alias mutation, one JSON object per line in
 * {@code audit/promotions.jsonl}.
 *
 * Invariants:
 * - entries are never edited or removed
 * - timestamps strictly increase within a model's log
 * - {@code from} is null exactly when {@code action} is CREATE
 */
public record AuditEntry(
    Instant ts,
    String actor,
    AliasAction action,
    String alias,
    String from,
    String to,
    String reason
) {
    /**
     * Create the entry for repointing an alias from {@code previous} (null on
     * first promotion) to {@code target}.
     */
    public static AuditEntry promotion(
            Instant ts,
            String actor,
            String alias,
            String previous,
            String target,
            String reason) {
        return new AuditEntry(
            ts,
            actor,
            previous == null ? AliasAction.CREATE : AliasAction.UPDATE,
            alias,
            previous,
            target,
            reason
        );
    }

    public AuditEntry withTimestamp(Instant newTs) {
        return new AuditEntry(newTs, actor, action, alias, from, to, reason);
    }
}
