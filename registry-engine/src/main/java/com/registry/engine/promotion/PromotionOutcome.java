package com.registry.engine.promotion;

import com.registry.core.model.AuditEntry;
import com.registry.core.model.VersionId;

/**
 * Result of a promotion.
 *
 * @param previous Version the alias pointed at before, or null if it was created
 * @param auditEntry The entry as logged
 */
public record PromotionOutcome(
    VersionId target,
    String alias,
    String previous,
    AuditEntry auditEntry
) {
}
