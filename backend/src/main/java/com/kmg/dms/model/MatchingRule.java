package com.kmg.dms.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Tenant-scoped (or global when {@code tenantId} is null) classification rule. Rules are evaluated by
 * descending priority; {@code id} follows declaration order and breaks ties.
 */
public record MatchingRule(
        long id,
        String tenantId,
        String name,
        boolean active,
        int priority,
        MatchAlgorithm algorithm,
        String pattern,
        boolean caseSensitive,
        String assignDocumentTypeId,
        String assignEmployeeId,
        List<String> assignTags,
        DocumentStatus assignStatus,
        long matchCount,
        OffsetDateTime lastMatchedAt
) {
    public MatchingRule {
        assignTags = assignTags == null ? List.of() : List.copyOf(assignTags);
    }
}
