package com.kmg.dms.model;

import java.time.OffsetDateTime;

/**
 * Dedup marker for one ingested source file. At most one exists per (tenant, content hash).
 * {@code documentId} is null when the source was split into several documents.
 */
public record ProcessedRecord(
        String tenantId,
        String contentHash,
        String sourceIdentifier,
        String documentId,
        OffsetDateTime processedAt
) {
}
