package com.kmg.dms.model;

import java.time.OffsetDateTime;

public record ReviewTask(
        String id,
        String documentId,
        String title,
        String description,
        int priority,
        ReviewTaskStatus status,
        ReviewSource source,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime completedAt
) {
}
