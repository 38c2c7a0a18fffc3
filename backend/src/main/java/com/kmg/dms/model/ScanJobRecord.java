package com.kmg.dms.model;

import java.time.OffsetDateTime;

public record ScanJobRecord(
        String id,
        String source,
        ScanJobStatus status,
        int totalFiles,
        int processedFiles,
        int skippedFiles,
        int errorFiles,
        int documentsCreated,
        String currentItem,
        String errorMessage,
        OffsetDateTime createdAt,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt
) {
}
