package com.kmg.dms.dto;

import com.kmg.dms.model.ScanJobRecord;
import com.kmg.dms.model.ScanJobStatus;
import com.kmg.dms.repo.SqlTime;

public record ScanJobView(
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
        String createdAt,
        String startedAt,
        String completedAt
) {
    public static ScanJobView from(ScanJobRecord record) {
        return new ScanJobView(
                record.id(),
                record.source(),
                record.status(),
                record.totalFiles(),
                record.processedFiles(),
                record.skippedFiles(),
                record.errorFiles(),
                record.documentsCreated(),
                record.currentItem(),
                record.errorMessage(),
                SqlTime.text(record.createdAt()),
                SqlTime.text(record.startedAt()),
                SqlTime.text(record.completedAt())
        );
    }
}
