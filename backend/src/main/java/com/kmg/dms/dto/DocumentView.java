package com.kmg.dms.dto;

import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentStatus;

import java.util.List;
import java.util.Map;

public record DocumentView(
        String id,
        String tenantId,
        String title,
        String originalFilename,
        DocumentStatus status,
        String employeeId,
        String documentTypeId,
        Integer periodYear,
        Integer periodMonth,
        List<String> tags,
        Map<String, String> metadata,
        String notes
) {
    public static DocumentView from(DocumentRecord document) {
        return new DocumentView(
                document.id(),
                document.tenantId(),
                document.title(),
                document.originalFilename(),
                document.status(),
                document.employeeId(),
                document.documentTypeId(),
                document.periodYear(),
                document.periodMonth(),
                document.tags(),
                document.metadata().fields(),
                document.notes()
        );
    }
}
