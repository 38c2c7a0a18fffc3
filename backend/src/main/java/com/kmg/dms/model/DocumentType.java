package com.kmg.dms.model;

public record DocumentType(
        String id,
        String tenantId,
        String name,
        String description,
        String categoryCode,
        boolean subjectSpecific
) {
}
