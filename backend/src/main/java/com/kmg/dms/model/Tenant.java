package com.kmg.dms.model;

import java.time.OffsetDateTime;

public record Tenant(
        String id,
        String code,
        String name,
        boolean active,
        OffsetDateTime createdAt
) {
}
