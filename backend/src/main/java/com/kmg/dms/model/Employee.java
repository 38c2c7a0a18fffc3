package com.kmg.dms.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Canonical identity of a person inside a tenant. {@code tenantId} is null for legacy records
 * that were imported before tenants existed.
 */
public record Employee(
        String id,
        String tenantId,
        String employeeId,
        String firstName,
        String lastName,
        boolean active,
        List<String> aliases,
        OffsetDateTime createdAt
) {
    public Employee {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
