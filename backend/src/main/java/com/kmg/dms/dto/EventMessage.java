package com.kmg.dms.dto;

public record EventMessage(
        String type,
        String jobId,
        String message,
        String timestamp,
        Object payload
) {
}
