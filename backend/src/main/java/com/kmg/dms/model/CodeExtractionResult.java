package com.kmg.dms.model;

import java.util.List;
import java.util.Map;

public record CodeExtractionResult(
        boolean success,
        String error,
        List<DecodedCode> codes,
        List<String> subjectIds,
        String tenantHint,
        Map<String, String> fields
) {
    public CodeExtractionResult {
        codes = List.copyOf(codes);
        subjectIds = List.copyOf(subjectIds);
        fields = Map.copyOf(fields);
    }

    public static CodeExtractionResult timedOut() {
        return new CodeExtractionResult(true, "Timeout", List.of(), List.of(), null, Map.of());
    }

    public static CodeExtractionResult failed(String error) {
        return new CodeExtractionResult(false, error, List.of(), List.of(), null, Map.of());
    }

    public boolean hasSubjects() {
        return success && !subjectIds.isEmpty();
    }

    public boolean hasCodes() {
        return success && !codes.isEmpty();
    }
}
