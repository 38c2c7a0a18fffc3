package com.kmg.dms.model;

public record Classification(
        String type,
        boolean subjectSpecific,
        String categoryCode,
        String description
) {
    public static final String UNKNOWN_TYPE = "UNKNOWN";

    public static Classification unknown() {
        return new Classification(UNKNOWN_TYPE, false, null, "Unknown document");
    }

    public boolean isKnown() {
        return !UNKNOWN_TYPE.equals(type);
    }
}
