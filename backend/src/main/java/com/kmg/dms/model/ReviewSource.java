package com.kmg.dms.model;

public enum ReviewSource {
    BATCH_ARCHIVE("Batch archive"),
    SPLIT("Split batch scan"),
    EMAIL("E-mail"),
    API("API upload"),
    MANUAL("Manual scan");

    private final String displayName;

    ReviewSource(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
