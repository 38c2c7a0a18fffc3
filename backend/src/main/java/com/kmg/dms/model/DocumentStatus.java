package com.kmg.dms.model;

public enum DocumentStatus {
    UNASSIGNED,
    ASSIGNED,
    REVIEW_NEEDED,
    COMPANY,
    ARCHIVED
}
