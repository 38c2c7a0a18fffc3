package com.kmg.dms.model;

public enum DocumentSource {
    BATCH_ARCHIVE,
    EMAIL,
    API,
    MANUAL
}
