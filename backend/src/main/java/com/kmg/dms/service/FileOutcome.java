package com.kmg.dms.service;

/**
 * Result of ingesting one archive file.
 */
public record FileOutcome(Kind kind, String identifier, int documentsCreated, String error) {

    public enum Kind {
        PROCESSED,
        SKIPPED,
        ERROR
    }

    public static FileOutcome processed(String identifier, int documentsCreated) {
        return new FileOutcome(Kind.PROCESSED, identifier, documentsCreated, null);
    }

    public static FileOutcome skipped(String identifier) {
        return new FileOutcome(Kind.SKIPPED, identifier, 0, null);
    }

    public static FileOutcome error(String identifier, String error) {
        return new FileOutcome(Kind.ERROR, identifier, 0, error);
    }
}
