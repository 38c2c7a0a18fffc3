package com.kmg.dms.service;

import com.kmg.dms.repo.ScanJobRepository.ProgressSnapshot;

/**
 * Counters of a running scan job. Guarded by its own monitor, independent of the dedup index locks.
 */
final class ScanProgress {
    private static final int LABEL_LIMIT = 100;

    private final int flushInterval;
    private int processed;
    private int skipped;
    private int errors;
    private int documentsCreated;
    private int sinceFlush;
    private String currentItem;

    ScanProgress(int initialSkipped, int flushInterval) {
        this.skipped = initialSkipped;
        this.flushInterval = Math.max(1, flushInterval);
    }

    /**
     * Counts one finished file. Returns true when a progress flush is due.
     */
    synchronized boolean record(FileOutcome outcome, String label) {
        switch (outcome.kind()) {
            case PROCESSED -> {
                processed++;
                documentsCreated += outcome.documentsCreated();
            }
            case SKIPPED -> skipped++;
            case ERROR -> errors++;
        }
        if (label != null) {
            currentItem = label.length() > LABEL_LIMIT ? label.substring(0, LABEL_LIMIT) : label;
        }
        sinceFlush++;
        if (sinceFlush >= flushInterval) {
            sinceFlush = 0;
            return true;
        }
        return false;
    }

    synchronized ProgressSnapshot snapshot() {
        return new ProgressSnapshot(processed, skipped, errors, documentsCreated, currentItem);
    }
}
