package com.kmg.dms.service;

import com.kmg.dms.model.ProcessedRecord;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory view of already ingested paths and per-tenant content hashes for one scan run. Only a fast path: the
 * unique constraint on {@code processed_records} stays authoritative.
 */
final class DedupIndex {
    private final Object hashLock = new Object();
    private final Object pathLock = new Object();
    private final Map<String, Set<String>> hashesByTenant = new HashMap<>();
    private final Set<String> knownPaths = new HashSet<>();

    static DedupIndex of(List<ProcessedRecord> records) {
        DedupIndex index = new DedupIndex();
        for (ProcessedRecord record : records) {
            index.hashesByTenant.computeIfAbsent(record.tenantId(), key -> new HashSet<>()).add(record.contentHash());
            index.knownPaths.add(record.sourceIdentifier());
        }
        return index;
    }

    boolean knowsPath(String identifier) {
        synchronized (pathLock) {
            return knownPaths.contains(identifier);
        }
    }

    void addPath(String identifier) {
        synchronized (pathLock) {
            knownPaths.add(identifier);
        }
    }

    /**
     * Marks the hash as taken for this tenant. False if it was already known or claimed by another worker.
     */
    boolean claimHash(String tenantId, String contentHash) {
        synchronized (hashLock) {
            return hashesByTenant.computeIfAbsent(tenantId, key -> new HashSet<>()).add(contentHash);
        }
    }

    void releaseHash(String tenantId, String contentHash) {
        synchronized (hashLock) {
            Set<String> hashes = hashesByTenant.get(tenantId);
            if (hashes != null) {
                hashes.remove(contentHash);
            }
        }
    }
}
