package com.kmg.dms.service;

import com.kmg.dms.model.RawArtifact;

import java.util.List;

/**
 * Tenant partitioned input hierarchy ({@code {tenant_code}/{YYYYMM}/{filename}}). Artifact identifiers are stable
 * across runs and serve as the dedup-by-path key.
 */
public interface ArchiveSource {

    /**
     * Human readable label stored on the scan job.
     */
    String name();

    List<String> tenantCodes();

    List<RawArtifact> artifacts(String tenantCode);
}
