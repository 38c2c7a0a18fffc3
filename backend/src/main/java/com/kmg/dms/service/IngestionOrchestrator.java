package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.RawArtifact;
import com.kmg.dms.model.ScanJobRecord;
import com.kmg.dms.model.ScanJobStatus;
import com.kmg.dms.model.Tenant;
import com.kmg.dms.repo.ProcessedRecordRepository;
import com.kmg.dms.repo.ScanJobRepository;
import com.kmg.dms.repo.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one scan job over an archive source: PENDING, RUNNING, then COMPLETED or FAILED.
 * <p>
 * The whole run holds the distributed scanner lock. Files whose identifier is already known are counted as
 * skipped without being read; the rest go to a bounded worker pool.
 */
@Service
public class IngestionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private static final String SOURCE = "ArchiveScanner";

    private final ArchiveSource archiveSource;
    private final ArchiveFileIngestor fileIngestor;
    private final DistributedLockManager lockManager;
    private final TenantRepository tenantRepository;
    private final ProcessedRecordRepository processedRecordRepository;
    private final ScanJobRepository scanJobRepository;
    private final EventService eventService;
    private final Clock clock;
    private final String lockName;
    private final Duration lockTtl;
    private final int maxWorkers;
    private final int progressInterval;

    public IngestionOrchestrator(
            ArchiveSource archiveSource,
            ArchiveFileIngestor fileIngestor,
            DistributedLockManager lockManager,
            TenantRepository tenantRepository,
            ProcessedRecordRepository processedRecordRepository,
            ScanJobRepository scanJobRepository,
            EventService eventService,
            Clock clock,
            DmsProperties properties
    ) {
        this.archiveSource = archiveSource;
        this.fileIngestor = fileIngestor;
        this.lockManager = lockManager;
        this.tenantRepository = tenantRepository;
        this.processedRecordRepository = processedRecordRepository;
        this.scanJobRepository = scanJobRepository;
        this.eventService = eventService;
        this.clock = clock;
        this.lockName = properties.getLock().getName();
        this.lockTtl = properties.getLock().getTtl();
        this.maxWorkers = properties.getScan().getMaxWorkers();
        this.progressInterval = properties.getScan().getProgressInterval();
    }

    /**
     * Runs a scan of the configured archive. Returns empty when another worker holds the scanner lock.
     *
     * @throws ScanFailedException if the run aborted; the job is left FAILED
     */
    public Optional<ScanJobRecord> runScan() {
        return runScan(archiveSource);
    }

    public Optional<ScanJobRecord> runScan(ArchiveSource source) {
        Optional<DistributedLockManager.LockHandle> lock = lockManager.tryAcquire(lockName, lockTtl);
        if (lock.isEmpty()) {
            log.info("Scan of {} skipped, lock {} is held elsewhere", source.name(), lockName);
            eventService.record(EventService.Level.INFO, SOURCE, "Scan skipped: another scan is running", null);
            return Optional.empty();
        }
        try (DistributedLockManager.LockHandle ignored = lock.get()) {
            return Optional.of(execute(source));
        }
    }

    private ScanJobRecord execute(ArchiveSource source) {
        String jobId = UUID.randomUUID().toString();
        scanJobRepository.insert(new ScanJobRecord(
                jobId, source.name(), ScanJobStatus.PENDING, 0, 0, 0, 0, 0, null, null,
                OffsetDateTime.now(clock), null, null));

        try {
            scanJobRepository.markRunning(jobId);
            eventService.publish("scan-started", jobId, "Scan started", Map.of("source", source.name()));

            DedupIndex index = DedupIndex.of(processedRecordRepository.findAll());
            List<WorkItem> work = new ArrayList<>();
            int total = 0;
            int known = 0;

            for (String tenantCode : source.tenantCodes()) {
                Optional<Tenant> tenant = ensureTenant(tenantCode);
                if (tenant.isEmpty()) {
                    continue;
                }
                for (RawArtifact artifact : source.artifacts(tenantCode)) {
                    total++;
                    if (index.knowsPath(artifact.identifier())) {
                        known++;
                    } else {
                        work.add(new WorkItem(tenant.get(), artifact));
                    }
                }
            }

            scanJobRepository.updateTotals(jobId, total, known);
            eventService.record(EventService.Level.INFO, SOURCE,
                    "Found " + work.size() + " new files, " + known + " already processed",
                    Map.of("job_id", jobId, "total", total));

            ScanProgress progress = new ScanProgress(known, progressInterval);
            if (!work.isEmpty()) {
                dispatch(jobId, work, index, progress);
            }

            ScanJobRepository.ProgressSnapshot result = progress.snapshot();
            scanJobRepository.complete(jobId, result);
            eventService.record(EventService.Level.INFO, SOURCE,
                    "Scan completed: " + result.processed() + " processed, " + result.skipped() + " skipped, "
                            + result.errors() + " errors",
                    Map.of("job_id", jobId, "documents_created", result.documentsCreated()));
            eventService.publish("scan-completed", jobId, "Scan completed", result);

            return scanJobRepository.findById(jobId)
                    .orElseThrow(() -> new IllegalStateException("Scan job vanished: " + jobId));
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Scan {} failed: {}", jobId, message, e);
            scanJobRepository.fail(jobId, message);
            eventService.record(EventService.Level.ERROR, SOURCE, "Scan failed: " + message, Map.of("job_id", jobId));
            eventService.publish("scan-failed", jobId, "Scan failed", Map.of("error", message));
            throw new ScanFailedException(jobId, message, e);
        }
    }

    private void dispatch(String jobId, List<WorkItem> work, DedupIndex index, ScanProgress progress)
            throws InterruptedException, ExecutionException {
        int workers = Math.max(1, Math.min(maxWorkers, Runtime.getRuntime().availableProcessors()));
        log.info("Processing {} files with {} workers", work.size(), workers);

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreads(jobId));
        CompletionService<FileOutcome> completionService = new ExecutorCompletionService<>(executor);
        try {
            for (WorkItem item : work) {
                completionService.submit(() -> fileIngestor.ingest(item.tenant(), item.artifact(), index));
            }
            for (int done = 0; done < work.size(); done++) {
                FileOutcome outcome = completionService.take().get();
                if (progress.record(outcome, label(outcome.identifier()))) {
                    scanJobRepository.updateProgress(jobId, progress.snapshot());
                    eventService.publish("scan-progress", jobId, "Scan progress", progress.snapshot());
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<Tenant> ensureTenant(String code) {
        if (tenantRepository.createIfMissing(code, "Mandant " + code)) {
            log.info("Created tenant {}", code);
            eventService.record(EventService.Level.INFO, SOURCE, "New tenant created: " + code, null);
        }
        Tenant tenant = tenantRepository.findByCode(code)
                .orElseThrow(() -> new IllegalStateException("Tenant vanished: " + code));
        if (!tenant.active()) {
            log.info("Skipping inactive tenant {}", code);
            return Optional.empty();
        }
        return Optional.of(tenant);
    }

    private static String label(String identifier) {
        int slash = identifier.lastIndexOf('/');
        return slash < 0 ? identifier : identifier.substring(slash + 1);
    }

    private static ThreadFactory workerThreads(String jobId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "scan-" + jobId.substring(0, 8) + "-";
        return runnable -> new Thread(runnable, prefix + counter.incrementAndGet());
    }

    private record WorkItem(Tenant tenant, RawArtifact artifact) {
    }
}
