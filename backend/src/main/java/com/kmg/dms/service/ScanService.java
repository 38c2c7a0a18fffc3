package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.ScanJobRecord;
import com.kmg.dms.repo.ScanJobRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for manual and scheduled scans. At most one scan runs per process; across processes the
 * orchestrator's distributed lock applies.
 */
@Service
public class ScanService {
    private static final Logger log = LoggerFactory.getLogger(ScanService.class);
    private static final int RECENT_LIMIT = 50;

    private final IngestionOrchestrator orchestrator;
    private final ScanJobRepository scanJobRepository;
    private final RetryPolicy retryPolicy;
    private final ExecutorService scanExecutor = Executors.newSingleThreadExecutor();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ScanService(IngestionOrchestrator orchestrator, ScanJobRepository scanJobRepository,
                       DmsProperties properties) {
        this.orchestrator = orchestrator;
        this.scanJobRepository = scanJobRepository;
        this.retryPolicy = RetryPolicy.from(properties.getScan().getRetry());
    }

    public void triggerScan() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A scan is already running.");
        }
        try {
            scanExecutor.submit(this::runGuarded);
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    /**
     * Runs a scan on the calling thread with retries. Returns false when a scan was already running here.
     */
    public boolean runScheduledScan() {
        if (!running.compareAndSet(false, true)) {
            log.info("Scheduled scan skipped, a scan is already running");
            return false;
        }
        runGuarded();
        return true;
    }

    public List<ScanJobRecord> recentScans() {
        return scanJobRepository.findRecent(RECENT_LIMIT);
    }

    public ScanJobRecord getScan(String jobId) {
        return scanJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Scan job not found: " + jobId));
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runGuarded() {
        try {
            Optional<ScanJobRecord> job = retryPolicy.execute(orchestrator::runScan, RetryPolicy.Sleeper.THREAD);
            job.ifPresent(record -> log.info("Scan {} finished with status {}", record.id(), record.status()));
        } catch (ScanFailedException e) {
            log.error("Scan {} failed after {} attempts: {}", e.getJobId(), retryPolicy.maxAttempts(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan retry interrupted");
        } finally {
            running.set(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        scanExecutor.shutdownNow();
    }
}
