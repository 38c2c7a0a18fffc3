package com.kmg.dms.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ScanScheduler {
    private final ScanService scanService;

    public ScanScheduler(ScanService scanService) {
        this.scanService = scanService;
    }

    // "-" disables the trigger.
    @Scheduled(cron = "${dms.scan.cron:-}")
    public void scheduledScan() {
        scanService.runScheduledScan();
    }
}
