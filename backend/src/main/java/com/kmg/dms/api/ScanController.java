package com.kmg.dms.api;

import com.kmg.dms.dto.ScanJobView;
import com.kmg.dms.dto.TriggerScanResponse;
import com.kmg.dms.service.ScanService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/scans")
public class ScanController {
    private final ScanService scanService;

    public ScanController(ScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping
    public ResponseEntity<TriggerScanResponse> trigger() {
        scanService.triggerScan();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TriggerScanResponse(true, "Scan started"));
    }

    @GetMapping
    public List<ScanJobView> list() {
        return scanService.recentScans().stream().map(ScanJobView::from).toList();
    }

    @GetMapping("/{id}")
    public ScanJobView get(@PathVariable String id) {
        return ScanJobView.from(scanService.getScan(id));
    }
}
