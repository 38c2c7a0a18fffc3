package com.kmg.dms.api;

import com.kmg.dms.model.ScanJobRecord;
import com.kmg.dms.model.ScanJobStatus;
import com.kmg.dms.service.ScanService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.util.List;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ScanControllerTest {

    @Mock
    private ScanService scanService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ScanController(scanService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void triggerIsAccepted() throws Exception {
        mockMvc.perform(post("/api/scans"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true));
    }

    @Test
    void triggerWhileRunningIsConflict() throws Exception {
        doThrow(new IllegalStateException("A scan is already running.")).when(scanService).triggerScan();

        mockMvc.perform(post("/api/scans"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("A scan is already running."));
    }

    @Test
    void listsRecentJobs() throws Exception {
        when(scanService.recentScans()).thenReturn(List.of(new ScanJobRecord("job-1", "local:/archive",
                ScanJobStatus.COMPLETED, 3, 2, 1, 0, 2, null, null,
                OffsetDateTime.parse("2025-01-01T08:00:00Z"), null, null)));

        mockMvc.perform(get("/api/scans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("job-1"))
                .andExpect(jsonPath("$[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$[0].createdAt").value("2025-01-01T08:00Z"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(scanService.getScan("missing")).thenThrow(new IllegalArgumentException("Scan job not found: missing"));

        mockMvc.perform(get("/api/scans/missing"))
                .andExpect(status().isNotFound());
    }
}
