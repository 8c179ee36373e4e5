package com.calcron.infrastructure.web;

import com.calcron.application.CycleGate;
import com.calcron.application.ResetJobs;
import com.calcron.application.SyncCalendarJobs;
import com.calcron.domain.model.CycleStatus;
import com.calcron.domain.model.SyncReport;
import com.calcron.domain.port.out.SyncStatusRepository;
import com.calcron.infrastructure.web.dto.SyncReportResponse;
import com.calcron.infrastructure.web.dto.SyncStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sync")
public class SyncController {

    private static final Logger logger = LoggerFactory.getLogger(SyncController.class);

    private final SyncCalendarJobs syncCalendarJobs;
    private final ResetJobs resetJobs;
    private final CycleGate cycleGate;
    private final SyncStatusRepository syncStatusRepository;

    public SyncController(SyncCalendarJobs syncCalendarJobs,
                          ResetJobs resetJobs,
                          CycleGate cycleGate,
                          SyncStatusRepository syncStatusRepository) {
        this.syncCalendarJobs = syncCalendarJobs;
        this.resetJobs = resetJobs;
        this.cycleGate = cycleGate;
        this.syncStatusRepository = syncStatusRepository;
    }

    @PostMapping
    public ResponseEntity<SyncReportResponse> sync() {
        logger.info("Sync requested over HTTP");
        return toResponse(syncCalendarJobs.runCycle());
    }

    @PostMapping("/reset")
    public ResponseEntity<SyncReportResponse> reset() {
        logger.info("Reset requested over HTTP");
        return toResponse(resetJobs.reset());
    }

    /**
     * Current phase plus the last report, taken from this process or, after a restart, from Redis.
     */
    @GetMapping("/status")
    public ResponseEntity<SyncStatusResponse> status() {
        var lastCycle = syncCalendarJobs.lastReport()
                .or(syncStatusRepository::getLastCycle)
                .map(SyncReportResponse::fromReport)
                .orElse(null);

        return ResponseEntity.ok(new SyncStatusResponse(
                syncCalendarJobs.currentPhase().name(),
                cycleGate.isBusy(),
                lastCycle));
    }

    private ResponseEntity<SyncReportResponse> toResponse(SyncReport report) {
        HttpStatus status = report.status() == CycleStatus.SKIPPED ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(SyncReportResponse.fromReport(report));
    }
}
