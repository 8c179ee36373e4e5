package com.calcron.infrastructure.cron;

import com.calcron.application.SyncCalendarJobs;
import com.calcron.domain.model.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
// run-once mode owns the single cycle of the process
@ConditionalOnExpression("${calcron.sync.enabled:true} and !${calcron.sync.run-once:false}")
public class ScheduledSyncTrigger {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledSyncTrigger.class);
    private final SyncCalendarJobs syncCalendarJobs;

    public ScheduledSyncTrigger(SyncCalendarJobs syncCalendarJobs) {
        this.syncCalendarJobs = syncCalendarJobs;
    }

    @Scheduled(fixedDelayString = "${calcron.sync.interval-ms:300000}",
            initialDelayString = "${calcron.sync.initial-delay-ms:0}")
    public void sync() {
        logger.info("Running scheduled calendar sync");
        try {
            SyncReport report = syncCalendarJobs.runCycle();
            logger.debug("Scheduled sync ended with {}", report.status());
        } catch (RuntimeException e) {
            logger.error("Scheduled sync failed unexpectedly", e);
        }
    }
}
