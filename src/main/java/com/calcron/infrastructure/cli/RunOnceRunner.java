package com.calcron.infrastructure.cli;

import com.calcron.application.ResetJobs;
import com.calcron.application.SyncCalendarJobs;
import com.calcron.domain.model.SyncReport;
import com.calcron.infrastructure.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Cron-style mode: runs a single cycle (or a reset) at startup and reports its status as the exit code.
 */
@Component
@ConditionalOnProperty(name = "calcron.sync.run-once", havingValue = "true")
public class RunOnceRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(RunOnceRunner.class);

    private final SyncCalendarJobs syncCalendarJobs;
    private final ResetJobs resetJobs;
    private final SyncProperties properties;

    private volatile int exitCode;

    public RunOnceRunner(SyncCalendarJobs syncCalendarJobs, ResetJobs resetJobs, SyncProperties properties) {
        this.syncCalendarJobs = syncCalendarJobs;
        this.resetJobs = resetJobs;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        SyncReport report = properties.isReset() ? resetJobs.reset() : syncCalendarJobs.runCycle();
        exitCode = report.status().exitCode();
        logger.info("{} finished with {} (exit code {})",
                properties.isReset() ? "Reset" : "Sync", report.status(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
