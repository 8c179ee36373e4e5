package com.calcron.infrastructure.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the reconciliation cycle and its triggers.
 */
@Component
@ConfigurationProperties(prefix = "calcron.sync")
@Validated
public class SyncProperties {

    private boolean enabled = true;
    @Min(1)
    private long intervalMs = 300_000;
    @NotNull
    private Duration horizon = Duration.ofDays(7);
    @NotNull
    private Duration fetchTimeout = Duration.ofSeconds(60);
    @Min(1)
    private int applyParallelism = 1;
    private boolean runOnce;
    private boolean reset;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public Duration getHorizon() {
        return horizon;
    }

    public void setHorizon(Duration horizon) {
        this.horizon = horizon;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public int getApplyParallelism() {
        return applyParallelism;
    }

    public void setApplyParallelism(int applyParallelism) {
        this.applyParallelism = applyParallelism;
    }

    public boolean isRunOnce() {
        return runOnce;
    }

    public void setRunOnce(boolean runOnce) {
        this.runOnce = runOnce;
    }

    public boolean isReset() {
        return reset;
    }

    public void setReset(boolean reset) {
        this.reset = reset;
    }
}
