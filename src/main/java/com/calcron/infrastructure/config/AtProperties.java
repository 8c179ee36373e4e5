package com.calcron.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * How the {@code at} tool family is invoked.
 * Times are handed to {@code at} in {@code timeZone}, with TZ set to the same zone for the child
 * process, so the host's local time zone never matters.
 *
 * <p>{@code at} copies its environment into the job, so the scheduled command also runs with
 * {@code TZ=<timeZone>}. Set {@code timeZone} to the host's zone when commands rely on local time.
 */
@Component
@ConfigurationProperties(prefix = "calcron.at")
public class AtProperties {

    private String atCommand = "at";
    private String atrmCommand = "atrm";
    private String atqCommand = "atq";
    private String queue;
    private Duration timeout = Duration.ofSeconds(10);
    private String timeZone = "UTC";

    public String getAtCommand() {
        return atCommand;
    }

    public void setAtCommand(String atCommand) {
        this.atCommand = atCommand;
    }

    public String getAtrmCommand() {
        return atrmCommand;
    }

    public void setAtrmCommand(String atrmCommand) {
        this.atrmCommand = atrmCommand;
    }

    public String getAtqCommand() {
        return atqCommand;
    }

    public void setAtqCommand(String atqCommand) {
        this.atqCommand = atqCommand;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }
}
