package com.calcron.infrastructure.adapter.at;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner {

    /**
     * @param command program and arguments, passed without a shell
     * @param stdin text written to the process input, or {@code null}
     * @param environment variables added to the inherited environment
     * @param timeout how long to wait before the process is killed
     * @throws com.calcron.domain.exception.JobSchedulerException if the command cannot be started,
     *         times out or the wait is interrupted
     */
    CommandResult run(List<String> command, String stdin, Map<String, String> environment, Duration timeout);
}
