package com.calcron.domain.port.out;

import java.time.Instant;
import java.util.Set;

/**
 * Port for the external one-shot job scheduler.
 * All calls block and are bounded by a timeout; failures are reported as
 * {@link com.calcron.domain.exception.JobSchedulerException}.
 */
public interface JobScheduler {

    /**
     * Submits {@code payload} to run once at {@code at}.
     *
     * @return the opaque handle identifying the new job
     */
    String submit(Instant at, String payload);

    /**
     * Cancels a job. Cancelling an unknown handle is not an error.
     */
    CancelResult cancel(String jobHandle);

    /**
     * Lists the handles of all jobs the scheduler currently holds.
     */
    Set<String> liveHandles();
}
