package com.calcron.domain.exception;

/**
 * The external job scheduler did not confirm a submit or cancel.
 */
public class JobSchedulerException extends RuntimeException {

    public JobSchedulerException(String message) {
        super(message);
    }

    public JobSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
