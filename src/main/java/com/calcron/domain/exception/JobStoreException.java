package com.calcron.domain.exception;

/**
 * The job record store could not be loaded or saved.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
