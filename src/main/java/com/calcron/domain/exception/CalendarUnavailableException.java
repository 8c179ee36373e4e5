package com.calcron.domain.exception;

/**
 * The calendar could not be read completely. A cycle that sees this aborts without side effects.
 */
public class CalendarUnavailableException extends RuntimeException {

    public CalendarUnavailableException(String message) {
        super(message);
    }

    public CalendarUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
