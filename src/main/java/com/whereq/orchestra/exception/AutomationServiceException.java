package com.whereq.orchestra.exception;

/**
 * Failure talking to the external automation service: unreachable, timed out,
 * non-2xx, or a response that could not be read
 */
public class AutomationServiceException extends RuntimeException {

    /**
     * HTTP status, or -1 when no response was received
     */
    private final int statusCode;

    public AutomationServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public AutomationServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
