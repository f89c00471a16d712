package com.whereq.orchestra.exception;

/**
 * Exception thrown when a job cannot be accepted: the manager is stopped,
 * or its record or task message could not be written
 */
public class EnqueueException extends RuntimeException {
    public EnqueueException(String message) {
        super(message);
    }

    public EnqueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
