package com.whereq.orchestra.exception;

/**
 * Thrown when a job or execution is asked to move to a state its state machine does not allow
 */
public class InvalidStateTransitionException extends RuntimeException {
    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
