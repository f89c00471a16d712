package com.whereq.orchestra.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → PROCESSING → {COMPLETED, FAILED}
 * {QUEUED, PROCESSING} → CANCELLED (external cancel request only)
 */
public enum JobStatus {
    /**
     * Persisted and waiting on its queue
     */
    QUEUED,

    /**
     * Picked up by a worker
     */
    PROCESSING,

    /**
     * Processor finished successfully
     */
    COMPLETED,

    /**
     * Processor raised an error
     */
    FAILED,

    /**
     * User-initiated cancellation
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a cancel request may be honoured
     */
    public boolean isCancellable() {
        return this == QUEUED || this == PROCESSING;
    }

    /**
     * Check if moving to {@code next} is a legal transition
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == PROCESSING || next == CANCELLED;
            case PROCESSING -> next == PROCESSING || next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
