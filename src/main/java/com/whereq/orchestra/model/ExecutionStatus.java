package com.whereq.orchestra.model;

/**
 * Execution lifecycle states
 *
 * PENDING → RUNNING → {SUCCESS, FAILED}
 * {PENDING, RUNNING} → CANCELLED (marker only, the remote run is not stopped)
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == RUNNING;
    }
}
