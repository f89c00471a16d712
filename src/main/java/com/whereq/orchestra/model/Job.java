package com.whereq.orchestra.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.orchestra.exception.InvalidStateTransitionException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Unit of orchestrated work.
 *
 * <p>Created by {@link com.whereq.orchestra.service.JobQueueManager} at enqueue time and afterwards
 * mutated only by the worker that owns its task message, apart from the out-of-band cancel marker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job implements PersistentRecord {

    public static final int PROCESSING_START_PROGRESS = 10;
    public static final int MAX_RUNNING_PROGRESS = 99;

    private String id;

    private JobType type;

    @Builder.Default
    private JobStatus status = JobStatus.QUEUED;

    /**
     * 0-100, never decreases
     */
    @Builder.Default
    private int progress = 0;

    /**
     * Request snapshot taken at enqueue time
     */
    private JsonNode input;

    /**
     * Success payload, only set on COMPLETED
     */
    private JsonNode result;

    /**
     * Failure reason, only set on FAILED
     */
    private String error;

    private String executionId;

    private String playbookId;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;

    private String createdById;

    /**
     * Move to PROCESSING and raise progress to the starting mark.
     */
    public void markProcessing() {
        transitionTo(JobStatus.PROCESSING);
        advanceProgress(PROCESSING_START_PROGRESS);
    }

    /**
     * Raise progress while running. Values below the current progress are ignored and values
     * above {@link #MAX_RUNNING_PROGRESS} are capped; only completion reaches 100.
     *
     * @return the progress after the update
     */
    public int advanceProgress(int value) {
        int capped = Math.min(Math.max(value, 0), MAX_RUNNING_PROGRESS);
        progress = Math.max(progress, capped);
        return progress;
    }

    public void complete(JsonNode result, Instant now) {
        transitionTo(JobStatus.COMPLETED);
        this.progress = 100;
        this.result = result;
        this.error = null;
        this.completedAt = now;
    }

    public void fail(String reason, Instant now) {
        transitionTo(JobStatus.FAILED);
        this.error = reason;
        this.result = null;
        this.completedAt = now;
    }

    public void cancel(Instant now) {
        if (!status.isCancellable()) {
            throw new InvalidStateTransitionException(
                "Job " + id + " cannot be cancelled in status " + status);
        }
        this.status = JobStatus.CANCELLED;
        this.completedAt = now;
    }

    private void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStateTransitionException(
                "Job " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}
