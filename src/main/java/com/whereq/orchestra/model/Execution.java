package com.whereq.orchestra.model;

import com.whereq.orchestra.exception.InvalidStateTransitionException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Record of one run of the automation tool, owned 1:1 by an EXECUTE job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Execution implements PersistentRecord {

    public static final String CANCELLED_BY_USER = "Execution cancelled by user";

    private String id;

    private String playbookId;

    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.PENDING;

    private String inventory;

    private Map<String, Object> extraVars;

    private boolean checkMode;

    private List<String> tags;

    /**
     * Resolved invocation line, set when the run starts
     */
    private String command;

    private String output;

    private String error;

    private ExecutionStats stats;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant startedAt;

    private Instant completedAt;

    private Double durationSeconds;

    private String executedById;

    /**
     * PENDING → RUNNING. Only the worker owning the run calls this.
     */
    public void start(String command, Instant now) {
        if (status != ExecutionStatus.PENDING) {
            throw new InvalidStateTransitionException(
                "Execution " + id + " cannot start from status " + status);
        }
        this.status = ExecutionStatus.RUNNING;
        this.command = command;
        this.startedAt = now;
    }

    /**
     * Record the outcome of the run. A CANCELLED marker set while the run was in flight is kept,
     * but output and timings are still recorded.
     */
    public void finish(boolean success, String output, String error, ExecutionStats stats,
                       Double durationSeconds, Instant now) {
        if (status != ExecutionStatus.CANCELLED) {
            if (status != ExecutionStatus.RUNNING) {
                throw new InvalidStateTransitionException(
                    "Execution " + id + " cannot finish from status " + status);
            }
            this.status = success ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED;
        }
        this.output = output;
        this.error = error;
        this.stats = stats;
        this.durationSeconds = durationSeconds != null ? durationSeconds : elapsedSeconds(now);
        this.completedAt = now;
    }

    /**
     * The run could not be carried out at all (service unreachable, non-2xx, missing playbook).
     * PENDING or RUNNING only; a finished or cancelled execution keeps its outcome.
     */
    public void abort(String error, Instant now) {
        if (status.isTerminal()) {
            throw new InvalidStateTransitionException(
                "Execution " + id + " cannot be aborted in status " + status);
        }
        this.status = ExecutionStatus.FAILED;
        this.error = error;
        this.durationSeconds = elapsedSeconds(now);
        this.completedAt = now;
    }

    public void cancel(Instant now) {
        if (!status.isCancellable()) {
            throw new InvalidStateTransitionException(
                "Execution " + id + " cannot be cancelled in status " + status);
        }
        this.status = ExecutionStatus.CANCELLED;
        this.error = CANCELLED_BY_USER;
        this.completedAt = now;
    }

    private Double elapsedSeconds(Instant now) {
        if (startedAt == null) {
            return 0.0;
        }
        return Duration.between(startedAt, now).toMillis() / 1000.0;
    }
}
