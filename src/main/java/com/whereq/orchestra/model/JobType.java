package com.whereq.orchestra.model;

import java.util.Locale;

/**
 * Kinds of work the orchestrator dispatches. Each type owns one task queue and one worker pool.
 */
public enum JobType {
    GENERATE,
    VALIDATE,
    LINT,
    EXECUTE,
    REFINE;

    /**
     * Queue name used on the wire and in configuration keys
     */
    public String queueName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
