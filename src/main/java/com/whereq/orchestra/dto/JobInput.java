package com.whereq.orchestra.dto;

/**
 * Typed enqueue input. Snapshotted into {@code Job.input} and copied into the task message.
 */
public interface JobInput {

    /**
     * Requester identity, opaque to the orchestrator
     */
    String getUserId();

    /**
     * Playbook the job operates on, when it already exists
     */
    default String getPlaybookId() {
        return null;
    }
}
