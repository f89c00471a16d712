package com.whereq.orchestra.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.model.Job;
import com.whereq.orchestra.model.TaskMessage;

/**
 * What a processor gets for one task: the job owned by the worker, the delivered message and a
 * progress callback
 */
public class JobContext {

    private final Job job;
    private final TaskMessage message;
    private final ProgressReporter progress;
    private final ObjectMapper objectMapper;

    public JobContext(Job job, TaskMessage message, ProgressReporter progress, ObjectMapper objectMapper) {
        this.job = job;
        this.message = message;
        this.progress = progress;
        this.objectMapper = objectMapper;
    }

    public Job getJob() {
        return job;
    }

    public TaskMessage getMessage() {
        return message;
    }

    public ProgressReporter getProgress() {
        return progress;
    }

    /**
     * Bind the message fields to the typed enqueue input
     */
    public <T> T input(Class<T> inputType) {
        return objectMapper.convertValue(message.getFields(), inputType);
    }
}
