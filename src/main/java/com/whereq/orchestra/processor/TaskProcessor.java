package com.whereq.orchestra.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.orchestra.model.JobType;
import reactor.core.publisher.Mono;

/**
 * Type-specific side-effecting work for a job
 */
public interface TaskProcessor {

    /**
     * Job type this processor handles
     */
    JobType type();

    /**
     * Run the job. The worker owns the job's status: the processor only reports progress,
     * may set linked ids on the job, and returns the result payload.
     *
     * @param context job, message and progress callback
     * @return the value stored as {@code Job.result}; an error fails the job
     */
    Mono<JsonNode> process(JobContext context);
}
