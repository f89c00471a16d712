package com.whereq.orchestra.queue;

import com.whereq.orchestra.model.TaskMessage;
import reactor.core.publisher.Mono;

/**
 * One delivery of a task message to a worker. Exactly one worker holds a given delivery;
 * it must end it with {@link #ack()} or {@link #nack(Throwable, boolean)}.
 */
public interface Task {

    /**
     * Delivery identifier, unique per job and attempt
     */
    String id();

    TaskMessage payload();

    default int attempt() {
        return payload().getAttempt();
    }

    /**
     * Record transport-side progress for monitoring. Not the job's authoritative progress.
     */
    Mono<Void> updateProgress(int progress);

    /**
     * Processing finished, forget the delivery
     */
    Mono<Void> ack();

    /**
     * Processing failed. A retryable failure may be redelivered according to the queue's
     * retry policy; anything else goes to the dead-letter list.
     */
    Mono<Void> nack(Throwable error, boolean retryable);
}
