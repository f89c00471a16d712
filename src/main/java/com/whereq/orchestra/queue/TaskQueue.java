package com.whereq.orchestra.queue;

import com.whereq.orchestra.model.TaskMessage;
import reactor.core.publisher.Mono;

/**
 * Durable FIFO of task messages for one job type
 */
public interface TaskQueue {

    /**
     * Queue name, matches {@link com.whereq.orchestra.model.JobType#queueName()}
     */
    String name();

    /**
     * Append a message
     *
     * @param message the task to deliver
     * @return Mono that completes when the message is stored
     */
    Mono<Void> push(TaskMessage message);

    /**
     * Take the oldest waiting message and hand it out as an in-flight delivery
     *
     * @return the delivery, or empty when nothing is waiting
     */
    Mono<Task> poll();

    /**
     * Number of waiting messages
     */
    Mono<Long> size();

    /**
     * Move deliveries left in flight by consumers that are gone back to the waiting list, then
     * register this consumer. Deliveries held by live consumers are never touched.
     *
     * @return number of recovered messages
     */
    Mono<Long> recoverInFlight();

    /**
     * Renew this consumer's claim on its in-flight deliveries
     */
    default Mono<Void> heartbeat() {
        return Mono.empty();
    }

    /**
     * Release resources held by the queue. Waiting messages stay stored.
     */
    default Mono<Void> close() {
        return Mono.empty();
    }
}
