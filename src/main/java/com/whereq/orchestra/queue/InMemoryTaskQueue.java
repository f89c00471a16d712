package com.whereq.orchestra.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.model.RetryPolicy;
import com.whereq.orchestra.model.TaskMessage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process queue with the same delivery contract as {@link RedisTaskQueue}. Messages travel as
 * JSON, so workers never share an instance with the enqueuer.
 */
@Slf4j
public class InMemoryTaskQueue implements TaskQueue {

    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final String name;

    private final ConcurrentLinkedDeque<String> waiting = new ConcurrentLinkedDeque<>();
    private final Map<String, String> inFlight = new ConcurrentHashMap<>();
    private final Map<String, Integer> progress = new ConcurrentHashMap<>();
    private final List<String> failed = new CopyOnWriteArrayList<>();
    private final AtomicLong deliveries = new AtomicLong();

    public InMemoryTaskQueue(ObjectMapper objectMapper, RetryPolicy retryPolicy, String name) {
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<Void> push(TaskMessage message) {
        return Mono.fromRunnable(() -> {
            waiting.addLast(serialize(message));
            log.info("Enqueued task for job {} on {}, queue size: {}", message.getJobId(), name, waiting.size());
        });
    }

    @Override
    public Mono<Task> poll() {
        return Mono.fromCallable(() -> {
            String json = waiting.pollFirst();
            if (json == null) {
                return null;
            }
            String deliveryId = name + "-" + deliveries.incrementAndGet();
            inFlight.put(deliveryId, json);
            return new InMemoryTask(deliveryId, objectMapper.readValue(json, TaskMessage.class));
        });
    }

    @Override
    public Mono<Long> size() {
        return Mono.fromSupplier(() -> (long) waiting.size());
    }

    @Override
    public Mono<Long> recoverInFlight() {
        return Mono.fromSupplier(() -> {
            long recovered = 0;
            for (String deliveryId : List.copyOf(inFlight.keySet())) {
                String json = inFlight.remove(deliveryId);
                if (json != null) {
                    waiting.addFirst(json);
                    recovered++;
                }
            }
            return recovered;
        });
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public List<String> deadLetters() {
        return List.copyOf(failed);
    }

    public Integer progressOf(String jobId) {
        return progress.get(jobId);
    }

    private String serialize(TaskMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task for job " + message.getJobId(), e);
        }
    }

    private final class InMemoryTask implements Task {

        private final String deliveryId;
        private final TaskMessage message;

        private InMemoryTask(String deliveryId, TaskMessage message) {
            this.deliveryId = deliveryId;
            this.message = message;
        }

        @Override
        public String id() {
            return deliveryId;
        }

        @Override
        public TaskMessage payload() {
            return message;
        }

        @Override
        public Mono<Void> updateProgress(int value) {
            return Mono.fromRunnable(() -> progress.put(message.getJobId(), value));
        }

        @Override
        public Mono<Void> ack() {
            return Mono.fromRunnable(() -> {
                inFlight.remove(deliveryId);
                progress.remove(message.getJobId());
            });
        }

        @Override
        public Mono<Void> nack(Throwable error, boolean retryable) {
            return Mono.defer(() -> {
                progress.remove(message.getJobId());
                if (retryable && retryPolicy.allowsAnotherAttempt(message.getAttempt())) {
                    TaskMessage next = message.toBuilder().attempt(message.getAttempt() + 1).build();
                    Mono.delay(retryPolicy.backoffAfter(message.getAttempt()))
                        .then(push(next))
                        .doFinally(signal -> inFlight.remove(deliveryId))
                        .subscribe();
                    return Mono.empty();
                }
                log.warn("Task for job {} on {} failed permanently after attempt {}: {}",
                    message.getJobId(), name, message.getAttempt(), error.getMessage());
                String json = inFlight.remove(deliveryId);
                if (json != null) {
                    failed.add(json);
                }
                return Mono.empty();
            });
        }
    }
}
