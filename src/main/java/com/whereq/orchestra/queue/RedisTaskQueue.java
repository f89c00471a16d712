package com.whereq.orchestra.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.model.RetryPolicy;
import com.whereq.orchestra.model.TaskMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;

/**
 * Reliable Redis queue built on lists.
 *
 * <p>Messages are LPUSHed to {@code <prefix>:queue:<name>} and taken with RPOPLPUSH into the
 * consumer's own {@code <prefix>:queue:<name>:processing:<consumerId>}, so a delivery survives a
 * worker crash until it is acknowledged. Exhausted or permanent failures land in
 * {@code <prefix>:queue:<name>:failed}.
 *
 * <p>Every consumer is listed in {@code <prefix>:queue:<name>:consumers} and holds a lease key
 * {@code <prefix>:queue:<name>:lease:<consumerId>} that expires unless renewed by
 * {@link #heartbeat()}. Recovery only reclaims the processing lists of consumers whose lease is gone.
 */
@Slf4j
public class RedisTaskQueue implements TaskQueue {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final String name;
    private final String consumerId;
    private final Duration leaseTtl;
    private final String waitingKey;
    private final String processingKey;
    private final String failedKey;
    private final String progressKey;
    private final String consumersKey;

    public RedisTaskQueue(ReactiveRedisTemplate<String, String> redisTemplate,
                          ObjectMapper objectMapper,
                          RetryPolicy retryPolicy,
                          String keyPrefix,
                          String name,
                          String consumerId,
                          Duration leaseTtl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.name = name;
        this.consumerId = consumerId;
        this.leaseTtl = leaseTtl;
        this.waitingKey = keyPrefix + ":queue:" + name;
        this.processingKey = processingKey(consumerId);
        this.failedKey = waitingKey + ":failed";
        this.progressKey = waitingKey + ":progress";
        this.consumersKey = waitingKey + ":consumers";
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<Void> push(TaskMessage message) {
        return Mono.fromCallable(() -> serialize(message))
            .flatMap(json -> redisTemplate.opsForList().leftPush(waitingKey, json))
            .doOnSuccess(size -> log.info("Enqueued task for job {} on {}, queue size: {}",
                message.getJobId(), name, size))
            .then()
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Task> poll() {
        return redisTemplate.opsForList()
            .rightPopAndLeftPush(waitingKey, processingKey)
            .flatMap(json -> {
                try {
                    TaskMessage message = objectMapper.readValue(json, TaskMessage.class);
                    log.debug("Consumed task for job {} from {}", message.getJobId(), name);
                    return Mono.<Task>just(new RedisTask(json, message));
                } catch (JsonProcessingException e) {
                    log.error("Dropping unreadable task on {}: {}", name, e.getMessage());
                    return deadLetter(json).then(Mono.<Task>empty());
                }
            });
    }

    @Override
    public Mono<Long> size() {
        return redisTemplate.opsForList().size(waitingKey)
            .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Long> recoverInFlight() {
        return redisTemplate.opsForSet().members(consumersKey)
            .filter(owner -> !owner.equals(consumerId))
            .concatMap(owner -> redisTemplate.hasKey(leaseKey(owner))
                .flatMap(alive -> Boolean.TRUE.equals(alive) ? Mono.just(0L) : reclaim(owner)))
            .reduce(0L, Long::sum)
            .flatMap(count -> register().thenReturn(count))
            .doOnSuccess(count -> {
                if (count != null && count > 0) {
                    log.warn("Recovered {} in-flight task(s) on {}", count, name);
                }
            });
    }

    /**
     * Hand the deliveries of an expired consumer back to the waiting list and forget the consumer
     */
    private Mono<Long> reclaim(String owner) {
        return moveBack(processingKey(owner), 0L)
            .flatMap(moved -> redisTemplate.opsForSet().remove(consumersKey, owner).thenReturn(moved))
            .doOnNext(moved -> log.info("Consumer {} on {} has no lease, reclaimed {} task(s)", owner, name, moved));
    }

    private Mono<Long> moveBack(String fromKey, long moved) {
        return redisTemplate.opsForList()
            .rightPopAndLeftPush(fromKey, waitingKey)
            .flatMap(json -> moveBack(fromKey, moved + 1))
            .defaultIfEmpty(moved);
    }

    private Mono<Void> register() {
        return redisTemplate.opsForSet().add(consumersKey, consumerId)
            .then(heartbeat())
            .doOnSuccess(v -> log.info("Consumer {} registered on {}", consumerId, name));
    }

    @Override
    public Mono<Void> heartbeat() {
        return redisTemplate.opsForValue()
            .set(leaseKey(consumerId), Instant.now().toString(), leaseTtl)
            .then();
    }

    /**
     * Deregister when nothing is left in flight. Otherwise the lease is left to expire, and the
     * remaining deliveries are reclaimed after that.
     */
    @Override
    public Mono<Void> close() {
        return redisTemplate.opsForList().size(processingKey)
            .defaultIfEmpty(0L)
            .flatMap(inFlight -> {
                if (inFlight > 0) {
                    log.warn("Closing {} with {} task(s) in flight, leaving them to lease expiry", name, inFlight);
                    return Mono.empty();
                }
                return redisTemplate.opsForSet().remove(consumersKey, consumerId)
                    .then(redisTemplate.delete(leaseKey(consumerId)))
                    .then();
            });
    }

    private String processingKey(String owner) {
        return waitingKey + ":processing:" + owner;
    }

    private String leaseKey(String owner) {
        return waitingKey + ":lease:" + owner;
    }

    private Mono<Void> deadLetter(String json) {
        return redisTemplate.opsForList().leftPush(failedKey, json)
            .then(redisTemplate.opsForList().remove(processingKey, 1, json))
            .then();
    }

    private String serialize(TaskMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task for job " + message.getJobId(), e);
        }
    }

    private final class RedisTask implements Task {

        private final String raw;
        private final TaskMessage message;

        private RedisTask(String raw, TaskMessage message) {
            this.raw = raw;
            this.message = message;
        }

        @Override
        public String id() {
            return message.getJobId() + ":" + message.getAttempt();
        }

        @Override
        public TaskMessage payload() {
            return message;
        }

        @Override
        public Mono<Void> updateProgress(int progress) {
            return redisTemplate.opsForHash()
                .put(progressKey, message.getJobId(), Integer.toString(progress))
                .then();
        }

        @Override
        public Mono<Void> ack() {
            return redisTemplate.opsForList().remove(processingKey, 1, raw)
                .then(redisTemplate.opsForHash().remove(progressKey, message.getJobId()))
                .doOnSuccess(v -> log.debug("Acknowledged task {} on {}", id(), name))
                .then();
        }

        @Override
        public Mono<Void> nack(Throwable error, boolean retryable) {
            Mono<Void> clearProgress = redisTemplate.opsForHash().remove(progressKey, message.getJobId()).then();

            if (retryable && retryPolicy.allowsAnotherAttempt(message.getAttempt())) {
                Duration backoff = retryPolicy.backoffAfter(message.getAttempt());
                log.info("Redelivering task for job {} on {} in {}ms (attempt {}/{})",
                    message.getJobId(), name, backoff.toMillis(), message.getAttempt() + 1,
                    retryPolicy.getMaxAttempts());

                TaskMessage next = message.toBuilder().attempt(message.getAttempt() + 1).build();

                // The old delivery stays in the processing list until the retry is stored.
                Mono.delay(backoff)
                    .then(push(next))
                    .then(redisTemplate.opsForList().remove(processingKey, 1, raw))
                    .doOnError(e -> log.error("Failed to redeliver task for job {} on {}: {}",
                        message.getJobId(), name, e.getMessage()))
                    .onErrorResume(e -> Mono.empty())
                    .subscribe();
                return clearProgress;
            }

            log.warn("Task for job {} on {} failed permanently after attempt {}: {}",
                message.getJobId(), name, message.getAttempt(), error.getMessage());
            return clearProgress.then(deadLetter(raw));
        }
    }
}
