package com.whereq.orchestra.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.exception.InvalidStateTransitionException;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.Job;
import com.whereq.orchestra.model.JobStatus;
import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.TaskMessage;
import com.whereq.orchestra.processor.JobContext;
import com.whereq.orchestra.processor.TaskProcessor;
import com.whereq.orchestra.queue.Task;
import com.whereq.orchestra.store.RecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one delivered task end to end: QUEUED → PROCESSING → COMPLETED / FAILED, with progress
 * persisted and published along the way.
 *
 * <p>The worker owns the job's status while it holds the delivery. A job that is already terminal
 * when its task arrives (a redelivery, or a job cancelled while waiting) is skipped and acked.
 * Processor failures fail the job and then nack the task under the queue's retry policy; since a
 * redelivery of a FAILED job is skipped, redelivery only re-runs work whose outcome was never stored.
 */
@Slf4j
@Service
public class JobWorker {

    private final RecordStore<Job> jobStore;
    private final JobEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private final Map<JobType, TaskProcessor> processors = new EnumMap<>(JobType.class);
    private final Map<JobType, Counter> completedCounters = new EnumMap<>(JobType.class);
    private final Map<JobType, Counter> failedCounters = new EnumMap<>(JobType.class);
    private final Map<JobType, Timer> executionTimers = new EnumMap<>(JobType.class);

    public JobWorker(RecordStore<Job> jobStore,
                     List<TaskProcessor> processors,
                     JobEventPublisher eventPublisher,
                     ObjectMapper objectMapper,
                     MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;

        for (TaskProcessor processor : processors) {
            TaskProcessor previous = this.processors.put(processor.type(), processor);
            if (previous != null) {
                throw new IllegalStateException("Two processors registered for " + processor.type());
            }
        }

        for (JobType type : JobType.values()) {
            String tag = type.queueName();
            completedCounters.put(type, Counter.builder("orchestra.jobs.completed")
                .description("Number of jobs completed")
                .tag("type", tag)
                .register(meterRegistry));
            failedCounters.put(type, Counter.builder("orchestra.jobs.failed")
                .description("Number of jobs failed")
                .tag("type", tag)
                .register(meterRegistry));
            executionTimers.put(type, Timer.builder("orchestra.jobs.execution.time")
                .description("Job processing time")
                .tag("type", tag)
                .register(meterRegistry));
        }
    }

    /**
     * Process a delivery and settle it. The returned Mono completes once the task is acked or
     * nacked; it does not error.
     */
    public Mono<Void> handle(Task task) {
        TaskMessage message = task.payload();
        return jobStore.findById(message.getJobId())
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(found -> found.isPresent()
                ? run(task, found.get())
                : dropOrphan(task))
            .onErrorResume(error -> {
                log.error("Task {} for job {} failed before its outcome was stored: {}",
                    task.id(), message.getJobId(), error.getMessage(), error);
                return task.nack(error, isRetryable(error));
            })
            .onErrorResume(error -> {
                log.error("Could not nack task {}: {}", task.id(), error.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> run(Task task, Job job) {
        if (job.getStatus().isTerminal()) {
            log.info("Skipping task {}: job {} is already {}", task.id(), job.getId(), job.getStatus());
            return task.ack();
        }

        TaskProcessor processor = processors.get(job.getType());
        if (processor == null) {
            return Mono.error(new IllegalStateException("No processor registered for " + job.getType()));
        }

        JobContext context = new JobContext(job, task.payload(),
            value -> reportProgress(task, job, value), objectMapper);
        Timer.Sample sample = Timer.start(meterRegistry);

        return begin(task, job)
            .then(Mono.defer(() -> processor.process(context))
                .defaultIfEmpty(objectMapper.nullNode())
                .map(Outcome::success)
                .onErrorResume(error -> Mono.just(Outcome.failure(error))))
            .flatMap(outcome -> outcome.error == null
                ? complete(job, outcome.result).then(task.ack())
                : fail(job, outcome.error).then(task.nack(outcome.error, isRetryable(outcome.error))))
            .doFinally(signal -> sample.stop(executionTimers.get(job.getType())));
    }

    private Mono<Void> begin(Task task, Job job) {
        job.markProcessing();
        log.info("Job {} ({}) processing, attempt {}", job.getId(), job.getType(), task.attempt());
        return jobStore.save(job)
            .doOnNext(eventPublisher::jobProgress)
            .then(task.updateProgress(job.getProgress()));
    }

    /**
     * Persist and publish a progress value. Ignored when it would not raise the job's progress, or
     * when the job has been cancelled in the meantime.
     */
    private Mono<Void> reportProgress(Task task, Job job, int value) {
        int before = job.getProgress();
        int after = job.advanceProgress(value);
        if (after == before) {
            return Mono.empty();
        }
        return storedStatus(job)
            .flatMap(status -> {
                if (status == JobStatus.CANCELLED) {
                    log.debug("Job {} cancelled, not recording progress {}", job.getId(), after);
                    return Mono.empty();
                }
                return jobStore.save(job)
                    .doOnNext(eventPublisher::jobProgress)
                    .then(task.updateProgress(after));
            });
    }

    private Mono<Void> complete(Job job, JsonNode result) {
        return storedStatus(job)
            .flatMap(status -> {
                if (status == JobStatus.CANCELLED) {
                    log.info("Job {} was cancelled while running, discarding its result", job.getId());
                    return Mono.empty();
                }
                job.complete(result, Instant.now());
                return jobStore.save(job)
                    .doOnNext(saved -> {
                        completedCounters.get(saved.getType()).increment();
                        eventPublisher.jobResult(saved);
                        log.info("Job {} completed", saved.getId());
                    })
                    .then();
            });
    }

    private Mono<Void> fail(Job job, Throwable error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("Job {} failed: {}", job.getId(), reason, error);
        return storedStatus(job)
            .flatMap(status -> {
                if (status == JobStatus.CANCELLED) {
                    return Mono.empty();
                }
                job.fail(reason, Instant.now());
                return jobStore.save(job)
                    .doOnNext(saved -> {
                        failedCounters.get(saved.getType()).increment();
                        eventPublisher.jobResult(saved);
                    })
                    .then();
            });
    }

    private Mono<JobStatus> storedStatus(Job job) {
        return jobStore.findById(job.getId())
            .map(Job::getStatus)
            .defaultIfEmpty(job.getStatus());
    }

    private Mono<Void> dropOrphan(Task task) {
        log.warn("Dropping task {}: job {} does not exist", task.id(), task.payload().getJobId());
        return task.nack(new RecordNotFoundException("job", task.payload().getJobId()), false);
    }

    /**
     * Bad state and missing records do not heal on redelivery
     */
    static boolean isRetryable(Throwable error) {
        return !(error instanceof RecordNotFoundException
            || error instanceof InvalidStateTransitionException
            || error instanceof IllegalArgumentException);
    }

    private static final class Outcome {

        private final JsonNode result;
        private final Throwable error;

        private Outcome(JsonNode result, Throwable error) {
            this.result = result;
            this.error = error;
        }

        static Outcome success(JsonNode result) {
            return new Outcome(result, null);
        }

        static Outcome failure(Throwable error) {
            return new Outcome(null, error);
        }
    }
}
