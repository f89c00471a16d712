package com.whereq.orchestra.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.config.OrchestraProperties;
import com.whereq.orchestra.dto.ExecuteJobInput;
import com.whereq.orchestra.dto.ExecuteJobSubmission;
import com.whereq.orchestra.dto.GenerateJobInput;
import com.whereq.orchestra.dto.JobInput;
import com.whereq.orchestra.dto.LintJobInput;
import com.whereq.orchestra.dto.RefineJobInput;
import com.whereq.orchestra.dto.ValidateJobInput;
import com.whereq.orchestra.exception.EnqueueException;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.Execution;
import com.whereq.orchestra.model.Job;
import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.TaskMessage;
import com.whereq.orchestra.queue.TaskQueue;
import com.whereq.orchestra.queue.TaskQueueRegistry;
import com.whereq.orchestra.store.RecordStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Entry point for job submission and management.
 *
 * <p>Every {@code queue*Job} call persists the job before anything else happens, publishes the
 * QUEUED event, then pushes the task message; the returned job is already visible to readers.
 * The manager also owns the worker pools: it recovers abandoned deliveries and starts them on
 * startup, and drains them on shutdown.
 */
@Slf4j
@Service
public class JobQueueManager {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final RecordStore<Job> jobStore;
    private final RecordStore<Execution> executionStore;
    private final TaskQueueRegistry queues;
    private final JobEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final OrchestraProperties properties;

    private final Map<JobType, WorkerPool> pools = new EnumMap<>(JobType.class);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private volatile Disposable heartbeat;

    public JobQueueManager(RecordStore<Job> jobStore,
                           RecordStore<Execution> executionStore,
                           TaskQueueRegistry queues,
                           JobWorker worker,
                           JobEventPublisher eventPublisher,
                           ObjectMapper objectMapper,
                           Validator validator,
                           OrchestraProperties properties) {
        this.jobStore = jobStore;
        this.executionStore = executionStore;
        this.queues = queues;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.properties = properties;

        for (JobType type : JobType.values()) {
            pools.put(type, new WorkerPool(queues.queueFor(type), worker,
                properties.getWorkers().concurrencyFor(type), properties.getQueue().getPollInterval()));
        }
    }

    // Lifecycle

    /**
     * Put deliveries abandoned by a previous process back on their queues, then start the pools
     */
    @PostConstruct
    public void start() {
        Flux.fromIterable(queues.all())
            .flatMap(queue -> queue.recoverInFlight()
                .doOnNext(recovered -> {
                    if (recovered > 0) {
                        log.warn("Recovered {} in-flight task(s) on queue {}", recovered, queue.name());
                    }
                })
                .onErrorResume(e -> {
                    log.error("Failed to recover in-flight tasks on queue {}: {}", queue.name(), e.getMessage());
                    return Mono.empty();
                }))
            .then()
            .block();

        startHeartbeat();
        pools.values().forEach(WorkerPool::start);
        log.info("Job queue manager started with queues {}", pools.keySet());
    }

    /**
     * Keep this instance's queue leases alive while it runs, so its in-flight deliveries are not
     * reclaimed by other instances
     */
    private void startHeartbeat() {
        Duration interval = properties.getQueue().getHeartbeatInterval();
        heartbeat = Flux.interval(interval, interval)
            .concatMap(tick -> Flux.fromIterable(queues.all())
                .flatMap(queue -> queue.heartbeat()
                    .onErrorResume(e -> {
                        log.warn("Failed to renew lease on queue {}: {}", queue.name(), e.getMessage());
                        return Mono.empty();
                    }))
                .then())
            .subscribe();
    }

    /**
     * Stop accepting jobs, wait for in-flight tasks up to the drain timeout, then release the queues
     */
    @PreDestroy
    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        Duration timeout = properties.getShutdown().getDrainTimeout();
        log.info("Shutting down job queue manager, draining worker pools (timeout {})", timeout);

        Flux.fromIterable(pools.values())
            .flatMap(pool -> pool.drain(timeout))
            .then(Mono.fromRunnable(this::stopHeartbeat))
            .then(Flux.fromIterable(queues.all())
                .flatMap(TaskQueue::close)
                .then())
            .block();

        log.info("Job queue manager stopped");
    }

    private void stopHeartbeat() {
        Disposable running = heartbeat;
        if (running != null) {
            running.dispose();
        }
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    // Submission

    public Mono<Job> queueGenerateJob(GenerateJobInput input) {
        return enqueue(JobType.GENERATE, input);
    }

    public Mono<Job> queueValidateJob(ValidateJobInput input) {
        return enqueue(JobType.VALIDATE, input);
    }

    public Mono<Job> queueLintJob(LintJobInput input) {
        return enqueue(JobType.LINT, input);
    }

    public Mono<Job> queueRefineJob(RefineJobInput input) {
        return enqueue(JobType.REFINE, input);
    }

    /**
     * Create the PENDING execution, then the job linked to it, then enqueue. The execution exists
     * before the task can be seen by any worker.
     */
    public Mono<ExecuteJobSubmission> queueExecuteJob(ExecuteJobInput input) {
        return Mono.defer(() -> {
            checkAccepting();
            validate(input);

            Execution execution = Execution.builder()
                .playbookId(input.getPlaybookId())
                .inventory(input.getInventory())
                .extraVars(input.getExtraVars())
                .checkMode(input.isCheckMode())
                .tags(input.getTags())
                .executedById(input.getUserId())
                .build();

            return executionStore.create(execution)
                .onErrorMap(e -> new EnqueueException("Failed to persist execution for playbook "
                    + input.getPlaybookId(), e))
                .flatMap(created -> {
                    Job job = newJob(JobType.EXECUTE, input);
                    job.setExecutionId(created.getId());
                    return jobStore.create(job)
                        .onErrorResume(e -> abortExecution(created, e)
                            .then(Mono.<Job>error(new EnqueueException(
                                "Failed to persist job for execution " + created.getId(), e))))
                        .flatMap(saved -> dispatch(saved, input)
                            .thenReturn(new ExecuteJobSubmission(saved, created)));
                });
        });
    }

    private Mono<Job> enqueue(JobType type, JobInput input) {
        return Mono.defer(() -> {
            checkAccepting();
            validate(input);
            return jobStore.create(newJob(type, input))
                .onErrorMap(e -> new EnqueueException("Failed to persist " + type.queueName() + " job", e))
                .flatMap(saved -> dispatch(saved, input).thenReturn(saved));
        });
    }

    private Job newJob(JobType type, JobInput input) {
        return Job.builder()
            .type(type)
            .input(objectMapper.valueToTree(input))
            .playbookId(input.getPlaybookId())
            .createdById(input.getUserId())
            .build();
    }

    /**
     * Publish the QUEUED event and push the task. A push failure leaves the job QUEUED with no
     * task behind it.
     */
    private Mono<Void> dispatch(Job job, JobInput input) {
        eventPublisher.jobProgress(job);

        TaskMessage message = TaskMessage.builder()
            .jobId(job.getId())
            .type(job.getType())
            .executionId(job.getExecutionId())
            .enqueuedAt(Instant.now())
            .fields(taskFields(input))
            .build();

        return queues.queueFor(job.getType()).push(message)
            .doOnSuccess(v -> log.info("Job {} ({}) queued", job.getId(), job.getType()))
            .onErrorMap(e -> {
                log.error("Job {} persisted but its task could not be queued, it stays QUEUED: {}",
                    job.getId(), e.getMessage());
                return new EnqueueException("Failed to queue job " + job.getId(), e);
            });
    }

    private Map<String, Object> taskFields(JobInput input) {
        Map<String, Object> fields = new LinkedHashMap<>();
        objectMapper.convertValue(input, FIELDS).forEach((name, value) -> {
            if (value != null) {
                fields.put(name, value);
            }
        });
        return fields;
    }

    private Mono<Void> abortExecution(Execution execution, Throwable cause) {
        execution.abort("Enqueue aborted: " + cause.getMessage(), Instant.now());
        return executionStore.save(execution)
            .doOnNext(eventPublisher::executionUpdate)
            .onErrorResume(e -> {
                log.error("Execution {} left PENDING after a failed enqueue: {}", execution.getId(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private void checkAccepting() {
        if (!accepting.get()) {
            throw new EnqueueException("Job queue manager is shutting down, not accepting jobs");
        }
    }

    private void validate(Object input) {
        if (input == null) {
            throw new IllegalArgumentException("Job input is required");
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(input);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid job input: " + details);
        }
    }

    // Cancellation and lookup

    /**
     * Mark a QUEUED or PROCESSING job CANCELLED, along with its execution if that has not finished.
     * Work already handed to the automation service is not interrupted.
     */
    public Mono<Job> cancelJob(String jobId) {
        return jobStore.findById(jobId)
            .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("job", jobId)))
            .flatMap(job -> {
                job.cancel(Instant.now());
                return jobStore.save(job);
            })
            .flatMap(saved -> cancelLinkedExecution(saved).thenReturn(saved))
            .doOnNext(saved -> {
                eventPublisher.jobResult(saved);
                log.info("Job {} cancelled", saved.getId());
            });
    }

    private Mono<Void> cancelLinkedExecution(Job job) {
        if (job.getExecutionId() == null) {
            return Mono.empty();
        }
        return executionStore.findById(job.getExecutionId())
            .filter(execution -> execution.getStatus().isCancellable())
            .flatMap(this::markCancelled)
            .then();
    }

    /**
     * Mark a PENDING or RUNNING execution CANCELLED
     */
    public Mono<Execution> cancelExecution(String executionId) {
        return executionStore.findById(executionId)
            .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("execution", executionId)))
            .flatMap(this::markCancelled);
    }

    private Mono<Execution> markCancelled(Execution execution) {
        execution.cancel(Instant.now());
        return executionStore.save(execution)
            .doOnNext(saved -> {
                eventPublisher.executionUpdate(saved);
                log.info("Execution {} cancelled", saved.getId());
            });
    }

    public Mono<Job> findJob(String jobId) {
        return jobStore.findById(jobId);
    }

    public Mono<Execution> findExecution(String executionId) {
        return executionStore.findById(executionId);
    }

    /**
     * Waiting tasks per queue
     */
    public Mono<Map<JobType, Long>> queueDepths() {
        return Flux.fromArray(JobType.values())
            .flatMap(type -> queues.queueFor(type).size()
                .map(size -> Tuples.of(type, size)))
            .collectMap(Tuple2::getT1, Tuple2::getT2, () -> new EnumMap<JobType, Long>(JobType.class));
    }

    WorkerPool pool(JobType type) {
        return pools.get(type);
    }
}
