package com.whereq.orchestra.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.TestObjectMappers;
import com.whereq.orchestra.client.AutomationServiceClient;
import com.whereq.orchestra.client.ExecuteResponse;
import com.whereq.orchestra.client.ValidationResponse;
import com.whereq.orchestra.config.OrchestraProperties;
import com.whereq.orchestra.dto.ExecuteJobInput;
import com.whereq.orchestra.dto.ExecuteJobSubmission;
import com.whereq.orchestra.dto.GenerateJobInput;
import com.whereq.orchestra.dto.LintJobInput;
import com.whereq.orchestra.dto.ValidateJobInput;
import com.whereq.orchestra.exception.AutomationServiceException;
import com.whereq.orchestra.exception.EnqueueException;
import com.whereq.orchestra.exception.InvalidStateTransitionException;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.Execution;
import com.whereq.orchestra.model.ExecutionStatus;
import com.whereq.orchestra.model.Job;
import com.whereq.orchestra.model.JobStatus;
import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.Playbook;
import com.whereq.orchestra.model.PlaybookStatus;
import com.whereq.orchestra.model.RetryPolicy;
import com.whereq.orchestra.model.TaskMessage;
import com.whereq.orchestra.notification.Channels;
import com.whereq.orchestra.notification.LocalNotificationBus;
import com.whereq.orchestra.notification.NotificationEnvelope;
import com.whereq.orchestra.notification.PublishResult;
import com.whereq.orchestra.processor.ExecuteTaskProcessor;
import com.whereq.orchestra.processor.GenerateTaskProcessor;
import com.whereq.orchestra.processor.LintTaskProcessor;
import com.whereq.orchestra.processor.PlaybookFileStore;
import com.whereq.orchestra.processor.RefineTaskProcessor;
import com.whereq.orchestra.processor.ValidateTaskProcessor;
import com.whereq.orchestra.queue.InMemoryTaskQueue;
import com.whereq.orchestra.queue.TaskQueueRegistry;
import com.whereq.orchestra.store.InMemoryRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobQueueManagerTest {

    @TempDir
    Path playbookDir;

    private final ObjectMapper objectMapper = TestObjectMappers.create();
    private final AtomicReference<RuntimeException> jobWriteFailure = new AtomicReference<>();
    private final AtomicReference<RuntimeException> pushFailure = new AtomicReference<>();
    private final InMemoryRecordStore<Job> jobStore =
        new InMemoryRecordStore<>(objectMapper, "job", Job.class, Set.of()) {
            @Override
            public Mono<Job> create(Job record) {
                RuntimeException failure = jobWriteFailure.get();
                return failure != null ? Mono.error(failure) : super.create(record);
            }
        };
    private final InMemoryRecordStore<Execution> executionStore =
        new InMemoryRecordStore<>(objectMapper, "execution", Execution.class, Set.of());
    private final InMemoryRecordStore<Playbook> playbookStore =
        new InMemoryRecordStore<>(objectMapper, "playbook", Playbook.class, Playbook.ATTRIBUTE_FIELDS);
    private final TaskQueueRegistry queues = new TaskQueueRegistry(type ->
        new InMemoryTaskQueue(objectMapper, RetryPolicy.defaultPolicy(), type.queueName()) {
            @Override
            public Mono<Void> push(TaskMessage message) {
                RuntimeException failure = pushFailure.get();
                return failure != null ? Mono.error(failure) : super.push(message);
            }
        });
    private final List<NotificationEnvelope> published = new CopyOnWriteArrayList<>();
    private final LocalNotificationBus bus = new LocalNotificationBus() {
        @Override
        public PublishResult publish(NotificationEnvelope envelope) {
            published.add(envelope);
            return super.publish(envelope);
        }
    };
    private final AutomationServiceClient automationService = mock(AutomationServiceClient.class);

    private JobQueueManager manager;

    @BeforeEach
    void setUp() {
        OrchestraProperties properties = new OrchestraProperties();
        properties.getQueue().setPollInterval(Duration.ofMillis(10));
        properties.getShutdown().setDrainTimeout(Duration.ofSeconds(5));
        properties.getPlaybooks().setDirectory(playbookDir.toString());

        JobEventPublisher eventPublisher = new JobEventPublisher(bus, objectMapper);
        PlaybookFileStore playbookFiles = new PlaybookFileStore(properties);
        JobWorker worker = new JobWorker(jobStore, List.of(
            new GenerateTaskProcessor(automationService, playbookStore, playbookFiles, eventPublisher, objectMapper),
            new ValidateTaskProcessor(automationService, playbookStore, eventPublisher, objectMapper),
            new LintTaskProcessor(automationService, playbookStore),
            new ExecuteTaskProcessor(automationService, playbookStore, executionStore, eventPublisher, objectMapper),
            new RefineTaskProcessor(automationService, playbookStore, playbookFiles, eventPublisher, objectMapper)),
            eventPublisher, objectMapper, new SimpleMeterRegistry());

        manager = new JobQueueManager(jobStore, executionStore, queues, worker, eventPublisher, objectMapper,
            Validation.buildDefaultValidatorFactory().getValidator(), properties);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private Job awaitTerminal(String jobId) {
        return Mono.defer(() -> manager.findJob(jobId))
            .filter(job -> job.getStatus().isTerminal())
            .repeatWhenEmpty(500, repeats -> repeats.delayElements(Duration.ofMillis(20)))
            .block(Duration.ofSeconds(15));
    }

    private Playbook storedPlaybook() {
        return playbookStore.create(Playbook.builder().name("web").content("- hosts: all").build()).block();
    }

    private List<NotificationEnvelope> jobEvents(String jobId) {
        return published.stream().filter(e -> Channels.job(jobId).equals(e.getChannel())).toList();
    }

    @Test
    void enqueuePersistsQueuedJobBeforeTaskIsVisible() {
        Playbook playbook = storedPlaybook();

        Job job = manager.queueLintJob(LintJobInput.builder().playbookId(playbook.getId()).userId("u1").build()).block();

        Job stored = jobStore.findById(job.getId()).block();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(stored.getProgress()).isZero();
        assertThat(stored.getError()).isNull();
        assertThat(stored.getPlaybookId()).isEqualTo(playbook.getId());
        assertThat(stored.getCreatedById()).isEqualTo("u1");
        assertThat(stored.getInput().get("playbookId").asText()).isEqualTo(playbook.getId());

        assertThat(jobEvents(job.getId()))
            .singleElement()
            .satisfies(event -> {
                assertThat(event.getStatus()).isEqualTo("QUEUED");
                assertThat(event.getProgress()).isZero();
            });

        StepVerifier.create(manager.queueDepths())
            .assertNext(depths -> {
                assertThat(depths).containsEntry(JobType.LINT, 1L);
                assertThat(depths).containsEntry(JobType.GENERATE, 0L);
            })
            .verifyComplete();

        TaskMessage message = queues.queueFor(JobType.LINT).poll().block().payload();
        assertThat(message.getJobId()).isEqualTo(job.getId());
        assertThat(message.getType()).isEqualTo(JobType.LINT);
        assertThat(message.getFields()).containsEntry("playbookId", playbook.getId());
    }

    @Test
    void invalidInputIsRejectedBeforeAnythingIsStored() {
        StepVerifier.create(manager.queueGenerateJob(GenerateJobInput.builder().prompt(" ").build()))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prompt"))
            .verify();

        assertThat(jobStore.size()).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    void executeEnqueueLinksPendingExecution() {
        Playbook playbook = storedPlaybook();

        ExecuteJobSubmission submission = manager.queueExecuteJob(ExecuteJobInput.builder()
            .playbookId(playbook.getId())
            .inventory("localhost,")
            .extraVars(Map.of("env", "staging"))
            .build()).block();

        assertThat(submission.getJob().getExecutionId()).isEqualTo(submission.getExecution().getId());
        Execution execution = executionStore.findById(submission.getExecution().getId()).block();
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(execution.getPlaybookId()).isEqualTo(playbook.getId());
        assertThat(execution.getExtraVars()).containsEntry("env", "staging");
        assertThat(executionStore.size()).isEqualTo(1);

        TaskMessage message = queues.queueFor(JobType.EXECUTE).poll().block().payload();
        assertThat(message.getExecutionId()).isEqualTo(execution.getId());
    }

    @Test
    void generationServiceErrorFailsJobWithoutCreatingPlaybook() {
        when(automationService.generate(any())).thenReturn(Mono.error(
            new AutomationServiceException("Generation service error: boom", 500)));
        manager.start();

        Job job = manager.queueGenerateJob(GenerateJobInput.builder().prompt("Install nginx").build()).block();
        Job finished = awaitTerminal(job.getId());

        assertThat(finished.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(finished.getError()).contains("boom");
        assertThat(finished.getCompletedAt()).isNotNull();
        assertThat(playbookStore.size()).isZero();

        List<NotificationEnvelope> events = jobEvents(job.getId());
        assertThat(events).extracting(NotificationEnvelope::getStatus)
            .containsExactly("QUEUED", "PROCESSING", "FAILED");
        assertThat(events).extracting(NotificationEnvelope::getProgress).isSorted();
    }

    @Test
    void invalidPlaybookStillCompletesValidationJob() {
        Playbook playbook = storedPlaybook();
        when(automationService.validate(anyString())).thenReturn(Mono.just(ValidationResponse.builder()
            .valid(false)
            .yamlValid(true)
            .errors(List.of("unknown module"))
            .build()));
        manager.start();

        Job job = manager.queueValidateJob(ValidateJobInput.builder().playbookId(playbook.getId()).build()).block();
        Job finished = awaitTerminal(job.getId());

        assertThat(finished.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(finished.getProgress()).isEqualTo(100);
        assertThat(finished.getResult().get("valid").asBoolean()).isFalse();
        assertThat(playbookStore.findById(playbook.getId()).block().getStatus()).isEqualTo(PlaybookStatus.INVALID);
    }

    @Test
    void concurrentExecutionsOfOnePlaybookAreAllCounted() {
        Playbook playbook = storedPlaybook();
        when(automationService.execute(any())).thenAnswer(invocation -> Mono.just(ExecuteResponse.builder()
                .success(true)
                .output("ok")
                .durationSeconds(0.1)
                .build())
            .delayElement(Duration.ofMillis(50)));
        manager.start();

        ExecuteJobInput input = ExecuteJobInput.builder().playbookId(playbook.getId()).inventory("localhost,").build();
        ExecuteJobSubmission first = manager.queueExecuteJob(input).block();
        ExecuteJobSubmission second = manager.queueExecuteJob(input).block();

        assertThat(awaitTerminal(first.getJob().getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(awaitTerminal(second.getJob().getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);

        Playbook counted = playbookStore.findById(playbook.getId()).block();
        assertThat(counted.getExecutionCount()).isEqualTo(2);
        assertThat(executionStore.findById(first.getExecution().getId()).block().getStatus())
            .isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    void completedJobCannotBeCancelled() {
        Playbook playbook = storedPlaybook();
        when(automationService.lint(anyString()))
            .thenReturn(Mono.just(objectMapper.createObjectNode().put("passed", true)));
        manager.start();

        Job job = manager.queueLintJob(LintJobInput.builder().playbookId(playbook.getId()).build()).block();
        assertThat(awaitTerminal(job.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);

        StepVerifier.create(manager.cancelJob(job.getId()))
            .expectError(InvalidStateTransitionException.class)
            .verify();
        assertThat(jobStore.findById(job.getId()).block().getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void cancelledQueuedJobIsSkippedByWorkers() {
        Playbook playbook = storedPlaybook();
        ExecuteJobSubmission submission = manager.queueExecuteJob(ExecuteJobInput.builder()
            .playbookId(playbook.getId())
            .inventory("localhost,")
            .build()).block();

        Job cancelled = manager.cancelJob(submission.getJob().getId()).block();

        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.getCompletedAt()).isNotNull();
        assertThat(executionStore.findById(submission.getExecution().getId()).block().getStatus())
            .isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(jobEvents(cancelled.getId()))
            .extracting(NotificationEnvelope::getType)
            .containsExactly(NotificationEnvelope.PROGRESS, NotificationEnvelope.RESULT);

        manager.start();
        Mono.defer(() -> queues.queueFor(JobType.EXECUTE).size())
            .filter(size -> size == 0 && manager.pool(JobType.EXECUTE).inFlight() == 0)
            .repeatWhenEmpty(500, repeats -> repeats.delayElements(Duration.ofMillis(20)))
            .block(Duration.ofSeconds(15));

        assertThat(jobStore.findById(cancelled.getId()).block().getStatus()).isEqualTo(JobStatus.CANCELLED);
        verify(automationService, never()).execute(any());
    }

    @Test
    void cancelExecutionMarksItCancelled() {
        Playbook playbook = storedPlaybook();
        ExecuteJobSubmission submission = manager.queueExecuteJob(ExecuteJobInput.builder()
            .playbookId(playbook.getId())
            .inventory("localhost,")
            .build()).block();

        StepVerifier.create(manager.cancelExecution(submission.getExecution().getId()))
            .assertNext(execution -> {
                assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
                assertThat(execution.getError()).isEqualTo(Execution.CANCELLED_BY_USER);
            })
            .verifyComplete();
    }

    @Test
    void cancellingUnknownJobIsNotFound() {
        StepVerifier.create(manager.cancelJob("missing"))
            .expectError(RecordNotFoundException.class)
            .verify();
    }

    @Test
    void stoppedManagerRejectsNewJobs() {
        manager.shutdown();

        StepVerifier.create(manager.queueLintJob(LintJobInput.builder().playbookId("pb").build()))
            .expectError(EnqueueException.class)
            .verify();
        assertThat(jobStore.size()).isZero();
    }

    @Test
    void jobPersistFailureEnqueuesNothing() {
        jobWriteFailure.set(new IllegalStateException("redis unavailable"));

        StepVerifier.create(manager.queueLintJob(LintJobInput.builder().playbookId("pb").build()))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(EnqueueException.class)
                .hasRootCauseMessage("redis unavailable"))
            .verify();

        assertThat(jobStore.size()).isZero();
        assertThat(published).isEmpty();
        assertThat(queues.queueFor(JobType.LINT).size().block()).isZero();
    }

    @Test
    void pushFailureLeavesJobQueued() {
        pushFailure.set(new IllegalStateException("queue unavailable"));

        StepVerifier.create(manager.queueLintJob(LintJobInput.builder().playbookId("pb").build()))
            .expectError(EnqueueException.class)
            .verify();

        assertThat(jobStore.size()).isEqualTo(1);
        NotificationEnvelope queued = published.get(0);
        assertThat(queued.getStatus()).isEqualTo("QUEUED");
        assertThat(jobStore.findById(queued.getJobId()).block().getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(queues.queueFor(JobType.LINT).size().block()).isZero();
    }

    @Test
    void failedExecuteJobPersistAbortsExecution() {
        Playbook playbook = storedPlaybook();
        jobWriteFailure.set(new IllegalStateException("redis unavailable"));

        StepVerifier.create(manager.queueExecuteJob(ExecuteJobInput.builder()
                .playbookId(playbook.getId())
                .inventory("localhost,")
                .build()))
            .expectError(EnqueueException.class)
            .verify();

        assertThat(jobStore.size()).isZero();
        assertThat(executionStore.size()).isEqualTo(1);
        String executionId = published.stream()
            .map(NotificationEnvelope::getExecutionId)
            .filter(Objects::nonNull)
            .findFirst()
            .orElseThrow();
        Execution execution = executionStore.findById(executionId).block();
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getError()).startsWith("Enqueue aborted");
        assertThat(execution.getCompletedAt()).isNotNull();
        assertThat(queues.queueFor(JobType.EXECUTE).size().block()).isZero();
    }

    @Test
    void executeOfMissingPlaybookFailsJobAndExecution() {
        manager.start();

        ExecuteJobSubmission submission = manager.queueExecuteJob(ExecuteJobInput.builder()
            .playbookId("no-such-playbook")
            .inventory("localhost,")
            .build()).block();
        Job finished = awaitTerminal(submission.getJob().getId());

        assertThat(finished.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(finished.getError()).isEqualTo("Playbook not found: no-such-playbook");
        Execution execution = executionStore.findById(submission.getExecution().getId()).block();
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getCompletedAt()).isNotNull();
        verify(automationService, never()).execute(any());
    }
}
