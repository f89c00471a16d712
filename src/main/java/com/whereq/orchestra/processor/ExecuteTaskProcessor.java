package com.whereq.orchestra.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.orchestra.client.AutomationServiceClient;
import com.whereq.orchestra.client.ExecuteRequest;
import com.whereq.orchestra.client.ExecuteResponse;
import com.whereq.orchestra.dto.ExecuteJobInput;
import com.whereq.orchestra.exception.InvalidStateTransitionException;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.Execution;
import com.whereq.orchestra.model.ExecutionStatus;
import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.Playbook;
import com.whereq.orchestra.service.JobEventPublisher;
import com.whereq.orchestra.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Runs a playbook through the automation service and drives the linked execution record.
 *
 * <p>Execution: PENDING → RUNNING right before the call, then SUCCESS / FAILED from the reported
 * outcome. The playbook's execution counter is bumped with an atomic increment, so concurrent runs
 * of the same playbook never lose an update.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecuteTaskProcessor implements TaskProcessor {

    private final AutomationServiceClient automationService;
    private final RecordStore<Playbook> playbookStore;
    private final RecordStore<Execution> executionStore;
    private final JobEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Override
    public JobType type() {
        return JobType.EXECUTE;
    }

    @Override
    public Mono<JsonNode> process(JobContext context) {
        ExecuteJobInput input = context.input(ExecuteJobInput.class);
        String executionId = context.getMessage().getExecutionId() != null
            ? context.getMessage().getExecutionId()
            : context.getJob().getExecutionId();

        return executionStore.findById(executionId)
            .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("execution", executionId)))
            .flatMap(execution -> playbookStore.findById(input.getPlaybookId())
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("playbook", input.getPlaybookId())))
                .flatMap(playbook -> run(context, input, playbook, execution))
                .onErrorResume(e -> abort(execution, e).then(Mono.<JsonNode>error(e))));
    }

    private Mono<JsonNode> run(JobContext context, ExecuteJobInput input, Playbook playbook, Execution execution) {
        if (execution.getStatus() == ExecutionStatus.CANCELLED) {
            return Mono.error(new InvalidStateTransitionException(
                "Execution " + execution.getId() + " was cancelled before it started"));
        }

        execution.start(describeCommand(input, playbook), Instant.now());

        return executionStore.save(execution)
            .doOnNext(running -> {
                eventPublisher.executionUpdate(running, "Execution started...");
                log.info("Execution {} of playbook {} started by job {}",
                    running.getId(), playbook.getId(), context.getJob().getId());
            })
            .then(automationService.execute(toRequest(input, playbook)))
            .flatMap(response -> context.getProgress().report(80).thenReturn(response))
            .flatMap(response -> finish(execution, response))
            .flatMap(finished -> countExecution(playbook.getId()).thenReturn(finished))
            .flatMap(finished -> context.getProgress().report(95).thenReturn(finished))
            .map(this::buildResult);
    }

    /**
     * Records the outcome on the latest stored copy, which may carry a cancel marker set while the
     * run was in flight.
     */
    private Mono<Execution> finish(Execution running, ExecuteResponse response) {
        return executionStore.findById(running.getId())
            .defaultIfEmpty(running)
            .flatMap(current -> {
                current.finish(response.isSuccess(), response.getOutput(),
                    response.getError() != null ? response.getError() : "",
                    response.getStats(), response.getDurationSeconds(), Instant.now());
                return executionStore.save(current);
            })
            .doOnNext(saved -> {
                eventPublisher.executionUpdate(saved);
                log.info("Execution {} finished with status {}", saved.getId(), saved.getStatus());
            });
    }

    /**
     * Fail an execution whose run could not complete. A stored copy that already reached a
     * terminal status (finished, or cancelled by the user) is left as it is.
     */
    private Mono<Void> abort(Execution execution, Throwable error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return executionStore.findById(execution.getId())
            .filter(current -> !current.getStatus().isTerminal())
            .flatMap(current -> {
                current.abort(reason, Instant.now());
                return executionStore.save(current);
            })
            .doOnNext(aborted -> {
                eventPublisher.executionUpdate(aborted);
                log.warn("Execution {} aborted: {}", aborted.getId(), reason);
            })
            .onErrorResume(e -> {
                log.error("Execution {} could not be marked failed: {}", execution.getId(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private Mono<Void> countExecution(String playbookId) {
        return playbookStore.increment(playbookId, Playbook.EXECUTION_COUNT, 1)
            .doOnNext(count -> log.debug("Playbook {} execution count is now {}", playbookId, count))
            .then(playbookStore.updateField(playbookId, Playbook.LAST_EXECUTED_AT, Instant.now()));
    }

    private ExecuteRequest toRequest(ExecuteJobInput input, Playbook playbook) {
        return ExecuteRequest.builder()
            .content(playbook.getContent())
            .inventory(input.getInventory())
            .extraVars(input.getExtraVars())
            .limit(input.getLimit())
            .tags(input.getTags())
            .skipTags(input.getSkipTags())
            .checkMode(input.isCheckMode())
            .diffMode(input.isDiffMode())
            .verbosity(input.getVerbosity())
            .build();
    }

    private JsonNode buildResult(Execution execution) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("executionId", execution.getId());
        result.put("success", execution.getStatus() == ExecutionStatus.SUCCESS);
        result.put("status", execution.getStatus().name());
        result.put("output", execution.getOutput());
        result.put("error", execution.getError());
        result.put("durationSeconds", execution.getDurationSeconds());
        result.set("stats", objectMapper.valueToTree(execution.getStats()));
        return result;
    }

    /**
     * Invocation line recorded on the execution, for display and audit
     */
    String describeCommand(ExecuteJobInput input, Playbook playbook) {
        StringBuilder command = new StringBuilder("ansible-playbook");
        command.append(" -i ").append(input.getInventory());
        if (input.isCheckMode()) {
            command.append(" --check");
        }
        if (input.isDiffMode()) {
            command.append(" --diff");
        }
        if (input.getVerbosity() > 0) {
            command.append(" -").append("v".repeat(input.getVerbosity()));
        }
        if (input.getLimit() != null && !input.getLimit().isBlank()) {
            command.append(" --limit ").append(input.getLimit());
        }
        appendList(command, "--tags", input.getTags());
        appendList(command, "--skip-tags", input.getSkipTags());
        if (input.getExtraVars() != null && !input.getExtraVars().isEmpty()) {
            try {
                command.append(" -e '").append(objectMapper.writeValueAsString(input.getExtraVars())).append("'");
            } catch (JsonProcessingException e) {
                log.warn("Could not render extra vars for playbook {}: {}", playbook.getId(), e.getMessage());
            }
        }
        command.append(' ').append(playbook.getFilePath() != null ? playbook.getFilePath() : playbook.getId() + ".yml");
        return command.toString();
    }

    private static void appendList(StringBuilder command, String flag, List<String> values) {
        if (values != null && !values.isEmpty()) {
            command.append(' ').append(flag).append(' ').append(String.join(",", values));
        }
    }
}
