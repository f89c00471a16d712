package com.whereq.orchestra.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.client.AutomationServiceClient;
import com.whereq.orchestra.client.ValidationResponse;
import com.whereq.orchestra.dto.ValidateJobInput;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.Playbook;
import com.whereq.orchestra.model.PlaybookStatus;
import com.whereq.orchestra.service.JobEventPublisher;
import com.whereq.orchestra.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Validates a stored playbook and records the verdict on it.
 *
 * <p>An invalid playbook still completes the job: the job reports that validation ran, the
 * playbook status reports whether it passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidateTaskProcessor implements TaskProcessor {

    private final AutomationServiceClient automationService;
    private final RecordStore<Playbook> playbookStore;
    private final JobEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Override
    public JobType type() {
        return JobType.VALIDATE;
    }

    @Override
    public Mono<JsonNode> process(JobContext context) {
        ValidateJobInput input = context.input(ValidateJobInput.class);

        return playbookStore.findById(input.getPlaybookId())
            .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("playbook", input.getPlaybookId())))
            .flatMap(playbook -> automationService.validate(playbook.getContent())
                .flatMap(response -> context.getProgress().report(80).thenReturn(response))
                .flatMap(response -> recordVerdict(playbook, response)
                    .map(saved -> {
                        eventPublisher.playbookUpdate(saved, "validated");
                        log.info("Playbook {} validated by job {}: valid={}",
                            saved.getId(), context.getJob().getId(), response.isValid());
                        return objectMapper.<JsonNode>valueToTree(response);
                    })));
    }

    private Mono<Playbook> recordVerdict(Playbook playbook, ValidationResponse response) {
        playbook.setStatus(response.isValid() ? PlaybookStatus.VALIDATED : PlaybookStatus.INVALID);
        playbook.setValidationResults(Playbook.ValidationResults.builder()
            .yamlValid(response.isYamlValid())
            .syntaxValid(response.isSyntaxValid())
            .errors(response.getErrors())
            .warnings(response.getWarnings())
            .build());
        return playbookStore.save(playbook);
    }
}
