package com.whereq.orchestra.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.orchestra.client.AutomationServiceClient;
import com.whereq.orchestra.client.GenerateRequest;
import com.whereq.orchestra.client.GenerateResponse;
import com.whereq.orchestra.dto.GenerateJobInput;
import com.whereq.orchestra.exception.AutomationServiceException;
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
 * Generates a new playbook from a prompt and stores it
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerateTaskProcessor implements TaskProcessor {

    private static final int NAME_PROMPT_LENGTH = 50;

    private final AutomationServiceClient automationService;
    private final RecordStore<Playbook> playbookStore;
    private final PlaybookFileStore playbookFiles;
    private final JobEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Override
    public JobType type() {
        return JobType.GENERATE;
    }

    @Override
    public Mono<JsonNode> process(JobContext context) {
        GenerateJobInput input = context.input(GenerateJobInput.class);
        GenerateRequest request = GenerateRequest.builder()
            .prompt(input.getPrompt())
            .template(input.getTemplate())
            .build();

        return automationService.generate(request)
            .flatMap(response -> context.getProgress().report(70).thenReturn(response))
            .flatMap(response -> {
                if (response.getContent() == null || response.getContent().isBlank()) {
                    return Mono.error(new AutomationServiceException(
                        "Generation service returned no playbook content", 200));
                }
                return playbookFiles.write(response.getContent())
                    .flatMap(path -> context.getProgress().report(80).thenReturn(path))
                    .flatMap(path -> playbookStore.create(newPlaybook(input, response, path)))
                    .map(playbook -> {
                        context.getJob().setPlaybookId(playbook.getId());
                        eventPublisher.playbookUpdate(playbook, "created");
                        log.info("Job {} created playbook {}", context.getJob().getId(), playbook.getId());
                        return buildResult(playbook, response);
                    });
            });
    }

    private Playbook newPlaybook(GenerateJobInput input, GenerateResponse response, String filePath) {
        String prompt = input.getPrompt();
        return Playbook.builder()
            .name(input.getName() != null
                ? input.getName()
                : "Generated: " + prompt.substring(0, Math.min(prompt.length(), NAME_PROMPT_LENGTH)))
            .description(input.getDescription() != null
                ? input.getDescription()
                : "Generated from prompt: " + prompt)
            .content(response.getContent())
            .filePath(filePath)
            .template(input.getTemplate())
            .prompt(prompt)
            .status(response.hasValidContent() ? PlaybookStatus.VALIDATED : PlaybookStatus.DRAFT)
            .createdById(input.getUserId())
            .build();
    }

    private JsonNode buildResult(Playbook playbook, GenerateResponse response) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("playbookId", playbook.getId());
        result.put("playbookType", response.getContentType());
        result.set("validation", objectMapper.valueToTree(response.getValidation()));
        return result;
    }
}
