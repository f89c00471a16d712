package com.whereq.orchestra.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.orchestra.client.AutomationServiceClient;
import com.whereq.orchestra.client.GenerateRequest;
import com.whereq.orchestra.client.GenerateResponse;
import com.whereq.orchestra.dto.RefineJobInput;
import com.whereq.orchestra.exception.AutomationServiceException;
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
 * Regenerates an existing playbook from user feedback. The version counter moves through an atomic
 * increment, never through a read-modify-write of the stored document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefineTaskProcessor implements TaskProcessor {

    private final AutomationServiceClient automationService;
    private final RecordStore<Playbook> playbookStore;
    private final PlaybookFileStore playbookFiles;
    private final JobEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Override
    public JobType type() {
        return JobType.REFINE;
    }

    @Override
    public Mono<JsonNode> process(JobContext context) {
        RefineJobInput input = context.input(RefineJobInput.class);

        return playbookStore.findById(input.getPlaybookId())
            .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("playbook", input.getPlaybookId())))
            .flatMap(playbook -> automationService.generate(GenerateRequest.builder()
                    .prompt(refinementPrompt(playbook, input.getFeedback()))
                    .template(playbook.getTemplate())
                    .build())
                .flatMap(response -> context.getProgress().report(70).thenReturn(response))
                .flatMap(response -> {
                    if (response.getContent() == null || response.getContent().isBlank()) {
                        return Mono.error(new AutomationServiceException(
                            "Generation service returned no refined content", 200));
                    }
                    return applyRefinement(playbook, response)
                        .flatMap(version -> context.getProgress().report(90).thenReturn(version))
                        .map(version -> {
                            playbook.setVersion(version);
                            context.getJob().setPlaybookId(playbook.getId());
                            eventPublisher.playbookUpdate(playbook, "updated");
                            log.info("Playbook {} refined to version {} by job {}",
                                playbook.getId(), version, context.getJob().getId());
                            return buildResult(playbook, response);
                        });
                }));
    }

    private Mono<Long> applyRefinement(Playbook playbook, GenerateResponse response) {
        playbook.setContent(response.getContent());
        playbook.setStatus(response.hasValidContent() ? PlaybookStatus.VALIDATED : PlaybookStatus.DRAFT);

        Mono<Void> file = playbook.getFilePath() != null
            ? playbookFiles.rewrite(playbook.getFilePath(), response.getContent())
            : Mono.empty();

        return file
            .then(playbookStore.save(playbook))
            .then(playbookStore.increment(playbook.getId(), Playbook.VERSION, 1));
    }

    static String refinementPrompt(Playbook playbook, String feedback) {
        return "Please improve the following Ansible playbook based on this feedback:\n\n"
            + "Current playbook:\n```yaml\n" + playbook.getContent() + "\n```\n\n"
            + "Feedback: " + feedback + "\n\n"
            + "Generate an improved version that addresses the feedback.";
    }

    private JsonNode buildResult(Playbook playbook, GenerateResponse response) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("playbookId", playbook.getId());
        result.put("version", playbook.getVersion());
        result.set("validation", objectMapper.valueToTree(response.getValidation()));
        return result;
    }
}
