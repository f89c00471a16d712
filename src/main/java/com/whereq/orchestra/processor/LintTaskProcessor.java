package com.whereq.orchestra.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.orchestra.client.AutomationServiceClient;
import com.whereq.orchestra.dto.LintJobInput;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.Playbook;
import com.whereq.orchestra.store.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Runs the linter over a stored playbook; the lint report is passed through as the job result
 */
@Component
@RequiredArgsConstructor
public class LintTaskProcessor implements TaskProcessor {

    private final AutomationServiceClient automationService;
    private final RecordStore<Playbook> playbookStore;

    @Override
    public JobType type() {
        return JobType.LINT;
    }

    @Override
    public Mono<JsonNode> process(JobContext context) {
        LintJobInput input = context.input(LintJobInput.class);

        return playbookStore.findById(input.getPlaybookId())
            .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("playbook", input.getPlaybookId())))
            .flatMap(playbook -> automationService.lint(playbook.getContent()))
            .flatMap(report -> context.getProgress().report(80).thenReturn(report));
    }
}
