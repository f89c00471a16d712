package com.whereq.orchestra.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.orchestra.client.AutomationServiceClient;
import com.whereq.orchestra.client.GenerateResponse;
import com.whereq.orchestra.dto.GenerateJobInput;
import com.whereq.orchestra.exception.AutomationServiceException;
import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.Playbook;
import com.whereq.orchestra.model.PlaybookStatus;
import com.whereq.orchestra.notification.Channels;
import com.whereq.orchestra.notification.NotificationEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GenerateTaskProcessorTest {

    @TempDir
    Path playbookDir;

    private final ProcessorTestSupport support = new ProcessorTestSupport();
    private final AutomationServiceClient automationService = mock(AutomationServiceClient.class);
    private GenerateTaskProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new GenerateTaskProcessor(automationService, support.playbookStore,
            support.fileStore(playbookDir), support.eventPublisher, support.objectMapper);
    }

    @Test
    void createsValidatedPlaybookFromGeneratedContent() throws Exception {
        when(automationService.generate(any())).thenReturn(Mono.just(GenerateResponse.builder()
            .content("- hosts: web\n  tasks: []\n")
            .contentType("ansible")
            .validation(new GenerateResponse.EmbeddedValidation(true, List.of()))
            .build()));
        JobContext context = support.context(JobType.GENERATE,
            GenerateJobInput.builder().prompt("Install nginx on web servers").userId("u1").build(), null);

        JsonNode result = processor.process(context).block();

        String playbookId = result.get("playbookId").asText();
        assertThat(context.getJob().getPlaybookId()).isEqualTo(playbookId);
        assertThat(result.get("playbookType").asText()).isEqualTo("ansible");
        assertThat(result.get("validation").get("valid").asBoolean()).isTrue();
        assertThat(support.reported).containsExactly(70, 80);

        Playbook playbook = support.playbookStore.findById(playbookId).block();
        assertThat(playbook.getStatus()).isEqualTo(PlaybookStatus.VALIDATED);
        assertThat(playbook.getName()).isEqualTo("Generated: Install nginx on web servers");
        assertThat(playbook.getVersion()).isEqualTo(1);
        assertThat(playbook.getCreatedById()).isEqualTo("u1");
        assertThat(Files.readString(Path.of(playbook.getFilePath()))).isEqualTo("- hosts: web\n  tasks: []\n");
    }

    @Test
    void playbookWithoutPassingValidationStaysDraft() {
        when(automationService.generate(any())).thenReturn(Mono.just(GenerateResponse.builder()
            .content("- hosts: web")
            .build()));
        JobContext context = support.context(JobType.GENERATE,
            GenerateJobInput.builder().name("Web").prompt("p").build(), null);

        JsonNode result = processor.process(context).block();

        Playbook playbook = support.playbookStore.findById(result.get("playbookId").asText()).block();
        assertThat(playbook.getStatus()).isEqualTo(PlaybookStatus.DRAFT);
        assertThat(playbook.getName()).isEqualTo("Web");
    }

    @Test
    void publishesCreatedEventOnPlaybookChannel() {
        when(automationService.generate(any())).thenReturn(Mono.just(GenerateResponse.builder()
            .content("- hosts: all")
            .build()));
        JobContext context = support.context(JobType.GENERATE, GenerateJobInput.builder().prompt("p").build(), null);

        JsonNode result = processor.process(context).block();

        String playbookId = result.get("playbookId").asText();
        assertThat(support.publishedOn(Channels.playbook(playbookId)))
            .singleElement()
            .satisfies(envelope -> {
                assertThat(envelope.getType()).isEqualTo(NotificationEnvelope.PLAYBOOK);
                assertThat(envelope.getEvent()).isEqualTo("created");
                assertThat(envelope.getResult().get("version").asLong()).isEqualTo(1);
            });
    }

    @Test
    void serviceFailureCreatesNoPlaybook() {
        when(automationService.generate(any())).thenReturn(Mono.error(
            new AutomationServiceException("Generation service error: boom", 500)));
        JobContext context = support.context(JobType.GENERATE, GenerateJobInput.builder().prompt("p").build(), null);

        StepVerifier.create(processor.process(context))
            .expectErrorMessage("Generation service error: boom")
            .verify();
        assertThat(support.playbookStore.size()).isZero();
    }

    @Test
    void emptyContentIsAnError() {
        when(automationService.generate(any())).thenReturn(Mono.just(GenerateResponse.builder().content(" ").build()));
        JobContext context = support.context(JobType.GENERATE, GenerateJobInput.builder().prompt("p").build(), null);

        StepVerifier.create(processor.process(context))
            .expectError(AutomationServiceException.class)
            .verify();
        assertThat(support.playbookStore.size()).isZero();
    }
}
