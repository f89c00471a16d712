package com.whereq.orchestra.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.orchestra.model.Execution;
import com.whereq.orchestra.model.Job;
import com.whereq.orchestra.model.JobStatus;
import com.whereq.orchestra.model.Playbook;
import com.whereq.orchestra.notification.Channels;
import com.whereq.orchestra.notification.NotificationBus;
import com.whereq.orchestra.notification.NotificationEnvelope;
import com.whereq.orchestra.notification.PublishResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Turns job, execution and playbook state changes into bus events.
 *
 * <p>Every method is a failure boundary: a broken bus is logged and reported in the returned
 * {@link PublishResult}, never thrown, so a notification problem cannot fail a job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobEventPublisher {

    private final NotificationBus notificationBus;
    private final ObjectMapper objectMapper;

    /**
     * Non-terminal job event
     */
    public PublishResult jobProgress(Job job) {
        return publish(NotificationEnvelope.builder()
            .type(NotificationEnvelope.PROGRESS)
            .channel(Channels.job(job.getId()))
            .jobId(job.getId())
            .executionId(job.getExecutionId())
            .progress(job.getProgress())
            .status(job.getStatus().name())
            .timestamp(Instant.now())
            .build());
    }

    /**
     * Terminal job event: the result on COMPLETED, {@code {"error": ...}} on FAILED
     */
    public PublishResult jobResult(Job job) {
        return publish(NotificationEnvelope.builder()
            .type(NotificationEnvelope.RESULT)
            .channel(Channels.job(job.getId()))
            .jobId(job.getId())
            .executionId(job.getExecutionId())
            .playbookId(job.getPlaybookId())
            .progress(job.getProgress())
            .status(job.getStatus().name())
            .result(terminalPayload(job))
            .timestamp(Instant.now())
            .build());
    }

    public PublishResult executionUpdate(Execution execution) {
        return executionUpdate(execution, execution.getOutput());
    }

    public PublishResult executionUpdate(Execution execution, String output) {
        return publish(NotificationEnvelope.builder()
            .type(NotificationEnvelope.EXECUTION)
            .channel(Channels.execution(execution.getId()))
            .executionId(execution.getId())
            .playbookId(execution.getPlaybookId())
            .status(execution.getStatus().name())
            .output(output)
            .timestamp(Instant.now())
            .build());
    }

    public PublishResult playbookUpdate(Playbook playbook, String event) {
        ObjectNode summary = objectMapper.createObjectNode()
            .put("id", playbook.getId())
            .put("name", playbook.getName())
            .put("status", playbook.getStatus().name())
            .put("version", playbook.getVersion());
        return publish(NotificationEnvelope.builder()
            .type(NotificationEnvelope.PLAYBOOK)
            .channel(Channels.playbook(playbook.getId()))
            .playbookId(playbook.getId())
            .status(playbook.getStatus().name())
            .event(event)
            .result(summary)
            .timestamp(Instant.now())
            .build());
    }

    private JsonNode terminalPayload(Job job) {
        if (job.getStatus() == JobStatus.COMPLETED) {
            return job.getResult();
        }
        if (job.getStatus() == JobStatus.FAILED) {
            return objectMapper.createObjectNode().put("error", job.getError());
        }
        return objectMapper.createObjectNode().put("message", "Job " + job.getStatus().name().toLowerCase());
    }

    private PublishResult publish(NotificationEnvelope envelope) {
        try {
            PublishResult result = notificationBus.publish(envelope);
            log.debug("Published {} on {} to {} subscriber(s)",
                envelope.getType(), envelope.getChannel(), result.getDelivered());
            return result;
        } catch (RuntimeException e) {
            log.warn("Dropped {} event on {}: {}", envelope.getType(), envelope.getChannel(), e.getMessage());
            return PublishResult.failed(envelope.getChannel(), 0, 0, e);
        }
    }
}
