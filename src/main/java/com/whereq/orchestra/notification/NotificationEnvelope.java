package com.whereq.orchestra.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event delivered to channel subscribers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationEnvelope {

    public static final String PROGRESS = "progress";
    public static final String RESULT = "result";
    public static final String EXECUTION = "execution";
    public static final String PLAYBOOK = "playbook";

    /**
     * progress, result, execution or playbook
     */
    private String type;

    private String channel;

    private String jobId;

    private String executionId;

    private String playbookId;

    /**
     * 0-100, job events only
     */
    private Integer progress;

    private String status;

    /**
     * Terminal payload; for failures {@code {"error": "..."}}
     */
    private JsonNode result;

    /**
     * Run output, execution events only
     */
    private String output;

    /**
     * created / updated / validated, playbook events only
     */
    private String event;

    private Instant timestamp;
}
