package com.whereq.orchestra.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue wire format: {@code {jobId, type, attempt, executionId?, <input fields>}}.
 * Input fields are flattened next to the envelope fields.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskMessage {
    /**
     * Job this task drives
     */
    private String jobId;

    private JobType type;

    /**
     * Linked execution, EXECUTE tasks only
     */
    private String executionId;

    /**
     * When the task was pushed
     */
    private Instant enqueuedAt;

    /**
     * Delivery attempt, starting at 1
     */
    @Builder.Default
    private int attempt = 1;

    /**
     * Copy of the enqueue input
     */
    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    @JsonAnySetter
    public void putField(String name, Object value) {
        if (fields == null) {
            fields = new LinkedHashMap<>();
        }
        fields.put(name, value);
    }
}
