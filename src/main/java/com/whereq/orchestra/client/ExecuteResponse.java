package com.whereq.orchestra.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.whereq.orchestra.model.ExecutionStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of {@code POST /execute}. {@code success=false} is a completed run whose
 * playbook failed, not a transport error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecuteResponse {

    private boolean success;

    private String output;

    private String error;

    private ExecutionStats stats;

    @JsonProperty("duration_seconds")
    private Double durationSeconds;
}
