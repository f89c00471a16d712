package com.whereq.orchestra.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerateJobInput implements JobInput {

    /**
     * Name for the playbook, derived from the prompt when absent
     */
    private String name;

    @NotBlank(message = "Prompt is required")
    private String prompt;

    private String template;

    private String description;

    private String userId;
}
