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
public class RefineJobInput implements JobInput {

    @NotBlank(message = "Playbook id is required")
    private String playbookId;

    @NotBlank(message = "Feedback is required")
    private String feedback;

    private String userId;
}
