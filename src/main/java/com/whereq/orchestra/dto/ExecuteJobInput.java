package com.whereq.orchestra.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Input for running a playbook against an inventory
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecuteJobInput implements JobInput {

    @NotBlank(message = "Playbook id is required")
    private String playbookId;

    @NotBlank(message = "Inventory is required")
    private String inventory;

    private Map<String, Object> extraVars;

    private boolean checkMode;

    private List<String> tags;

    private List<String> skipTags;

    /**
     * Host pattern restricting the run
     */
    private String limit;

    private boolean diffMode;

    /**
     * Number of -v flags, 0-4
     */
    @Min(0)
    @Max(4)
    private int verbosity;

    private String userId;
}
