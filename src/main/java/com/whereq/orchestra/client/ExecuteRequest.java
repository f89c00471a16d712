package com.whereq.orchestra.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /execute}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecuteRequest {

    private String content;

    private String inventory;

    @JsonProperty("extra_vars")
    private Map<String, Object> extraVars;

    private String limit;

    private List<String> tags;

    @JsonProperty("skip_tags")
    private List<String> skipTags;

    @JsonProperty("check_mode")
    private boolean checkMode;

    @JsonProperty("diff_mode")
    private boolean diffMode;

    private int verbosity;
}
