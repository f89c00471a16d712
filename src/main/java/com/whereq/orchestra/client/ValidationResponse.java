package com.whereq.orchestra.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of {@code POST /validate}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationResponse {

    private boolean valid;

    @JsonProperty("yaml_valid")
    private boolean yamlValid;

    @JsonProperty("syntax_valid")
    private boolean syntaxValid;

    private List<String> errors;

    private List<String> warnings;
}
