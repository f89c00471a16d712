package com.whereq.orchestra.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of {@code POST /generate}. Older service builds name the fields
 * {@code playbook} / {@code playbook_type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerateResponse {

    @JsonAlias("playbook")
    private String content;

    @JsonProperty("content_type")
    @JsonAlias("playbook_type")
    private String contentType;

    private EmbeddedValidation validation;

    public boolean hasValidContent() {
        return validation != null && validation.isValid();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddedValidation {
        private boolean valid;
        private List<String> errors;
    }
}
