package com.whereq.orchestra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Automation script produced by GENERATE and operated on by the other job types.
 *
 * <p>{@code version}, {@code executionCount} and {@code lastExecutedAt} are attribute fields:
 * the record store keeps them apart from the document and only changes them through atomic
 * field operations, so saving a stale copy never rolls them back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Playbook implements PersistentRecord {

    public static final String VERSION = "version";
    public static final String EXECUTION_COUNT = "executionCount";
    public static final String LAST_EXECUTED_AT = "lastExecutedAt";
    public static final Set<String> ATTRIBUTE_FIELDS = Set.of(VERSION, EXECUTION_COUNT, LAST_EXECUTED_AT);

    private String id;

    private String name;

    private String description;

    private String content;

    private String filePath;

    private String template;

    private String prompt;

    @Builder.Default
    private PlaybookStatus status = PlaybookStatus.DRAFT;

    private ValidationResults validationResults;

    @Builder.Default
    private long version = 1;

    @Builder.Default
    private long executionCount = 0;

    private Instant lastExecutedAt;

    private String createdById;

    private Instant createdAt;

    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidationResults {
        private boolean yamlValid;
        private boolean syntaxValid;
        private List<String> errors;
        private List<String> warnings;
    }
}
