package com.whereq.orchestra.exception;

/**
 * Thrown when a job, execution or playbook id does not resolve. Never retried.
 */
public class RecordNotFoundException extends RuntimeException {

    private final String kind;
    private final String id;

    public RecordNotFoundException(String kind, String id) {
        super(capitalize(kind) + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "Record";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
