package com.datachain.validation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stage that reported a {@link QueryError}.
 */
public enum ErrorStage {
    STRUCTURE_VALIDATION("structure_validation"),
    REFERENCE_VALIDATION("reference_validation"),
    JOIN_PATH_VALIDATION("join_path_validation"),
    RESOLUTION("resolution");

    private final String wireName;

    ErrorStage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
