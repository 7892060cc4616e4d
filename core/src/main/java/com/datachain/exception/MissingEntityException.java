package com.datachain.exception;

/**
 * Exception thrown when a KPI or filter lookup finds no match.
 */
public class MissingEntityException extends RuntimeException {

    private final String entityKind;
    private final String entityName;

    public MissingEntityException(String entityKind, String entityName) {
        super("No matching " + entityKind + " named '" + entityName + "'");
        this.entityKind = entityKind;
        this.entityName = entityName;
    }

    public String getEntityKind() {
        return entityKind;
    }

    public String getEntityName() {
        return entityName;
    }
}
