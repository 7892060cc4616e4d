package com.datachain.exception;

/**
 * Exception thrown when a KPI or filter lookup matches more than one entity.
 */
public class DuplicateEntityException extends RuntimeException {

    private final String entityKind;
    private final String entityName;
    private final int matchCount;

    public DuplicateEntityException(String entityKind, String entityName, int matchCount) {
        super(matchCount + " matching " + entityKind + " entries named '" + entityName + "'");
        this.entityKind = entityKind;
        this.entityName = entityName;
        this.matchCount = matchCount;
    }

    public String getEntityKind() {
        return entityKind;
    }

    public String getEntityName() {
        return entityName;
    }

    public int getMatchCount() {
        return matchCount;
    }
}
