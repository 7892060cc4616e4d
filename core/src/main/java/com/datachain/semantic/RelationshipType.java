package com.datachain.semantic;

/**
 * Cardinality of a relationship.
 *
 * <p>Only {@link #ONE_TO_MANY} can be planned. {@link #MANY_TO_MANY} is accepted
 * by the JSON reader so it can be reported as a model violation.
 */
public enum RelationshipType {
    ONE_TO_MANY,
    MANY_TO_MANY
}
