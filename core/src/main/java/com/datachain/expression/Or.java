package com.datachain.expression;

import java.util.List;

/**
 * Disjunction of predicates.
 */
public record Or(List<Predicate> predicates) implements Predicate {

    public Or {
        if (predicates == null || predicates.isEmpty()) {
            throw new IllegalArgumentException("OR requires at least one predicate");
        }
        predicates = List.copyOf(predicates);
    }
}
