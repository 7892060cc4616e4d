package com.datachain.expression;

import java.util.List;

/**
 * Conjunction of two or more predicates.
 */
public record And(List<Predicate> predicates) implements Predicate {

    public And {
        if (predicates == null || predicates.isEmpty()) {
            throw new IllegalArgumentException("AND requires at least one predicate");
        }
        predicates = List.copyOf(predicates);
    }

    /**
     * Returns the single predicate unchanged, or an AND of all of them.
     *
     * @param predicates predicates to combine, not empty
     * @return combined predicate
     */
    public static Predicate of(List<Predicate> predicates) {
        return predicates.size() == 1 ? predicates.get(0) : new And(predicates);
    }
}
