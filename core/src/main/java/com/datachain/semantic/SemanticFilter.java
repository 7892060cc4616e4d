package com.datachain.semantic;

import java.util.Objects;

/**
 * A named, reusable filter stored in the semantic model.
 */
public record SemanticFilter(String name, SemanticPredicate predicate, String description) {

    public SemanticFilter {
        Objects.requireNonNull(name, "filter name must not be null");
        Objects.requireNonNull(predicate, "filter predicate must not be null");
        description = description == null ? "" : description;
    }

    public static SemanticFilter of(String name, SemanticPredicate predicate) {
        return new SemanticFilter(name, predicate, "");
    }
}
