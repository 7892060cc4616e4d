package com.datachain.expression;

import java.util.Objects;

public record Not(Predicate predicate) implements Predicate {

    public Not {
        Objects.requireNonNull(predicate, "predicate must not be null");
    }
}
