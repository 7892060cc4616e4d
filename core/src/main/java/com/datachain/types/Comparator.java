package com.datachain.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators accepted in filters.
 *
 * <p>Comparators serialize as their SQL symbol ({@code "NOT IN"}, {@code ">="}),
 * which is also how they are rendered.
 */
public enum Comparator {
    EQUAL("="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN_OR_EQUAL(">="),
    IN("IN"),
    NOT_IN("NOT IN"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL"),
    LIKE("LIKE"),
    NOT_LIKE("NOT LIKE");

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * Returns true for {@code IS NULL} and {@code IS NOT NULL}, which take no value.
     */
    public boolean isNullCheck() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * Returns true for {@code IN} and {@code NOT IN}, which take a value list.
     */
    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    @JsonCreator
    public static Comparator fromSymbol(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Comparator cannot be null");
        }
        String normalized = value.trim().replaceAll("\\s+", " ");
        for (Comparator comparator : values()) {
            if (comparator.symbol.equalsIgnoreCase(normalized)
                    || comparator.name().equalsIgnoreCase(normalized)) {
                return comparator;
            }
        }
        if ("<>".equals(normalized)) {
            return NOT_EQUAL;
        }
        throw new IllegalArgumentException("Unknown comparator: " + value);
    }
}
