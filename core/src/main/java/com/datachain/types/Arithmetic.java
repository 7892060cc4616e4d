package com.datachain.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Arithmetic operators used to combine two KPIs into a derived KPI.
 */
public enum Arithmetic {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%");

    private final String symbol;

    Arithmetic(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    @JsonCreator
    public static Arithmetic fromSymbol(String value) {
        for (Arithmetic op : values()) {
            if (op.symbol.equals(value) || op.name().equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown arithmetic operator: " + value);
    }
}
