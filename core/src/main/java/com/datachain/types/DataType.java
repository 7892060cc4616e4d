package com.datachain.types;

/**
 * Logical column types understood by the semantic model.
 *
 * <p>The compiler only needs to know enough about a column's type to decide
 * whether it may be time-grained (DATE) or summed/averaged (NUMERIC).
 */
public enum DataType {
    DATE,
    STRING,
    NUMERIC,
    BOOLEAN
}
