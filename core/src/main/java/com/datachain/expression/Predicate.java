package com.datachain.expression;

/**
 * Boolean predicate in the SQL AST, used for WHERE, HAVING and join conditions.
 */
public sealed interface Predicate permits Comparison, ColumnComparison, And, Or, Not {
}
