package com.datachain.expression;

/**
 * Value expression in the SQL AST.
 *
 * <p>The variant set is closed; the generator matches every variant
 * exhaustively:
 * <ul>
 *   <li>{@link ColumnReference} - plain column or CTE alias</li>
 *   <li>{@link TimeGrainColumn} - column truncated to a time grain</li>
 *   <li>{@link AggregateMeasure} - aggregation over a column</li>
 *   <li>{@link BinaryMetric} - arithmetic over two expressions</li>
 *   <li>{@link WindowSpec} - change or moving-average window</li>
 * </ul>
 */
public sealed interface Expression
        permits ColumnReference, TimeGrainColumn, AggregateMeasure, BinaryMetric, WindowSpec {
}
