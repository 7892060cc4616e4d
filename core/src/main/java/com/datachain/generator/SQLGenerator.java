package com.datachain.generator;

import com.datachain.config.CompilerSettings;
import com.datachain.exception.SQLGenerationException;
import com.datachain.expression.AggregateMeasure;
import com.datachain.expression.And;
import com.datachain.expression.BinaryMetric;
import com.datachain.expression.ColumnComparison;
import com.datachain.expression.ColumnReference;
import com.datachain.expression.Comparison;
import com.datachain.expression.Expression;
import com.datachain.expression.Not;
import com.datachain.expression.Or;
import com.datachain.expression.Predicate;
import com.datachain.expression.TimeGrainColumn;
import com.datachain.expression.WindowSpec;
import com.datachain.expression.window.ChangeWindow;
import com.datachain.expression.window.MeasureWindow;
import com.datachain.expression.window.MovingAverageWindow;
import com.datachain.logical.SelectItem;
import com.datachain.logical.SortOrder;
import com.datachain.logical.SqlJoin;
import com.datachain.logical.SqlQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders the SQL AST to DuckDB SQL text.
 *
 * <p>Clauses are emitted one per line in the order SELECT, FROM, joins,
 * WHERE, GROUP BY, HAVING, ORDER BY, LIMIT, OFFSET. A query whose source is
 * a nested query is rendered as a single CTE:
 * <pre>
 *   WITH cte AS (
 *   SELECT ... FROM orders ... GROUP BY ...
 *   )
 *   SELECT cte.month_order_date AS month_order_date, (cte.revenue - LAG(cte.revenue, 1) OVER (...)) AS change
 *   FROM cte
 *   ORDER BY ...
 * </pre>
 *
 * <p>Window lowering:
 * <ul>
 *   <li>ABSOLUTE change: {@code (f - LAG(f, p) OVER (...))}</li>
 *   <li>PERCENTAGE change: {@code ((f - LAG(f, p) OVER (...)) / NULLIF(LAG(f, p) OVER (...), 0) * 100)}</li>
 *   <li>moving average: {@code AVG(f) OVER (... ROWS BETWEEN ...)}</li>
 * </ul>
 *
 * <p>The generator keeps no state between calls; the same AST always renders
 * to the same text.
 *
 * <p>Example usage:
 * <pre>
 *   SQLGenerator generator = new SQLGenerator();
 *   String sql = generator.generate(query);
 * </pre>
 *
 * @see SqlQuery
 */
public class SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    private final CompilerSettings settings;

    /**
     * Creates a generator using {@link CompilerSettings#defaults()}.
     */
    public SQLGenerator() {
        this(CompilerSettings.defaults());
    }

    public SQLGenerator(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Generates SQL for a query node.
     *
     * @param query the AST to render
     * @return the DuckDB SQL string
     * @throws NullPointerException if query is null
     * @throws IllegalArgumentException if a literal or identifier cannot be rendered
     * @throws SQLGenerationException if the AST has an unsupported shape
     */
    public String generate(SqlQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        try {
            String sql;
            if (query.source() instanceof SqlQuery.QuerySource nested) {
                if (nested.query().isStaged()) {
                    throw new SQLGenerationException(
                        "Only one level of CTE nesting is supported", query);
                }
                sql = "WITH " + identifier(nested.name()) + " AS (\n"
                    + renderBody(nested.query()) + "\n)\n"
                    + renderBody(query);
            } else {
                sql = renderBody(query);
            }
            logger.debug("Generated SQL:\n{}", sql);
            return sql;

        } catch (SQLGenerationException | IllegalArgumentException e) {
            // Re-throw without wrapping so callers can catch them directly
            throw e;

        } catch (RuntimeException e) {
            throw new SQLGenerationException("Unexpected error during SQL generation", e, query);
        }
    }

    private String renderBody(SqlQuery query) {
        List<String> clauses = new ArrayList<>();

        StringJoiner select = new StringJoiner(", ", "SELECT ", "");
        for (SelectItem item : query.select()) {
            select.add(renderExpression(item.expression()) + " AS " + identifier(item.alias()));
        }
        clauses.add(query.select().isEmpty() ? "SELECT *" : select.toString());

        if (query.source() instanceof SqlQuery.TableSource table) {
            clauses.add("FROM " + identifier(table.name()));
        } else if (query.source() instanceof SqlQuery.QuerySource nested) {
            clauses.add("FROM " + identifier(nested.name()));
        }

        for (SqlJoin join : query.joins()) {
            clauses.add(join.type().keyword() + " " + identifier(join.table())
                + " ON " + renderJoinCondition(join.condition()));
        }

        if (query.where() != null) {
            clauses.add("WHERE " + renderPredicate(query.where()));
        }

        if (!query.groupBy().isEmpty()) {
            clauses.add("GROUP BY " + joinExpressions(query.groupBy()));
        }

        if (query.having() != null) {
            clauses.add("HAVING " + renderPredicate(query.having()));
        }

        if (!query.orderBy().isEmpty()) {
            StringJoiner orderBy = new StringJoiner(", ", "ORDER BY ", "");
            for (SortOrder order : query.orderBy()) {
                orderBy.add(renderExpression(order.expression()) + " " + order.sorting().name());
            }
            clauses.add(orderBy.toString());
        }

        if (query.limit() != null) {
            clauses.add("LIMIT " + query.limit());
        }
        if (query.offset() != null) {
            clauses.add("OFFSET " + query.offset());
        }

        return String.join("\n", clauses);
    }

    // ==================== Expressions ====================

    String renderExpression(Expression expression) {
        if (expression instanceof ColumnReference column) {
            return column.isQualified()
                ? identifier(column.table()) + "." + identifier(column.name())
                : identifier(column.name());
        }
        if (expression instanceof TimeGrainColumn grain) {
            return grain.grain().functionName() + "(" + qualified(grain.table(), grain.name()) + ")";
        }
        if (expression instanceof AggregateMeasure aggregate) {
            String argument = qualified(aggregate.table(), aggregate.column());
            if (aggregate.aggregation().isDistinct()) {
                argument = "DISTINCT " + argument;
            }
            return aggregate.aggregation().functionName() + "(" + argument + ")";
        }
        if (expression instanceof BinaryMetric binary) {
            return "(" + renderExpression(binary.left()) + " " + binary.operator().symbol() + " "
                + renderExpression(binary.right()) + ")";
        }
        if (expression instanceof WindowSpec window) {
            return renderWindow(window);
        }
        throw new SQLGenerationException(
            "Unsupported expression type: " + expression.getClass().getSimpleName(), null);
    }

    private String renderWindow(WindowSpec spec) {
        String field = renderExpression(spec.field());

        List<String> overParts = new ArrayList<>();
        if (!spec.partitionBy().isEmpty()) {
            overParts.add("PARTITION BY " + joinExpressions(spec.partitionBy()));
        }
        if (!spec.orderBy().isEmpty()) {
            overParts.add("ORDER BY " + joinExpressions(spec.orderBy()));
        }
        String over = String.join(" ", overParts);

        MeasureWindow window = spec.window();
        if (window instanceof ChangeWindow change) {
            String lag = "LAG(" + field + ", " + change.period() + ") OVER (" + over + ")";
            if (change.mode() == ChangeWindow.Mode.ABSOLUTE) {
                return "(" + field + " - " + lag + ")";
            }
            return "((" + field + " - " + lag + ") / NULLIF(" + lag + ", 0) * 100)";
        }
        if (window instanceof MovingAverageWindow average) {
            String frame = "ROWS BETWEEN " + frameBounds(average);
            String clause = over.isEmpty() ? frame : over + " " + frame;
            return "AVG(" + field + ") OVER (" + clause + ")";
        }
        throw new SQLGenerationException(
            "Unsupported window type: " + window.getClass().getSimpleName(), null);
    }

    private static String frameBounds(MovingAverageWindow window) {
        int span = window.period() - 1;
        return switch (window.mode()) {
            case BEHIND -> span + " PRECEDING AND CURRENT ROW";
            case AHEAD -> "CURRENT ROW AND " + span + " FOLLOWING";
            case CENTERED -> {
                int preceding = span / 2;
                yield preceding + " PRECEDING AND " + (span - preceding) + " FOLLOWING";
            }
        };
    }

    private String joinExpressions(List<Expression> expressions) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Expression expression : expressions) {
            joiner.add(renderExpression(expression));
        }
        return joiner.toString();
    }

    // ==================== Predicates ====================

    String renderPredicate(Predicate predicate) {
        if (predicate instanceof Comparison comparison) {
            String operand = renderExpression(comparison.operand());
            String symbol = comparison.comparator().symbol();
            if (comparison.comparator().isNullCheck()) {
                return operand + " " + symbol;
            }
            if (comparison.comparator().isMembership()) {
                return operand + " " + symbol + " " + renderValueList(comparison.value());
            }
            return operand + " " + symbol + " " + renderValue(comparison.value());
        }
        if (predicate instanceof ColumnComparison comparison) {
            return renderExpression(comparison.left()) + " " + comparison.comparator().symbol() + " "
                + renderExpression(comparison.right());
        }
        if (predicate instanceof And and) {
            return "(" + joinPredicates(and.predicates(), " AND ") + ")";
        }
        if (predicate instanceof Or or) {
            return "(" + joinPredicates(or.predicates(), " OR ") + ")";
        }
        if (predicate instanceof Not not) {
            String inner = renderPredicate(not.predicate());
            return not.predicate() instanceof And || not.predicate() instanceof Or
                ? "NOT " + inner
                : "NOT (" + inner + ")";
        }
        throw new SQLGenerationException(
            "Unsupported predicate type: " + predicate.getClass().getSimpleName(), null);
    }

    /**
     * Join conditions render a top-level conjunction without parentheses.
     */
    private String renderJoinCondition(Predicate condition) {
        if (condition instanceof And and) {
            return joinPredicates(and.predicates(), " AND ");
        }
        return renderPredicate(condition);
    }

    private String joinPredicates(List<Predicate> predicates, String separator) {
        StringJoiner joiner = new StringJoiner(separator);
        for (Predicate predicate : predicates) {
            joiner.add(renderPredicate(predicate));
        }
        return joiner.toString();
    }

    // ==================== Literals and identifiers ====================

    private static String renderValueList(Object value) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        if (value instanceof Collection<?> values) {
            for (Object item : values) {
                joiner.add(renderValue(item));
            }
        } else {
            joiner.add(renderValue(value));
        }
        return joiner.toString();
    }

    static String renderValue(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String text) {
            return SQLQuoting.quoteLiteral(text);
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new IllegalArgumentException("Cannot render non-finite number: " + value);
            }
            return value.toString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Collection<?>) {
            throw new IllegalArgumentException("A list value requires IN or NOT IN: " + value);
        }
        return SQLQuoting.quoteLiteral(value.toString());
    }

    private String qualified(String table, String column) {
        return identifier(table) + "." + identifier(column);
    }

    private String identifier(String name) {
        return settings.quoteIdentifiers()
            ? SQLQuoting.quoteIdentifier(name)
            : SQLQuoting.quoteIdentifierIfNeeded(name);
    }
}
