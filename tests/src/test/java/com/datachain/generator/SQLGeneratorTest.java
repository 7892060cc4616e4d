package com.datachain.generator;

import com.datachain.config.CompilerSettings;
import com.datachain.exception.SQLGenerationException;
import com.datachain.expression.AggregateMeasure;
import com.datachain.expression.And;
import com.datachain.expression.BinaryMetric;
import com.datachain.expression.ColumnComparison;
import com.datachain.expression.ColumnReference;
import com.datachain.expression.Comparison;
import com.datachain.expression.Not;
import com.datachain.expression.Or;
import com.datachain.expression.Predicate;
import com.datachain.expression.TimeGrainColumn;
import com.datachain.expression.WindowSpec;
import com.datachain.expression.window.ChangeWindow;
import com.datachain.expression.window.MovingAverageWindow;
import com.datachain.logical.JoinType;
import com.datachain.logical.SortOrder;
import com.datachain.logical.SqlJoin;
import com.datachain.logical.SqlQuery;
import com.datachain.test.TestBase;
import com.datachain.test.TestCategories;
import com.datachain.types.Aggregation;
import com.datachain.types.Arithmetic;
import com.datachain.types.Comparator;
import com.datachain.types.Sorting;
import com.datachain.types.TimeGrain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for SQLGenerator rendering of the SQL AST.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SQLGenerator Tests")
public class SQLGeneratorTest extends TestBase {

    private SQLGenerator generator;

    private static final ColumnReference REVENUE = ColumnReference.of("cte", "revenue");
    private static final ColumnReference MONTH = ColumnReference.of("cte", "month_order_date");

    @BeforeEach
    void setUp() {
        generator = new SQLGenerator();
    }

    private static Comparison compare(String column, Comparator comparator, Object value) {
        return new Comparison(ColumnReference.of("orders", column), comparator, value);
    }

    // ==================== Clauses ====================

    @Nested
    @DisplayName("Clauses")
    class Clauses {

        @Test
        @DisplayName("Clauses are emitted one per line in order")
        void testClauseOrder() {
            SqlQuery query = SqlQuery.from("orders")
                .select("region", ColumnReference.of("customers", "region"))
                .select("revenue", new AggregateMeasure("orders", "revenue", Aggregation.SUM))
                .join(new SqlJoin(JoinType.LEFT, "customers", new ColumnComparison(
                    ColumnReference.of("customers", "id"), Comparator.EQUAL,
                    ColumnReference.of("orders", "customer_id"))))
                .where(compare("status", Comparator.EQUAL, "shipped"))
                .groupBy(List.of(ColumnReference.of("customers", "region")))
                .having(new Comparison(new AggregateMeasure("orders", "revenue", Aggregation.SUM),
                    Comparator.GREATER_THAN, 100))
                .orderBy(new SortOrder(ColumnReference.alias("revenue"), Sorting.DESC))
                .limit(5)
                .offset(10)
                .build();

            String sql = generator.generate(query);
            logData("Generated SQL", sql);

            assertThat(sql).isEqualTo(String.join("\n",
                "SELECT customers.region AS region, SUM(orders.revenue) AS revenue",
                "FROM orders",
                "LEFT JOIN customers ON customers.id = orders.customer_id",
                "WHERE orders.status = 'shipped'",
                "GROUP BY customers.region",
                "HAVING SUM(orders.revenue) > 100",
                "ORDER BY revenue DESC",
                "LIMIT 5",
                "OFFSET 10"));
        }

        @Test
        @DisplayName("Composite join keys are ANDed without parentheses")
        void testCompositeJoin() {
            Predicate condition = And.of(List.of(
                new ColumnComparison(ColumnReference.of("a", "k1"), Comparator.EQUAL, ColumnReference.of("b", "k1")),
                new ColumnComparison(ColumnReference.of("a", "k2"), Comparator.EQUAL, ColumnReference.of("b", "k2"))));
            SqlQuery query = SqlQuery.from("b")
                .select("n", new AggregateMeasure("b", "k1", Aggregation.COUNT))
                .join(new SqlJoin(JoinType.INNER, "a", condition))
                .build();

            assertThat(generator.generate(query)).contains("INNER JOIN a ON a.k1 = b.k1 AND a.k2 = b.k2");
        }

        @Test
        @DisplayName("Generation is deterministic")
        void testDeterministic() {
            SqlQuery query = SqlQuery.from("orders")
                .select("n", new AggregateMeasure("orders", "id", Aggregation.COUNT_DISTINCT))
                .build();

            assertThat(generator.generate(query)).isEqualTo(generator.generate(query))
                .isEqualTo("SELECT COUNT(DISTINCT orders.id) AS n\nFROM orders");
        }
    }

    // ==================== Expressions ====================

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("Time grain renders as a function call")
        void testTimeGrain() {
            assertThat(generator.renderExpression(new TimeGrainColumn("orders", "order_date", TimeGrain.QUARTER)))
                .isEqualTo("QUARTER(orders.order_date)");
        }

        @Test
        @DisplayName("Binary metrics are fully parenthesized")
        void testBinaryMetric() {
            AggregateMeasure revenue = new AggregateMeasure("orders", "revenue", Aggregation.SUM);
            AggregateMeasure cost = new AggregateMeasure("orders", "production_cost", Aggregation.SUM);

            String sql = generator.renderExpression(new BinaryMetric(
                new BinaryMetric(revenue, Arithmetic.SUB, cost), Arithmetic.DIV, revenue));

            assertThat(sql).isEqualTo(
                "((SUM(orders.revenue) - SUM(orders.production_cost)) / SUM(orders.revenue))");
        }

        @Test
        @DisplayName("Absolute change subtracts the lagged value")
        void testAbsoluteChange() {
            WindowSpec spec = new WindowSpec(REVENUE, List.of(ColumnReference.of("cte", "region")), List.of(MONTH),
                ChangeWindow.absolute(1));

            assertThat(generator.renderExpression(spec)).isEqualTo(
                "(cte.revenue - LAG(cte.revenue, 1) OVER (PARTITION BY cte.region ORDER BY cte.month_order_date))");
        }

        @Test
        @DisplayName("Percentage change guards against division by zero")
        void testPercentageChange() {
            WindowSpec spec = new WindowSpec(REVENUE, List.of(), List.of(MONTH), ChangeWindow.percentage(2));
            String lag = "LAG(cte.revenue, 2) OVER (ORDER BY cte.month_order_date)";

            assertThat(generator.renderExpression(spec)).isEqualTo(
                "((cte.revenue - " + lag + ") / NULLIF(" + lag + ", 0) * 100)");
        }

        @ParameterizedTest(name = "{0} over {1} rows")
        @CsvSource({
            "BEHIND, 3, 2 PRECEDING AND CURRENT ROW",
            "AHEAD, 2, CURRENT ROW AND 1 FOLLOWING",
            "CENTERED, 3, 1 PRECEDING AND 1 FOLLOWING",
            "CENTERED, 4, 1 PRECEDING AND 2 FOLLOWING",
            "BEHIND, 1, 0 PRECEDING AND CURRENT ROW"
        })
        @DisplayName("Moving average frames")
        void testMovingAverageFrames(MovingAverageWindow.Mode mode, int period, String frame) {
            WindowSpec spec = new WindowSpec(REVENUE, List.of(), List.of(MONTH), new MovingAverageWindow(period, mode));

            assertThat(generator.renderExpression(spec)).isEqualTo(
                "AVG(cte.revenue) OVER (ORDER BY cte.month_order_date ROWS BETWEEN " + frame + ")");
        }
    }

    // ==================== Predicates ====================

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("Null checks take no value")
        void testNullCheck() {
            assertThat(generator.renderPredicate(compare("status", Comparator.IS_NOT_NULL, null)))
                .isEqualTo("orders.status IS NOT NULL");
        }

        @Test
        @DisplayName("Membership renders a value list")
        void testMembership() {
            assertThat(generator.renderPredicate(compare("status", Comparator.NOT_IN, List.of("a", "b"))))
                .isEqualTo("orders.status NOT IN ('a', 'b')");
            assertThat(generator.renderPredicate(compare("id", Comparator.IN, 7)))
                .isEqualTo("orders.id IN (7)");
        }

        @Test
        @DisplayName("Boolean connectives are parenthesized")
        void testConnectives() {
            Predicate a = compare("id", Comparator.GREATER_THAN, 1);
            Predicate b = compare("status", Comparator.LIKE, "s%");

            assertThat(generator.renderPredicate(new And(List.of(a, b))))
                .isEqualTo("(orders.id > 1 AND orders.status LIKE 's%')");
            assertThat(generator.renderPredicate(new Not(new Or(List.of(a, b)))))
                .isEqualTo("NOT (orders.id > 1 OR orders.status LIKE 's%')");
            assertThat(generator.renderPredicate(new Not(a)))
                .isEqualTo("NOT (orders.id > 1)");
        }

        @Test
        @DisplayName("List value with a scalar comparator is rejected")
        void testListInScalarPosition() {
            SqlQuery query = SqlQuery.from("orders")
                .select("id", ColumnReference.of("orders", "id"))
                .where(compare("id", Comparator.EQUAL, List.of(1, 2)))
                .build();

            assertThatThrownBy(() -> generator.generate(query))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("IN or NOT IN");
        }
    }

    // ==================== Literals and Identifiers ====================

    @Nested
    @DisplayName("Literals and Identifiers")
    class Literals {

        @Test
        @DisplayName("Literal rendering by value type")
        void testValues() {
            assertThat(SQLGenerator.renderValue(null)).isEqualTo("NULL");
            assertThat(SQLGenerator.renderValue("O'Reilly")).isEqualTo("'O''Reilly'");
            assertThat(SQLGenerator.renderValue(true)).isEqualTo("TRUE");
            assertThat(SQLGenerator.renderValue(42)).isEqualTo("42");
            assertThat(SQLGenerator.renderValue(2.5)).isEqualTo("2.5");
            assertThat(SQLGenerator.renderValue(new BigDecimal("1E+3"))).isEqualTo("1000");
        }

        @Test
        @DisplayName("Non-finite numbers are rejected")
        void testNonFinite() {
            assertThatThrownBy(() -> SQLGenerator.renderValue(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> SQLGenerator.renderValue(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Reserved and irregular identifiers are quoted")
        void testQuoteIfNeeded() {
            SqlQuery query = SqlQuery.from("order")
                .select("Order Total", new AggregateMeasure("order", "group", Aggregation.SUM))
                .build();

            assertThat(generator.generate(query))
                .isEqualTo("SELECT SUM(\"order\".\"group\") AS \"Order Total\"\nFROM \"order\"");
        }

        @Test
        @DisplayName("Quote-all setting quotes every identifier")
        void testQuoteAll() {
            SQLGenerator quoting = new SQLGenerator(new CompilerSettings(true, "cte"));
            SqlQuery query = SqlQuery.from("orders").select("id", ColumnReference.of("orders", "id")).build();

            assertThat(quoting.generate(query)).isEqualTo("SELECT \"orders\".\"id\" AS \"id\"\nFROM \"orders\"");
        }
    }

    // ==================== Staged Queries ====================

    @Nested
    @DisplayName("Staged Queries")
    class Staged {

        @Test
        @DisplayName("Nested source renders as a single CTE")
        void testCte() {
            SqlQuery inner = SqlQuery.from("orders")
                .select("revenue", new AggregateMeasure("orders", "revenue", Aggregation.SUM))
                .build();
            SqlQuery outer = SqlQuery.from(inner, "cte").select("revenue", REVENUE).build();

            assertThat(generator.generate(outer)).isEqualTo(String.join("\n",
                "WITH cte AS (",
                "SELECT SUM(orders.revenue) AS revenue",
                "FROM orders",
                ")",
                "SELECT cte.revenue AS revenue",
                "FROM cte"));
        }

        @Test
        @DisplayName("Two levels of nesting are not supported")
        void testDoubleNesting() {
            SqlQuery base = SqlQuery.from("orders").select("id", ColumnReference.of("orders", "id")).build();
            SqlQuery middle = SqlQuery.from(base, "first").select("id", ColumnReference.of("first", "id")).build();
            SqlQuery outer = SqlQuery.from(middle, "second").select("id", ColumnReference.of("second", "id")).build();

            assertThatThrownBy(() -> generator.generate(outer))
                .isInstanceOfSatisfying(SQLGenerationException.class, e -> {
                    assertThat(e.getFailedQuery()).isSameAs(outer);
                    assertThat(e.getUserMessage()).startsWith("Failed to generate SQL for a staged (CTE) query");
                });
        }
    }
}
