package com.datachain.validation;

import com.datachain.expression.window.ChangeWindow;
import com.datachain.query.Dimension;
import com.datachain.query.Measure;
import com.datachain.query.OrderBy;
import com.datachain.query.Query;
import com.datachain.query.QueryContext;
import com.datachain.query.QueryFilter;
import com.datachain.semantic.Column;
import com.datachain.semantic.Kpi;
import com.datachain.semantic.KpiMetric;
import com.datachain.semantic.Relationship;
import com.datachain.semantic.SemanticModel;
import com.datachain.semantic.Table;
import com.datachain.test.RetailModel;
import com.datachain.test.TestBase;
import com.datachain.test.TestCategories;
import com.datachain.types.Aggregation;
import com.datachain.types.Comparator;
import com.datachain.types.DataType;
import com.datachain.types.TimeGrain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for QueryValidator: structure, reference and join path checks.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("QueryValidator Tests")
public class QueryValidatorTest extends TestBase {

    private QueryValidator validator;
    private SemanticModel model;
    private QueryContext ctx;

    @BeforeEach
    void setUp() {
        validator = new QueryValidator();
        model = RetailModel.build();
        ctx = new QueryContext();
    }

    private static Measure revenue() {
        return Measure.of("revenue", "orders", "revenue", Aggregation.SUM);
    }

    private static Measure revenueChange() {
        return new Measure("change", "orders", "revenue", Aggregation.SUM, ChangeWindow.absolute(1));
    }

    private static Dimension month() {
        return Dimension.of("orders", "order_date", TimeGrain.MONTH);
    }

    private List<ErrorCode> structureCodes(Query query) {
        return validator.validateStructure(query, ctx).stream().map(QueryError::code).toList();
    }

    private List<ErrorCode> referenceCodes(Query query) {
        return validator.validateReferences(query, model, ctx).stream().map(QueryError::code).toList();
    }

    // ==================== Structure ====================

    @Nested
    @DisplayName("Structure Validation")
    class Structure {

        @Test
        @DisplayName("Valid query has no structural errors")
        void testValid() {
            Query query = Query.builder()
                .dimension(month())
                .measure(revenue())
                .measure(revenueChange())
                .limit(10)
                .offset(0)
                .build();

            assertThat(validator.validateStructure(query, ctx)).isEmpty();
        }

        @Test
        @DisplayName("Query selecting nothing is rejected")
        void testEmptySelection() {
            List<QueryError> errors = validator.validateStructure(Query.builder().build(), ctx);

            assertThat(errors).hasSize(1);
            assertThat(errors.get(0).stage()).isEqualTo(ErrorStage.STRUCTURE_VALIDATION);
            assertThat(errors.get(0).code()).isEqualTo(ErrorCode.EMPTY_SELECTION);
            assertThat(errors.get(0).hint()).isNotBlank();
        }

        @Test
        @DisplayName("KPI ref alone is a valid selection")
        void testKpiOnlySelection() {
            assertThat(structureCodes(Query.builder().kpiRef("total_revenue").build())).isEmpty();
        }

        @Test
        @DisplayName("Two time-grained dimensions are rejected")
        void testMultipleTimeGrains() {
            Query query = Query.builder()
                .dimension(month())
                .dimension(Dimension.of("customers", "signup_date", TimeGrain.YEAR))
                .measure(revenue())
                .build();

            assertThat(structureCodes(query)).containsExactly(ErrorCode.MULTIPLE_TIME_GRAINS);
        }

        @Test
        @DisplayName("Windowed measure needs a time-grained dimension")
        void testWindowWithoutTimeGrain() {
            Query query = Query.builder()
                .dimension(Dimension.of("customers", "region"))
                .measure(revenue().withWindow(ChangeWindow.absolute(1)))
                .build();

            assertThat(structureCodes(query)).containsExactly(ErrorCode.WINDOW_REQUIRES_TIME_GRAIN);
        }

        @Test
        @DisplayName("Window period below 1 is rejected")
        void testWindowPeriod() {
            Query query = Query.builder()
                .dimension(month())
                .measure(revenue().withWindow(ChangeWindow.absolute(0)))
                .build();

            assertThat(structureCodes(query)).containsExactly(ErrorCode.INVALID_WINDOW_PERIOD);
        }

        @Test
        @DisplayName("Measure name shared with a KPI ref is a duplicate")
        void testDuplicateNames() {
            Query query = Query.builder()
                .measure(Measure.of("total_revenue", "orders", "revenue", Aggregation.SUM))
                .kpiRef("total_revenue")
                .build();

            assertThat(structureCodes(query)).containsExactly(ErrorCode.DUPLICATE_MEASURE_NAME);
        }

        @Test
        @DisplayName("Filter values must match their comparator")
        void testFilterValues() {
            Query query = Query.builder()
                .measure(revenue())
                .dimensionFilter(QueryFilter.of("customers.region", Comparator.IN, "North"))
                .dimensionFilter(QueryFilter.of("customers.region", Comparator.IN, List.of()))
                .dimensionFilter(QueryFilter.of("customers.region", Comparator.EQUAL, null))
                .dimensionFilter(QueryFilter.of("customers.region", Comparator.IS_NULL, "x"))
                .measureFilter(QueryFilter.of("revenue", Comparator.GREATER_THAN, List.of(1, 2)))
                .build();

            assertThat(structureCodes(query)).containsExactly(
                ErrorCode.INVALID_FILTER_VALUE,
                ErrorCode.INVALID_FILTER_VALUE,
                ErrorCode.MISSING_FILTER_VALUE,
                ErrorCode.INVALID_FILTER_VALUE,
                ErrorCode.INVALID_FILTER_VALUE);
        }

        @Test
        @DisplayName("Null checks without a value are accepted")
        void testNullCheck() {
            Query query = Query.builder()
                .measure(revenue())
                .dimensionFilter(QueryFilter.of("orders.status", Comparator.IS_NOT_NULL, null))
                .build();

            assertThat(structureCodes(query)).isEmpty();
        }

        @Test
        @DisplayName("Errors accumulate within the stage")
        void testAccumulation() {
            Query query = Query.builder().limit(-1).offset(-5).build();

            assertThat(structureCodes(query)).containsExactly(
                ErrorCode.EMPTY_SELECTION, ErrorCode.INVALID_LIMIT, ErrorCode.INVALID_LIMIT);
        }
    }

    // ==================== References ====================

    @Nested
    @DisplayName("Reference Validation")
    class References {

        @Test
        @DisplayName("Known references pass")
        void testValid() {
            Query query = Query.builder()
                .dimension(Dimension.of("customers", "customer_name"))
                .dimension(month())
                .measure(revenue())
                .kpiRef("profit_margin")
                .filterRef("target_regions")
                .dimensionFilter(QueryFilter.of("orders.status", Comparator.EQUAL, "shipped"))
                .measureFilter(QueryFilter.of("revenue", Comparator.GREATER_THAN, 10))
                .kpiFilter(QueryFilter.of("total_cost", Comparator.LESS_THAN, 100))
                .orderBy(OrderBy.desc("profit_margin"))
                .orderBy(OrderBy.asc("customers.customer_name"))
                .build();

            assertThat(validator.validateReferences(query, model, ctx)).isEmpty();
        }

        @Test
        @DisplayName("Unknown KPI and filter refs are reported")
        void testUnknownKpiAndFilter() {
            Query query = Query.builder().kpiRef("ghost_kpi").filterRef("ghost_filter").build();

            assertThat(referenceCodes(query))
                .containsExactly(ErrorCode.KPI_NOT_FOUND, ErrorCode.FILTER_NOT_FOUND);
        }

        @Test
        @DisplayName("Unknown dimension carries a hint listing the table's columns")
        void testUnknownDimension() {
            Query query = Query.builder().dimension(Dimension.of("customers", "nope")).build();

            List<QueryError> errors = validator.validateReferences(query, model, ctx);

            assertThat(errors).hasSize(1);
            assertThat(errors.get(0).code()).isEqualTo(ErrorCode.DIMENSION_NOT_FOUND);
            assertThat(errors.get(0).stage()).isEqualTo(ErrorStage.REFERENCE_VALIDATION);
            assertThat(errors.get(0).hint())
                .isEqualTo("Columns of 'customers': [id, customer_name, region, signup_date]");
        }

        @Test
        @DisplayName("Time grain on a non-date column is rejected")
        void testTimeGrainType() {
            Query query = Query.builder().dimension(Dimension.of("customers", "region", TimeGrain.MONTH)).build();

            assertThat(referenceCodes(query)).containsExactly(ErrorCode.INVALID_TIME_GRAIN);
        }

        @Test
        @DisplayName("Unknown measure column and SUM over text are rejected")
        void testMeasures() {
            Query query = Query.builder()
                .measure(Measure.of("a", "orders", "nope", Aggregation.SUM))
                .measure(Measure.of("b", "orders", "status", Aggregation.SUM))
                .measure(Measure.of("c", "orders", "status", Aggregation.COUNT_DISTINCT))
                .build();

            assertThat(referenceCodes(query))
                .containsExactly(ErrorCode.MEASURE_NOT_FOUND, ErrorCode.INVALID_AGGREGATION);
        }

        @Test
        @DisplayName("Dimension filter fields must be table.column and exist")
        void testDimensionFilterFields() {
            Query query = Query.builder()
                .measure(revenue())
                .dimensionFilter(QueryFilter.of("region", Comparator.EQUAL, "North"))
                .dimensionFilter(QueryFilter.of("customers.nope", Comparator.EQUAL, "North"))
                .build();

            assertThat(referenceCodes(query))
                .containsExactly(ErrorCode.INVALID_FIELD_FORMAT, ErrorCode.DIMENSION_FILTER_NOT_FOUND);
        }

        @Test
        @DisplayName("Measure filters must target an unwindowed measure of the query")
        void testMeasureFilterTargets() {
            Query query = Query.builder()
                .dimension(month())
                .measure(revenue())
                .measure(revenueChange())
                .measureFilter(QueryFilter.of("ghost", Comparator.GREATER_THAN, 1))
                .measureFilter(QueryFilter.of("change", Comparator.GREATER_THAN, 1))
                .kpiFilter(QueryFilter.of("ghost_kpi", Comparator.GREATER_THAN, 1))
                .build();

            assertThat(referenceCodes(query)).containsExactly(
                ErrorCode.MEASURE_FILTER_NOT_FOUND,
                ErrorCode.WINDOW_MEASURE_FILTER,
                ErrorCode.KPI_FILTER_NOT_FOUND);
        }

        @Test
        @DisplayName("Order by must name a selected dimension, measure or KPI")
        void testOrderBy() {
            Query query = Query.builder()
                .dimension(Dimension.of("customers", "region"))
                .measure(revenue())
                .orderBy(OrderBy.asc("customers.customer_name"))
                .orderBy(OrderBy.desc("total_revenue"))
                .orderBy(OrderBy.desc("revenue"))
                .build();

            assertThat(referenceCodes(query))
                .containsExactly(ErrorCode.ORDER_BY_NOT_FOUND, ErrorCode.ORDER_BY_NOT_FOUND);
        }

        @Test
        @DisplayName("Ambiguous KPI name is reported as a duplicate")
        void testDuplicateKpi() {
            model = SemanticModel.builder()
                .table(RetailModel.orders())
                .kpi(Kpi.metric("n", new KpiMetric("orders", "id", Aggregation.COUNT)))
                .kpi(Kpi.metric("n", new KpiMetric("orders", "revenue", Aggregation.SUM)))
                .build();

            List<QueryError> errors = validator.validateReferences(Query.builder().kpiRef("n").build(), model, ctx);

            assertThat(errors).extracting(QueryError::code).containsExactly(ErrorCode.DUPLICATE_KPI);
            assertThat(errors.get(0).message()).contains("defined 2 times");
        }

        @Test
        @DisplayName("Ambiguous operand of a binary KPI is reported as a duplicate")
        void testDuplicateKpiOperand() {
            model = RetailModel.ambiguousRevenue();

            List<QueryError> errors = validator.validateReferences(Query.builder().kpiRef("profit").build(), model, ctx);

            assertThat(errors).extracting(QueryError::code).containsExactly(ErrorCode.DUPLICATE_KPI);
            assertThat(errors.get(0).message()).contains("'rev'");
        }

        @Test
        @DisplayName("Ambiguous KPI behind a filter ref is reported as a duplicate")
        void testDuplicateKpiInFilterRef() {
            model = RetailModel.ambiguousRevenue();

            List<QueryError> errors = validator.validateReferences(Query.builder()
                .dimension(Dimension.of("orders", "status"))
                .filterRef("big")
                .build(), model, ctx);

            assertThat(errors).extracting(QueryError::code).containsExactly(ErrorCode.DUPLICATE_KPI);
        }

        @Test
        @DisplayName("Nested KPI operands are checked once")
        void testNestedOperandsCheckedOnce() {
            List<QueryError> errors = validator.validateReferences(Query.builder()
                .kpiRef("profit_margin")
                .kpiRef("total_profit")
                .kpiFilter(QueryFilter.of("total_revenue", Comparator.GREATER_THAN, 0))
                .build(), model, ctx);

            assertThat(errors).isEmpty();
        }
    }

    // ==================== Join Path ====================

    @Nested
    @DisplayName("Join Path Validation")
    class JoinPath {

        @Test
        @DisplayName("Single table becomes the common table")
        void testSingleTable() {
            ctx.addTable("customers");

            assertThat(validator.validateJoinPath(model, ctx)).isEmpty();
            assertThat(ctx.getCommonTable()).isEqualTo("customers");
        }

        @Test
        @DisplayName("Many side wins a distance tie")
        void testManySidePreferred() {
            logStep("Given: customers and orders, both at distance sum 1");
            ctx.addTable("customers");
            ctx.addTable("orders");

            assertThat(validator.validateJoinPath(model, ctx)).isEmpty();
            assertThat(ctx.getCommonTable()).isEqualTo("orders");
        }

        @Test
        @DisplayName("Two dimension tables meet at the fact table")
        void testSharedChild() {
            logStep("Given: customers and products, all three candidates at distance sum 2");
            ctx.addTable("customers");
            ctx.addTable("products");

            assertThat(validator.validateJoinPath(model, ctx)).isEmpty();
            assertThat(ctx.getCommonTable()).isEqualTo("orders");
            assertThat(ctx.getTrace()).anyMatch(line -> line.contains("common table 'orders'"));
        }

        @Test
        @DisplayName("Tables that cannot join along relationship direction are reported")
        void testNoDirectedPath() {
            logStep("Given: hub -> left and hub -> right, querying left and right");
            SemanticModel fanOut = SemanticModel.builder()
                .table(Table.of("hub", Column.of("id", DataType.NUMERIC)))
                .table(Table.of("left_side", Column.of("hub_id", DataType.NUMERIC)))
                .table(Table.of("right_side", Column.of("hub_id", DataType.NUMERIC)))
                .relationship(Relationship.oneToMany("hub", "id", "left_side", "hub_id"))
                .relationship(Relationship.oneToMany("hub", "id", "right_side", "hub_id"))
                .build();
            ctx.addTable("left_side");
            ctx.addTable("right_side");

            List<QueryError> errors = validator.validateJoinPath(fanOut, ctx);

            assertThat(ctx.getCommonTable()).isEqualTo("hub");
            assertThat(errors).extracting(QueryError::code)
                .containsExactly(ErrorCode.NO_JOIN_PATH, ErrorCode.NO_JOIN_PATH);
            assertThat(errors).extracting(QueryError::stage)
                .containsOnly(ErrorStage.JOIN_PATH_VALIDATION);
        }

        @Test
        @DisplayName("Unknown table has no common table")
        void testNoCommonTable() {
            ctx.addTable("customers");
            ctx.addTable("ghost");

            assertThat(validator.validateJoinPath(model, ctx)).extracting(QueryError::code)
                .containsExactly(ErrorCode.NO_COMMON_TABLE);
            assertThat(ctx.getCommonTable()).isNull();
        }

        @Test
        @DisplayName("BFS distances cover every reachable table")
        void testBfsDistances() {
            Map<String, Integer> distances = QueryValidator.bfsDistances("customers", model.getRelationshipGraph(false));

            assertThat(distances).containsExactly(
                Map.entry("customers", 0), Map.entry("orders", 1), Map.entry("products", 2));
        }
    }
}
