package com.datachain.query;

import com.datachain.semantic.TableEdge;
import com.datachain.test.TestBase;
import com.datachain.test.TestCategories;
import com.datachain.types.Aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for QueryContext bookkeeping.
 */
@TestCategories.Unit
@DisplayName("QueryContext Tests")
public class QueryContextTest extends TestBase {

    @Test
    @DisplayName("Join edges are deduplicated and keep insertion order")
    void testJoinDedup() {
        QueryContext ctx = new QueryContext();

        assertThat(ctx.addJoin(new TableEdge("customers", "orders"))).isTrue();
        assertThat(ctx.addJoin(new TableEdge("products", "orders"))).isTrue();
        assertThat(ctx.addJoin(new TableEdge("customers", "orders"))).isFalse();

        assertThat(ctx.getJoins()).containsExactly(
            new TableEdge("customers", "orders"), new TableEdge("products", "orders"));
    }

    @Test
    @DisplayName("First alias registered for an aggregate is kept")
    void testUniqueMeasures() {
        QueryContext ctx = new QueryContext();
        MeasureKey key = new MeasureKey("orders", "revenue", Aggregation.SUM);

        ctx.putUniqueMeasure(key, "revenue");
        ctx.putUniqueMeasure(key, "other");

        assertThat(ctx.getUniqueMeasures()).containsOnly(entry(key, "revenue"));
        assertThat(key).hasToString("SUM(orders.revenue)");
    }

    @Test
    @DisplayName("Views are read-only")
    void testReadOnlyViews() {
        QueryContext ctx = new QueryContext();
        ctx.addTable("orders");
        ctx.trace("step");
        ctx.warn("careful");

        assertThat(ctx.getTables()).containsExactly("orders");
        assertThat(ctx.getTrace()).containsExactly("step");
        assertThat(ctx.getWarnings()).containsExactly("careful");
        assertThatThrownBy(() -> ctx.getTables().add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ctx.getTrace().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
