package com.datachain.logical;

import com.datachain.expression.Expression;
import com.datachain.expression.Predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root node of the SQL AST.
 *
 * <p>The source is either a table or a nested query. A nested source marks a
 * staged compilation: the generator renders it as a single
 * {@code WITH <name> AS (...)} block ahead of the outer SELECT.
 *
 * <p>Optional clauses are empty lists or null, never absent from the record.
 *
 * @param source FROM target
 * @param select select list, in output order
 * @param where WHERE predicate, may be null
 * @param joins joins in emission order
 * @param groupBy GROUP BY expressions
 * @param having HAVING predicate, may be null
 * @param orderBy ORDER BY entries
 * @param limit LIMIT, may be null
 * @param offset OFFSET, may be null
 */
public record SqlQuery(Source source, List<SelectItem> select, Predicate where, List<SqlJoin> joins,
                       List<Expression> groupBy, Predicate having, List<SortOrder> orderBy,
                       Integer limit, Integer offset) {

    /**
     * FROM target of a query.
     */
    public sealed interface Source permits TableSource, QuerySource {
    }

    public record TableSource(String name) implements Source {
        public TableSource {
            Objects.requireNonNull(name, "table name must not be null");
        }
    }

    /**
     * Nested query exposed under {@code name} (the CTE name).
     */
    public record QuerySource(SqlQuery query, String name) implements Source {
        public QuerySource {
            Objects.requireNonNull(query, "nested query must not be null");
            Objects.requireNonNull(name, "CTE name must not be null");
        }
    }

    public SqlQuery {
        Objects.requireNonNull(source, "source must not be null");
        select = select == null ? List.of() : List.copyOf(select);
        joins = joins == null ? List.of() : List.copyOf(joins);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    public boolean isStaged() {
        return source instanceof QuerySource;
    }

    public static Builder from(String table) {
        return new Builder(new TableSource(table));
    }

    public static Builder from(SqlQuery inner, String cteName) {
        return new Builder(new QuerySource(inner, cteName));
    }

    /**
     * Incremental builder used by the planner.
     */
    public static final class Builder {
        private final Source source;
        private final List<SelectItem> select = new ArrayList<>();
        private final List<SqlJoin> joins = new ArrayList<>();
        private final List<Expression> groupBy = new ArrayList<>();
        private final List<SortOrder> orderBy = new ArrayList<>();
        private Predicate where;
        private Predicate having;
        private Integer limit;
        private Integer offset;

        private Builder(Source source) {
            this.source = source;
        }

        public Builder select(String alias, Expression expression) {
            select.add(new SelectItem(alias, expression));
            return this;
        }

        public Builder select(List<SelectItem> items) {
            select.addAll(items);
            return this;
        }

        public Builder join(SqlJoin join) {
            joins.add(join);
            return this;
        }

        public Builder joins(List<SqlJoin> items) {
            joins.addAll(items);
            return this;
        }

        public Builder where(Predicate predicate) {
            this.where = predicate;
            return this;
        }

        public Builder groupBy(List<Expression> expressions) {
            groupBy.addAll(expressions);
            return this;
        }

        public Builder having(Predicate predicate) {
            this.having = predicate;
            return this;
        }

        public Builder orderBy(SortOrder order) {
            orderBy.add(order);
            return this;
        }

        public Builder limit(Integer value) {
            this.limit = value;
            return this;
        }

        public Builder offset(Integer value) {
            this.offset = value;
            return this;
        }

        public SqlQuery build() {
            return new SqlQuery(source, select, where, joins, groupBy, having, orderBy, limit, offset);
        }
    }
}
