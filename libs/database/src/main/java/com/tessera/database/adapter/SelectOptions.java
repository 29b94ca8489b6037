package com.tessera.database.adapter;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a {@code select} needs besides the table name.
 *
 * @param columns projection; empty means all columns
 * @param where predicates in declaration order
 * @param orderBy sort keys
 * @param limit maximum rows, null for no limit
 * @param offset rows to skip, null for none
 * @param joins relational joins
 */
public record SelectOptions(
        List<String> columns,
        List<WhereClause> where,
        List<OrderByClause> orderBy,
        Integer limit,
        Integer offset,
        List<JoinClause> joins) {

    public SelectOptions {
        columns = columns == null ? List.of() : List.copyOf(columns);
        where = where == null ? List.of() : List.copyOf(where);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        joins = joins == null ? List.of() : List.copyOf(joins);
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
    }

    public static SelectOptions all() {
        return new SelectOptions(null, null, null, null, null, null);
    }

    public static SelectOptions where(List<WhereClause> where) {
        return new SelectOptions(null, where, null, null, null, null);
    }

    /** Projection of all columns. */
    public boolean selectsAll() {
        return columns.isEmpty() || (columns.size() == 1 && "*".equals(columns.get(0)));
    }

    /** Same filters and joins, no projection, ordering or paging. Used for aggregates. */
    public SelectOptions withoutPaging() {
        return new SelectOptions(null, where, null, null, null, joins);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> columns = new ArrayList<>();
        private final List<WhereClause> where = new ArrayList<>();
        private final List<OrderByClause> orderBy = new ArrayList<>();
        private final List<JoinClause> joins = new ArrayList<>();
        private Integer limit;
        private Integer offset;

        private Builder() {}

        public Builder columns(List<String> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder where(WhereClause clause) {
            this.where.add(clause);
            return this;
        }

        public Builder where(List<WhereClause> clauses) {
            this.where.addAll(clauses);
            return this;
        }

        public Builder orderBy(OrderByClause clause) {
            this.orderBy.add(clause);
            return this;
        }

        public Builder orderBy(List<OrderByClause> clauses) {
            this.orderBy.addAll(clauses);
            return this;
        }

        public Builder join(JoinClause join) {
            this.joins.add(join);
            return this;
        }

        public Builder joins(List<JoinClause> joins) {
            this.joins.addAll(joins);
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public SelectOptions build() {
            return new SelectOptions(columns, where, orderBy, limit, offset, joins);
        }
    }
}
