package com.tessera.database.adapter;

/**
 * A join against another table, relational backends only.
 *
 * @param type join kind
 * @param table joined table
 * @param first left-hand column, usually qualified ({@code users.id})
 * @param operator comparison between the two columns
 * @param second right-hand column
 */
public record JoinClause(JoinType type, String table, String first, Operator operator, String second) {

    public enum JoinType {
        INNER,
        LEFT,
        RIGHT
    }

    public JoinClause {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be null or blank");
        }
        if (first == null || second == null) {
            throw new IllegalArgumentException("join columns must not be null");
        }
        if (operator == null || !operator.isComparison()) {
            throw new IllegalArgumentException("join operator must be a comparison");
        }
    }
}
