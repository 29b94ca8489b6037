package com.tessera.database.adapter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One backend-neutral filter predicate.
 *
 * <ul>
 *   <li>{@link Kind#BASIC}: {@code column operator value}
 *   <li>{@link Kind#COLUMN}: {@code column operator otherColumn}; {@code value} holds the other
 *       column name
 *   <li>{@link Kind#NESTED}: a parenthesised group held in {@code nested}
 *   <li>{@link Kind#RAW}: backend-native SQL in {@code column}, bindings in {@code value}
 * </ul>
 *
 * @param kind predicate shape
 * @param column column name (or raw SQL for {@code RAW})
 * @param operator comparison operator, null for {@code NESTED} and {@code RAW}
 * @param value operand; a {@code List} for list operators and {@code RAW} bindings
 * @param bool connective to the previous predicate
 * @param nested group members for {@code NESTED}, otherwise empty
 */
public record WhereClause(
        Kind kind,
        String column,
        Operator operator,
        Object value,
        BooleanOperator bool,
        List<WhereClause> nested) {

    public enum Kind {
        BASIC,
        COLUMN,
        NESTED,
        RAW
    }

    public WhereClause {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(bool, "bool");
        nested = nested == null ? List.of() : List.copyOf(nested);
        if (operator != null && operator.takesList() && kind == Kind.BASIC) {
            value = listOf(value);
            if ((operator == Operator.BETWEEN || operator == Operator.NOT_BETWEEN)
                    && ((List<?>) value).size() != 2) {
                throw new IllegalArgumentException(operator.symbol() + " requires exactly two values");
            }
        }
    }

    public static WhereClause basic(
            String column, Operator operator, Object value, BooleanOperator bool) {
        requireColumn(column);
        Objects.requireNonNull(operator, "operator");
        return new WhereClause(Kind.BASIC, column, operator, value, bool, List.of());
    }

    public static WhereClause columns(
            String first, Operator operator, String second, BooleanOperator bool) {
        requireColumn(first);
        requireColumn(second);
        if (!operator.isComparison()) {
            throw new IllegalArgumentException(
                    "Column comparisons only accept comparison operators, got " + operator.symbol());
        }
        return new WhereClause(Kind.COLUMN, first, operator, second, bool, List.of());
    }

    public static WhereClause nested(List<WhereClause> clauses, BooleanOperator bool) {
        return new WhereClause(Kind.NESTED, null, null, null, bool, clauses);
    }

    public static WhereClause raw(String sql, List<?> bindings, BooleanOperator bool) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("raw SQL must not be blank");
        }
        return new WhereClause(
                Kind.RAW, sql, null, bindings == null ? List.of() : copyAllowingNulls(bindings), bool, List.of());
    }

    /** Operand as a list, for list operators and raw bindings. */
    public List<Object> values() {
        return value instanceof List<?> list ? Collections.unmodifiableList(list) : List.of();
    }

    private static void requireColumn(String column) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be null or blank");
        }
    }

    private static List<Object> listOf(Object value) {
        if (value instanceof Collection<?> collection) {
            return copyAllowingNulls(collection);
        }
        if (value instanceof Object[] array) {
            return copyAllowingNulls(Arrays.asList(array));
        }
        throw new IllegalArgumentException("List operator requires a collection or array operand");
    }

    private static List<Object> copyAllowingNulls(Collection<?> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
