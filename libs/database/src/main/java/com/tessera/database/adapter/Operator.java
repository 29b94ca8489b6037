package com.tessera.database.adapter;

import java.util.Locale;

/** Comparison operators a predicate may use. Each backend decides which it can express. */
public enum Operator {
    EQUALS("="),
    NOT_EQUALS("!="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    LIKE("LIKE"),
    NOT_LIKE("NOT LIKE"),
    ILIKE("ILIKE"),
    IN("IN"),
    NOT_IN("NOT IN"),
    BETWEEN("BETWEEN"),
    NOT_BETWEEN("NOT BETWEEN"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** IS NULL / IS NOT NULL take no operand. */
    public boolean unary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /** IN / NOT IN / BETWEEN / NOT BETWEEN take a list operand. */
    public boolean takesList() {
        return this == IN || this == NOT_IN || this == BETWEEN || this == NOT_BETWEEN;
    }

    public boolean isComparison() {
        return switch (this) {
            case EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN,
                    LESS_THAN_OR_EQUAL -> true;
            default -> false;
        };
    }

    /**
     * Parses an operator symbol. Matching ignores case and repeated whitespace; {@code <>} is
     * accepted for {@link #NOT_EQUALS}.
     *
     * @throws IllegalArgumentException for an unknown symbol
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("operator must not be null");
        }
        String normalized = symbol.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (normalized.equals("<>")) {
            return NOT_EQUALS;
        }
        for (Operator operator : values()) {
            if (operator.symbol.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }
}
