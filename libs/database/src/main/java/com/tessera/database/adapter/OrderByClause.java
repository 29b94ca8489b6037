package com.tessera.database.adapter;

import java.util.Locale;

/** One sort key. */
public record OrderByClause(String column, Direction direction) {

    public enum Direction {
        ASC,
        DESC;

        public static Direction parse(String value) {
            if (value == null) {
                return ASC;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "asc" -> ASC;
                case "desc" -> DESC;
                default -> throw new IllegalArgumentException("Unknown sort direction: " + value);
            };
        }
    }

    public OrderByClause {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be null or blank");
        }
        if (direction == null) {
            direction = Direction.ASC;
        }
    }
}
