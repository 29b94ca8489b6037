package com.tessera.database.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WhereClause")
class WhereClauseTest {

    @Test
    @DisplayName("list operators copy collections and arrays, keeping nulls")
    void listOperands() {
        var fromArray = WhereClause.basic("id", Operator.IN, new Object[] {1, null}, BooleanOperator.AND);
        var fromSet = WhereClause.basic("id", Operator.NOT_IN, Set.of(3), BooleanOperator.OR);

        assertThat(fromArray.values()).isEqualTo(Arrays.asList(1, null));
        assertThat(fromSet.values()).containsExactly(3);
        assertThatThrownBy(() -> WhereClause.basic("id", Operator.IN, 5, BooleanOperator.AND))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("between needs exactly two bounds")
    void between() {
        assertThat(WhereClause.basic("n", Operator.BETWEEN, List.of(1, 5), BooleanOperator.AND).values())
                .containsExactly(1, 5);
        assertThatThrownBy(() -> WhereClause.basic("n", Operator.BETWEEN, List.of(1), BooleanOperator.AND))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("column comparisons accept comparison operators only")
    void columnComparisons() {
        var clause = WhereClause.columns("a", Operator.LESS_THAN, "b", BooleanOperator.AND);

        assertThat(clause.kind()).isEqualTo(WhereClause.Kind.COLUMN);
        assertThatThrownBy(() -> WhereClause.columns("a", Operator.LIKE, "b", BooleanOperator.AND))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("raw clauses need SQL and keep their bindings")
    void raw() {
        var clause = WhereClause.raw("score > ?", Arrays.asList(10, null), BooleanOperator.AND);

        assertThat(clause.values()).isEqualTo(Arrays.asList(10, null));
        assertThatThrownBy(() -> WhereClause.raw(" ", List.of(), BooleanOperator.AND))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("blank columns are rejected")
    void blankColumn() {
        assertThatThrownBy(() -> WhereClause.basic(" ", Operator.EQUALS, 1, BooleanOperator.AND))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("like patterns translate to anchored regular expressions")
    void likePatterns() {
        assertThat(LikePatterns.compile("a%c_", false).matcher("abbbcd").matches()).isTrue();
        assertThat(LikePatterns.compile("a.c", false).matcher("abc").matches()).isFalse();
        assertThat(LikePatterns.compile("ADA%", true).matcher("ada lovelace").matches()).isTrue();
    }
}
