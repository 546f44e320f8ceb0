package org.carball.reducer.engine;

import org.carball.reducer.model.filter.CompiledPredicate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SelectStatementTest {

    @Test
    void shouldRenderPlainSelectWithoutWhereClause() {
        SelectStatement statement = SelectStatement.builder().build();

        assertThat(statement.render("src")).isEqualTo("SELECT * FROM src");
    }

    @Test
    void shouldRenderAllClausesInOrder() {
        // Given
        SelectStatement statement = SelectStatement.builder()
                .projection("\"k\" AS key, SUM(\"v\") AS value")
                .predicate(new CompiledPredicate("(\"v\" > ?)", List.of(5)))
                .groupBy("\"k\"")
                .orderBy("value DESC, key")
                .limit(3)
                .build();

        // When
        String sql = statement.render("src");

        // Then
        assertThat(sql).isEqualTo("SELECT \"k\" AS key, SUM(\"v\") AS value FROM src WHERE (\"v\" > ?)"
                + " GROUP BY \"k\" ORDER BY value DESC, key LIMIT 3");
    }

    @Test
    void shouldRejectNegativeLimit() {
        SelectStatement statement = SelectStatement.builder().limit(-1).build();

        assertThatThrownBy(() -> statement.render("src"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
