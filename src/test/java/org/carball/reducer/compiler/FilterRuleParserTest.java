package org.carball.reducer.compiler;

import org.carball.reducer.compiler.FilterRuleParser.FilterRequest;
import org.carball.reducer.exception.MalformedOperandException;
import org.carball.reducer.model.filter.FilterLogic;
import org.carball.reducer.model.filter.FilterRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FilterRuleParserTest {

    @TempDir
    Path tempDir;

    private FilterRuleParser parser;

    @BeforeEach
    void setUp() {
        parser = new FilterRuleParser();
    }

    @Test
    void shouldParseRulesAndLogic() throws IOException {
        // Given
        String payload = """
                {
                  "logic": "or",
                  "filters": [
                    {"column": "amount", "op": "between", "value": [100, 500]},
                    {"column": "status", "operator": "=", "value": "paid"},
                    {"column": "vip", "op": "eq", "value": true},
                    {"column": "ratio", "op": "gt", "value": 0.5}
                  ]
                }
                """;

        // When
        FilterRequest request = parser.parse(payload);

        // Then
        assertThat(request.logic()).isEqualTo(FilterLogic.OR);
        assertThat(request.rules()).hasSize(4);

        FilterRule between = request.rules().get(0);
        assertThat(between.column()).isEqualTo("amount");
        assertThat(between.operator()).isEqualTo("between");
        assertThat(between.value().isList()).isTrue();
        assertThat(between.value().elements()).containsExactly(100L, 500L);

        assertThat(request.rules().get(1).operator()).isEqualTo("=");
        assertThat(request.rules().get(1).value().scalar()).isEqualTo("paid");
        assertThat(request.rules().get(2).value().scalar()).isEqualTo(true);
        assertThat(request.rules().get(3).value().scalar()).isEqualTo(0.5);
    }

    @Test
    void shouldDefaultToAndWithNoFilters() throws IOException {
        FilterRequest request = parser.parse("{}");

        assertThat(request.logic()).isEqualTo(FilterLogic.AND);
        assertThat(request.rules()).isEmpty();
    }

    @Test
    void shouldPassUnknownOperatorsThrough() throws IOException {
        FilterRequest request = parser.parse("{\"filters\": [{\"column\": \"a\", \"op\": \"like\", \"value\": \"x\"}]}");

        assertThat(request.rules().get(0).operator()).isEqualTo("like");
    }

    @Test
    void shouldRejectNestedValues() {
        String payload = "{\"filters\": [{\"column\": \"a\", \"op\": \"in\", \"value\": [[1, 2]]}]}";

        assertThatThrownBy(() -> parser.parse(payload))
                .isInstanceOf(MalformedOperandException.class);
    }

    @Test
    void shouldRejectNonObjectPayloads() {
        assertThatThrownBy(() -> parser.parse("[1, 2]"))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> parser.parse("{\"filters\": \"amount > 1\"}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("array");
    }

    @Test
    void shouldReadPayloadFromFile() throws IOException {
        // Given
        Path file = tempDir.resolve("filters.json");
        Files.writeString(file, "{\"filters\": [{\"column\": \"status\", \"op\": \"in\", \"value\": [\"a\", \"b\"]}]}");

        // When
        FilterRequest request = parser.parse(file);

        // Then
        assertThat(request.rules().get(0).value().elements()).containsExactly("a", "b");
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}
