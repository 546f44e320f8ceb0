package org.carball.reducer.compiler;

import org.carball.reducer.model.filter.CompiledPredicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PredicateVerifierTest {

    private PredicateVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new PredicateVerifier();
    }

    @Test
    void shouldAcceptParameterizedConditions() {
        CompiledPredicate predicate = new CompiledPredicate(
                "(\"amount\" BETWEEN ? AND ?) AND (\"status\" IN (?, ?))", List.of(1, 2, "a", "b"));

        assertThatCode(() -> verifier.verify(predicate)).doesNotThrowAnyException();
    }

    @Test
    void shouldAcceptUnconditionalPredicate() {
        assertThatCode(() -> verifier.verify(CompiledPredicate.unconditional())).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectParameterCountMismatch() {
        CompiledPredicate predicate = new CompiledPredicate("(\"amount\" = ?)", List.of(1, 2));

        assertThatThrownBy(() -> verifier.verify(predicate))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 placeholders but 2 parameters");
    }

    @Test
    void shouldRejectLiteralValues() {
        CompiledPredicate predicate = new CompiledPredicate("\"amount\" = 5", List.of());

        assertThatThrownBy(() -> verifier.verify(predicate))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("literal");
    }

    @Test
    void shouldRejectStringLiteralsAndStatementSeparators() {
        assertThatThrownBy(() -> verifier.verify(new CompiledPredicate("(\"status\" = 'paid')", List.of())))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> verifier.verify(new CompiledPredicate("(\"status\" = ?); DELETE", List.of("x"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldIgnoreSpecialCharactersInsideQuotedIdentifiers() {
        assertThat(PredicateVerifier.countPlaceholders("(\"what?\" = ?) AND (\"a--b\" = ?)")).isEqualTo(2);
        assertThat(PredicateVerifier.countPlaceholders("(\"say \"\"hi\"\"?\" = ?)")).isEqualTo(1);
    }

    @Test
    void shouldRejectCommentsOutsideIdentifiers() {
        assertThatThrownBy(() -> PredicateVerifier.countPlaceholders("(\"a\" = ?) -- tail"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> PredicateVerifier.countPlaceholders("(\"a\" = ?) /* x */"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectUnterminatedIdentifier() {
        assertThatThrownBy(() -> PredicateVerifier.countPlaceholders("(\"a = ?)"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    void shouldAcceptIdentifiersWithCharactersTheParserCannotTokenize() {
        CompiledPredicate predicate = new CompiledPredicate(
                "(\"col\nname\" = ?) OR (\"a\"\"b ?\" >= CAST(? AS TIMESTAMP))", List.of("x", "2024-01-01"));

        assertThatCode(() -> verifier.verify(predicate)).doesNotThrowAnyException();
    }

    @Test
    void shouldRenameQuotedIdentifiersBeforeParsing() {
        assertThat(PredicateVerifier.maskIdentifiers("(\"col\nname\" = ?) AND (\"a\"\"b\" IN (?, ?))"))
                .isEqualTo("(\"c1\" = ?) AND (\"c2\" IN (?, ?))");
    }
}
