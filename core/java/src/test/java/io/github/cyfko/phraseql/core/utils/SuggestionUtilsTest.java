package io.github.cyfko.phraseql.core.utils;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SuggestionUtils Tests")
class SuggestionUtilsTest {

    @Test
    @DisplayName("Related kinds share one deduplicated hint")
    void testDeduplication() {
        List<String> suggestions = SuggestionUtils.suggest(List.of(
            Diagnostic.of(DiagnosticKind.PARADOX, "paradox on A"),
            Diagnostic.of(DiagnosticKind.UNSATISFIABLE, "never matches"),
            Diagnostic.of(DiagnosticKind.PARADOX, "paradox on B")
        ));

        assertEquals(List.of("Remove contradictory terms like 'A AND NOT A', or split them into separate conditions."),
            suggestions);
    }

    @Test
    @DisplayName("Hints keep the order of the diagnostics")
    void testOrder() {
        List<String> suggestions = SuggestionUtils.suggest(List.of(
            Diagnostic.of(DiagnosticKind.UNBOUND_VARIABLE, "C unbound"),
            Diagnostic.of(DiagnosticKind.TAUTOLOGY, "tautology"),
            Diagnostic.of(DiagnosticKind.UNBOUND_VARIABLE, "D unbound")
        ));

        assertEquals(List.of(
            "Fill in phrases for the listed variables or remove those letters from the formula.",
            "Simplify tautologies such as 'A OR NOT A' to reduce unnecessary matches."
        ), suggestions);
    }

    @Test
    @DisplayName("All bracket problems share the balancing hint")
    void testBracketHints() {
        List<String> suggestions = SuggestionUtils.suggest(List.of(
            Diagnostic.of(DiagnosticKind.UNMATCHED_OPEN, "open"),
            Diagnostic.of(DiagnosticKind.UNMATCHED_CLOSE, "close"),
            Diagnostic.of(DiagnosticKind.MISMATCHED_BRACKET_KIND, "kind")
        ));

        assertEquals(List.of("Balance parentheses/brackets so every opening symbol has a matching close."), suggestions);
    }

    @Test
    @DisplayName("Unmapped kinds fall back to the message, deduplicated ignoring case")
    void testFallback() {
        List<String> suggestions = SuggestionUtils.suggest(List.of(
            Diagnostic.of(DiagnosticKind.FORMULA_TOO_LONG, "Formula too long"),
            Diagnostic.of(DiagnosticKind.FORMULA_TOO_LONG, "formula TOO long")
        ));

        assertEquals(List.of("Review: Formula too long"), suggestions);
    }

    @ParameterizedTest
    @EnumSource(DiagnosticKind.class)
    @DisplayName("Every kind yields exactly one hint")
    void testEveryKind(DiagnosticKind kind) {
        List<String> suggestions = SuggestionUtils.suggest(List.of(Diagnostic.of(kind, "message")));

        assertEquals(1, suggestions.size());
        assertFalse(suggestions.get(0).isBlank());
    }

    @Test
    @DisplayName("No diagnostics, no hints")
    void testEmpty() {
        assertTrue(SuggestionUtils.suggest(List.of()).isEmpty());
    }
}
