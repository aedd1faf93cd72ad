package io.github.cyfko.phraseql.core.utils;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps diagnostics to short remediation hints for the user.
 *
 * @since 1.0
 */
public final class SuggestionUtils {

    private static final String BALANCE =
        "Balance parentheses/brackets so every opening symbol has a matching close.";
    private static final String OPERANDS =
        "Provide values on both sides of each operator, such as 'A OR (B AND C)'.";
    private static final String CONTRADICTION =
        "Remove contradictory terms like 'A AND NOT A', or split them into separate conditions.";
    private static final String TAUTOLOGY =
        "Simplify tautologies such as 'A OR NOT A' to reduce unnecessary matches.";

    private static final Map<DiagnosticKind, String> SUGGESTIONS = new EnumMap<>(DiagnosticKind.class);

    static {
        SUGGESTIONS.put(DiagnosticKind.EMPTY_FORMULA,
            "Enter phrases and a formula, or leave the formula empty to combine all phrases with AND.");
        SUGGESTIONS.put(DiagnosticKind.INVALID_CHARACTER,
            "Replace unsupported characters with AND/OR/NOT operators or parentheses.");
        SUGGESTIONS.put(DiagnosticKind.UNMATCHED_OPEN, BALANCE);
        SUGGESTIONS.put(DiagnosticKind.UNMATCHED_CLOSE, BALANCE);
        SUGGESTIONS.put(DiagnosticKind.MISMATCHED_BRACKET_KIND, BALANCE);
        SUGGESTIONS.put(DiagnosticKind.EMPTY_GROUP,
            "Add content inside the empty parentheses or remove them entirely.");
        SUGGESTIONS.put(DiagnosticKind.ADJACENT_VARIABLES,
            "Ensure each variable is separated by an operator, e.g. 'A AND B'.");
        SUGGESTIONS.put(DiagnosticKind.CONSECUTIVE_BINARY_OPERATORS, OPERANDS);
        SUGGESTIONS.put(DiagnosticKind.DANGLING_OPERATOR, OPERANDS);
        SUGGESTIONS.put(DiagnosticKind.MISSING_NOT_OPERAND, OPERANDS);
        SUGGESTIONS.put(DiagnosticKind.PARADOX, CONTRADICTION);
        SUGGESTIONS.put(DiagnosticKind.UNSATISFIABLE, CONTRADICTION);
        SUGGESTIONS.put(DiagnosticKind.TAUTOLOGY, TAUTOLOGY);
        SUGGESTIONS.put(DiagnosticKind.ALWAYS_TRUE, TAUTOLOGY);
        SUGGESTIONS.put(DiagnosticKind.UNBOUND_VARIABLE,
            "Fill in phrases for the listed variables or remove those letters from the formula.");
    }

    private SuggestionUtils() {}

    /**
     * One hint per distinct problem, in diagnostic order. Kinds without a dedicated hint fall back
     * to {@code "Review: " + message}; hints are deduplicated ignoring case.
     */
    public static List<String> suggest(List<Diagnostic> diagnostics) {
        Objects.requireNonNull(diagnostics, "diagnostics");

        List<String> suggestions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Diagnostic diagnostic : diagnostics) {
            String suggestion = SUGGESTIONS.getOrDefault(diagnostic.kind(), "Review: " + diagnostic.message());
            if (seen.add(suggestion.toLowerCase(Locale.ROOT))) {
                suggestions.add(suggestion);
            }
        }
        return suggestions;
    }
}
