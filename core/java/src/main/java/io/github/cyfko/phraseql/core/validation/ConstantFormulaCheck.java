package io.github.cyfko.phraseql.core.validation;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import io.github.cyfko.phraseql.core.evaluation.FormulaEvaluator;
import io.github.cyfko.phraseql.core.model.FormulaNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Detects formulas whose value does not depend on any phrase, by evaluating every assignment
 * of the referenced letters.
 * <p>
 * This catches constants the chain checks cannot see, such as {@code A XOR A} or
 * {@code A NOR NOT A}. Formulas referencing more letters than the configured limit are skipped.
 * A formula already reported as a paradox is not reported again as unsatisfiable, and a
 * tautology is not reported again as always true.
 * </p>
 *
 * @since 1.0
 */
public final class ConstantFormulaCheck implements SemanticCheck {

    private final int maxVariables;

    /**
     * @param maxVariables largest number of distinct letters to enumerate; 0 disables the check
     */
    public ConstantFormulaCheck(int maxVariables) {
        if (maxVariables < 0 || maxVariables > 30) {
            throw new IllegalArgumentException("maxVariables must be between 0 and 30, got: " + maxVariables);
        }
        this.maxVariables = maxVariables;
    }

    @Override
    public void inspect(FormulaNode root, Map<Character, String> phraseTexts, List<Diagnostic> warnings) {
        List<Character> letters = new ArrayList<>(root.references().keySet());
        if (letters.isEmpty() || letters.size() > maxVariables) {
            return;
        }

        boolean seenTrue = false;
        boolean seenFalse = false;
        int combinations = 1 << letters.size();

        for (int mask = 0; mask < combinations && !(seenTrue && seenFalse); mask++) {
            final int bits = mask;
            boolean value = FormulaEvaluator.evaluate(root, letter -> (bits & (1 << letters.indexOf(letter))) != 0);
            if (value) {
                seenTrue = true;
            } else {
                seenFalse = true;
            }
        }

        if (!seenTrue && !alreadyReported(warnings, DiagnosticKind.PARADOX)) {
            warnings.add(Diagnostic.of(DiagnosticKind.UNSATISFIABLE,
                "Formula can never match: it is false for every combination of phrases", root.span()));
        } else if (!seenFalse && !alreadyReported(warnings, DiagnosticKind.TAUTOLOGY)) {
            warnings.add(Diagnostic.of(DiagnosticKind.ALWAYS_TRUE,
                "Formula always matches: it is true for every combination of phrases", root.span()));
        }
    }

    private static boolean alreadyReported(List<Diagnostic> warnings, DiagnosticKind kind) {
        return warnings.stream().anyMatch(w -> w.kind() == kind);
    }
}
