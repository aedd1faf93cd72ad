package io.github.cyfko.phraseql.core.validation;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import io.github.cyfko.phraseql.core.model.FormulaNode;
import io.github.cyfko.phraseql.core.model.TextSpan;

import java.util.List;
import java.util.Map;

/**
 * Warns about letters used in the formula whose phrase is missing or blank, in the order they
 * first appear. Such letters always evaluate to false.
 *
 * @since 1.0
 */
public final class UnboundVariableCheck implements SemanticCheck {

    @Override
    public void inspect(FormulaNode root, Map<Character, String> phraseTexts, List<Diagnostic> warnings) {
        for (Map.Entry<Character, TextSpan> reference : root.references().entrySet()) {
            char letter = reference.getKey();
            String text = lookup(phraseTexts, letter);
            if (text == null || text.isBlank()) {
                warnings.add(Diagnostic.forLetter(DiagnosticKind.UNBOUND_VARIABLE, letter,
                    String.format("Variable %s is used in formula but has no corresponding phrase", letter),
                    reference.getValue()));
            }
        }
    }

    private static String lookup(Map<Character, String> phraseTexts, char letter) {
        String text = phraseTexts.get(letter);
        return text != null ? text : phraseTexts.get(Character.toLowerCase(letter));
    }
}
