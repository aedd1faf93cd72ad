package io.github.cyfko.phraseql.core.validation;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.model.FormulaNode;

import java.util.List;
import java.util.Map;

/**
 * One semantic pass over a well-formed formula.
 * <p>
 * Checks run in registration order and see the warnings reported by earlier checks, so a later
 * check can avoid repeating what an earlier one already said.
 * </p>
 *
 * @since 1.0
 */
@FunctionalInterface
public interface SemanticCheck {

    /**
     * @param root        parsed formula
     * @param phraseTexts phrase text per letter; letters may be missing
     * @param warnings    warnings reported so far, to append to
     */
    void inspect(FormulaNode root, Map<Character, String> phraseTexts, List<Diagnostic> warnings);
}
