package io.github.cyfko.phraseql.core.api;

import io.github.cyfko.phraseql.core.model.FormulaNode;
import io.github.cyfko.phraseql.core.model.PhraseBindingSet;

import java.util.List;
import java.util.Set;

/**
 * A successfully parsed formula, ready to be evaluated any number of times.
 * <p>
 * Implementations are immutable and thread-safe: a scan may share one compiled formula across
 * all its worker threads and evaluate it against different binding sets and contents.
 * </p>
 *
 * @since 1.0
 */
public interface CompiledFormula {

    /**
     * Formula text as given to the engine.
     */
    String sourceText();

    /**
     * Normalized text; every span in the tree refers to this string.
     */
    String normalizedText();

    FormulaNode root();

    /**
     * Alphabet the formula was compiled against.
     */
    Set<Character> alphabet();

    /**
     * Distinct letters referenced by the formula, in first-reference order.
     */
    List<Character> referencedLetters();

    /**
     * Tests the formula against one piece of content, typically a line or a whole file.
     */
    boolean evaluate(PhraseBindingSet bindings, String content);

    /**
     * Fully bracketed rendering showing how operators were grouped.
     */
    String canonicalText();
}
