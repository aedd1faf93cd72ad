package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.diagnostic.ParseError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns tokens into a {@link io.github.cyfko.phraseql.core.model.FormulaNode} tree.
 *
 * <pre>
 * tokens -> TokenSequenceChecker -> PostfixConverter -> PostfixTreeBuilder -> tree
 * </pre>
 *
 * @since 1.0
 */
public final class FormulaParser {

    private FormulaParser() {}

    public static ParseOutcome parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");

        Optional<ParseError> error = TokenSequenceChecker.check(tokens);
        if (error.isPresent()) {
            return ParseOutcome.failure(error.get());
        }
        return PostfixTreeBuilder.build(PostfixConverter.toPostfix(tokens));
    }

    /**
     * Normalizes, tokenizes and parses raw formula text in one step.
     */
    public static ParseOutcome parse(String raw, Set<Character> alphabet) {
        return parse(FormulaTokenizer.tokenize(FormulaNormalizer.normalize(raw), alphabet));
    }
}
