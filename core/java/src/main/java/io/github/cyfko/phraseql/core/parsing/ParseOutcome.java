package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.diagnostic.ParseError;
import io.github.cyfko.phraseql.core.model.FormulaNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link FormulaParser#parse(java.util.List)}: either a tree or the first parse error.
 *
 * @since 1.0
 */
public final class ParseOutcome {

    private final FormulaNode root;
    private final ParseError error;

    private ParseOutcome(FormulaNode root, ParseError error) {
        this.root = root;
        this.error = error;
    }

    public static ParseOutcome success(FormulaNode root) {
        return new ParseOutcome(Objects.requireNonNull(root, "root"), null);
    }

    public static ParseOutcome failure(ParseError error) {
        return new ParseOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return root != null;
    }

    public Optional<FormulaNode> root() {
        return Optional.ofNullable(root);
    }

    public Optional<ParseError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseOutcome[success=" + root + "]" : "ParseOutcome[failure=" + error + "]";
    }
}
