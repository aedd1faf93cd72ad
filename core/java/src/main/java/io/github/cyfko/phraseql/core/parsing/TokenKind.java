package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.model.BinaryOperator;

import java.util.Optional;

/**
 * Lexical categories produced by {@link FormulaTokenizer}.
 *
 * @since 1.0
 */
public enum TokenKind {
    VARIABLE,
    AND,
    OR,
    NOT,
    NOR,
    XOR,
    XNOR,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    INVALID;

    public boolean isBinaryOperator() {
        return this == AND || this == OR || this == NOR || this == XOR || this == XNOR;
    }

    public boolean isOperator() {
        return this == NOT || isBinaryOperator();
    }

    /**
     * @throws IllegalStateException if this kind is not a binary operator
     */
    public BinaryOperator toBinaryOperator() {
        return switch (this) {
            case AND -> BinaryOperator.AND;
            case OR -> BinaryOperator.OR;
            case NOR -> BinaryOperator.NOR;
            case XOR -> BinaryOperator.XOR;
            case XNOR -> BinaryOperator.XNOR;
            default -> throw new IllegalStateException(this + " is not a binary operator");
        };
    }

    /**
     * Resolves an upper-case word to an operator keyword.
     */
    public static Optional<TokenKind> keyword(String word) {
        return switch (word) {
            case "AND" -> Optional.of(AND);
            case "OR" -> Optional.of(OR);
            case "NOT" -> Optional.of(NOT);
            case "NOR" -> Optional.of(NOR);
            case "XOR" -> Optional.of(XOR);
            case "XNOR" -> Optional.of(XNOR);
            default -> Optional.empty();
        };
    }
}
