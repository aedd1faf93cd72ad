package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.model.BracketKind;
import io.github.cyfko.phraseql.core.model.TextSpan;

import java.util.Objects;

/**
 * A typed, positioned token of a normalized formula.
 *
 * @param kind        lexical category
 * @param lexeme      the source characters, as written
 * @param span        position in the normalized formula
 * @param letter      upper-case variable letter, {@code '\0'} unless {@code kind} is {@link TokenKind#VARIABLE}
 * @param bracketKind bracket shape, null unless {@code kind} is a bracket
 * @since 1.0
 */
public record Token(TokenKind kind, String lexeme, TextSpan span, char letter, BracketKind bracketKind) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
        Objects.requireNonNull(span, "span");
    }

    public static Token variable(char letter, String lexeme, TextSpan span) {
        return new Token(TokenKind.VARIABLE, lexeme, span, Character.toUpperCase(letter), null);
    }

    public static Token operator(TokenKind kind, String lexeme, TextSpan span) {
        if (!kind.isOperator()) {
            throw new IllegalArgumentException(kind + " is not an operator");
        }
        return new Token(kind, lexeme, span, '\0', null);
    }

    public static Token leftBracket(BracketKind bracketKind, TextSpan span) {
        return new Token(TokenKind.LEFT_BRACKET, String.valueOf(bracketKind.open()), span, '\0', bracketKind);
    }

    public static Token rightBracket(BracketKind bracketKind, TextSpan span) {
        return new Token(TokenKind.RIGHT_BRACKET, String.valueOf(bracketKind.close()), span, '\0', bracketKind);
    }

    public static Token invalid(String lexeme, TextSpan span) {
        return new Token(TokenKind.INVALID, lexeme, span, '\0', null);
    }

    /**
     * True for tokens that end an operand: a variable or a closing bracket.
     */
    public boolean endsOperand() {
        return kind == TokenKind.VARIABLE || kind == TokenKind.RIGHT_BRACKET;
    }

    /**
     * True for tokens that can only start an operand: a variable, an opening bracket or {@code NOT}.
     */
    public boolean startsOperand() {
        return kind == TokenKind.VARIABLE || kind == TokenKind.LEFT_BRACKET || kind == TokenKind.NOT;
    }

    @Override
    public String toString() {
        return kind + "('" + lexeme + "')" + span;
    }
}
