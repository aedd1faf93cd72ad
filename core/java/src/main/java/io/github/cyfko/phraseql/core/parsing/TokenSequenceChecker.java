package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import io.github.cyfko.phraseql.core.diagnostic.ParseError;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Lexical passes run over the token stream before any tree is built.
 * <p>
 * Once these passes accept a stream, postfix conversion and tree building cannot fail: brackets
 * are balanced, every binary operator has an operand on each side and every {@code NOT} is
 * followed by an operand. Only the first problem found is reported, in this order:
 * </p>
 * <ol>
 *   <li>no tokens at all;</li>
 *   <li>an invalid character or word;</li>
 *   <li>bracket balance, left to right;</li>
 *   <li>token sequence, left to right.</li>
 * </ol>
 * <p>
 * Positions quoted in messages are 1-based, as shown to users; spans stay 0-based.
 * </p>
 *
 * @since 1.0
 */
public final class TokenSequenceChecker {

    private TokenSequenceChecker() {}

    /**
     * @return the first problem of the stream, or empty when the stream is well formed
     */
    public static Optional<ParseError> check(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return Optional.of(ParseError.of(DiagnosticKind.EMPTY_FORMULA,
                "The formula is empty. Add phrases or enter a custom expression."));
        }

        for (Token token : tokens) {
            if (token.kind() == TokenKind.INVALID) {
                return Optional.of(ParseError.of(DiagnosticKind.INVALID_CHARACTER,
                    String.format("Invalid characters found: '%s' at position %d",
                        token.lexeme(), token.span().start() + 1),
                    token.span()));
            }
        }

        Optional<ParseError> bracketError = checkBrackets(tokens);
        if (bracketError.isPresent()) {
            return bracketError;
        }

        return checkSequence(tokens);
    }

    private static Optional<ParseError> checkBrackets(List<Token> tokens) {
        Deque<Token> open = new ArrayDeque<>();

        for (Token token : tokens) {
            if (token.kind() == TokenKind.LEFT_BRACKET) {
                open.push(token);
            } else if (token.kind() == TokenKind.RIGHT_BRACKET) {
                if (open.isEmpty()) {
                    return Optional.of(ParseError.of(DiagnosticKind.UNMATCHED_CLOSE,
                        String.format("Unmatched closing '%s' at position %d",
                            token.lexeme(), token.span().start() + 1),
                        token.span()));
                }
                Token opening = open.pop();
                if (opening.bracketKind() != token.bracketKind()) {
                    return Optional.of(ParseError.of(DiagnosticKind.MISMATCHED_BRACKET_KIND,
                        String.format("Mismatched parentheses: '%s' at position %d closed by '%s' at position %d",
                            opening.lexeme(), opening.span().start() + 1,
                            token.lexeme(), token.span().start() + 1),
                        token.span()));
                }
            }
        }

        if (!open.isEmpty()) {
            // Report the outermost bracket left open
            Token unclosed = open.peekLast();
            return Optional.of(ParseError.of(DiagnosticKind.UNMATCHED_OPEN,
                String.format("Unclosed '%s' at position %d", unclosed.lexeme(), unclosed.span().start() + 1),
                unclosed.span()));
        }
        return Optional.empty();
    }

    private static Optional<ParseError> checkSequence(List<Token> tokens) {
        int last = tokens.size() - 1;

        for (int i = 0; i <= last; i++) {
            Token current = tokens.get(i);
            Token previous = i > 0 ? tokens.get(i - 1) : null;
            Token next = i < last ? tokens.get(i + 1) : null;

            switch (current.kind()) {
                case AND, OR, NOR, XOR, XNOR -> {
                    if (previous == null) {
                        return error(DiagnosticKind.DANGLING_OPERATOR, current,
                            "'%s' operator at start of formula needs left operand", current);
                    }
                    if (previous.kind().isBinaryOperator()) {
                        return Optional.of(ParseError.of(DiagnosticKind.CONSECUTIVE_BINARY_OPERATORS,
                            String.format("Invalid sequence: '%s %s' - consecutive operators",
                                previous.lexeme(), current.lexeme()),
                            current.span()));
                    }
                    if (previous.kind() == TokenKind.LEFT_BRACKET) {
                        return error(DiagnosticKind.DANGLING_OPERATOR, current,
                            "'%s' operator missing valid left operand", current);
                    }
                    if (next == null) {
                        return error(DiagnosticKind.DANGLING_OPERATOR, current,
                            "'%s' operator at end of formula needs right operand", current);
                    }
                    if (next.kind() == TokenKind.RIGHT_BRACKET) {
                        return error(DiagnosticKind.DANGLING_OPERATOR, current,
                            "'%s' operator missing valid right operand", current);
                    }
                }
                case NOT -> {
                    if (next == null) {
                        return error(DiagnosticKind.MISSING_NOT_OPERAND, current,
                            "'%s' operator at end of formula needs operand", current);
                    }
                    if (next.kind().isBinaryOperator() || next.kind() == TokenKind.RIGHT_BRACKET) {
                        return error(DiagnosticKind.MISSING_NOT_OPERAND, current,
                            "'%s' operator missing valid operand", current);
                    }
                }
                case LEFT_BRACKET -> {
                    if (next != null && next.kind() == TokenKind.RIGHT_BRACKET) {
                        return Optional.of(ParseError.of(DiagnosticKind.EMPTY_GROUP,
                            "Empty parentheses/brackets found - they must contain expressions",
                            current.span().merge(next.span())));
                    }
                }
                default -> {
                    // operands are checked from the token that follows them
                }
            }

            if (current.endsOperand() && next != null && next.startsOperand()) {
                return Optional.of(ParseError.of(DiagnosticKind.ADJACENT_VARIABLES,
                    String.format("Invalid sequence: '%s %s' - missing operator between variables",
                        current.lexeme(), next.lexeme()),
                    next.span()));
            }
        }

        return Optional.empty();
    }

    private static Optional<ParseError> error(DiagnosticKind kind, Token token, String format, Token subject) {
        return Optional.of(ParseError.of(kind,
            String.format(format, subject.kind().name()), token.span()));
    }
}
