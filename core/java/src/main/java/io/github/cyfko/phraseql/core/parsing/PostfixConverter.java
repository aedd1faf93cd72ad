package io.github.cyfko.phraseql.core.parsing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Shunting-yard conversion of a checked token stream to postfix order.
 * <p>
 * All precedence lives in one table; brackets reset it:
 * </p>
 * <pre>
 * NOT        4  prefix
 * AND        3  left-associative
 * XOR, XNOR  2  left-associative
 * OR, NOR    1  left-associative
 * </pre>
 *
 * <pre>{@code
 * // A OR B AND NOT C  ->  A B C NOT AND OR
 * List<Token> postfix = PostfixConverter.toPostfix(tokens);
 * }</pre>
 *
 * <p>The input must have passed {@link TokenSequenceChecker}; brackets are assumed balanced.</p>
 *
 * @since 1.0
 */
public final class PostfixConverter {

    private static final Map<TokenKind, Integer> PRECEDENCE = Map.of(
        TokenKind.NOT, 4,
        TokenKind.AND, 3,
        TokenKind.XOR, 2,
        TokenKind.XNOR, 2,
        TokenKind.OR, 1,
        TokenKind.NOR, 1
    );

    private PostfixConverter() {}

    public static List<Token> toPostfix(List<Token> tokens) {
        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> operators = new ArrayDeque<>();

        for (Token token : tokens) {
            switch (token.kind()) {
                case VARIABLE -> output.add(token);

                case LEFT_BRACKET -> operators.push(token);

                case RIGHT_BRACKET -> {
                    while (!operators.isEmpty() && operators.peek().kind() != TokenKind.LEFT_BRACKET) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new IllegalStateException("Unbalanced bracket at " + token.span());
                    }
                    operators.pop();
                }

                // prefix: nothing to its left can be popped yet
                case NOT -> operators.push(token);

                case AND, OR, NOR, XOR, XNOR -> {
                    while (!operators.isEmpty() && isHigherOrEqualPrecedence(operators.peek(), token)) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }

                default -> throw new IllegalStateException("Unexpected token " + token);
            }
        }

        while (!operators.isEmpty()) {
            Token op = operators.pop();
            if (op.kind() == TokenKind.LEFT_BRACKET) {
                throw new IllegalStateException("Unbalanced bracket at " + op.span());
            }
            output.add(op);
        }

        return output;
    }

    static int precedence(TokenKind kind) {
        Integer value = PRECEDENCE.get(kind);
        if (value == null) {
            throw new IllegalArgumentException(kind + " has no precedence");
        }
        return value;
    }

    private static boolean isHigherOrEqualPrecedence(Token top, Token current) {
        return top.kind() != TokenKind.LEFT_BRACKET
            && precedence(top.kind()) >= precedence(current.kind());
    }
}
