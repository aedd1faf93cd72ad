package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import io.github.cyfko.phraseql.core.diagnostic.ParseError;
import io.github.cyfko.phraseql.core.model.FormulaNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds a {@link FormulaNode} tree from postfix tokens with a single operand stack.
 * <p>
 * Stack underflow or leftover operands are returned as a {@link ParseError} rather than thrown;
 * with a stream accepted by {@link TokenSequenceChecker} neither can happen.
 * </p>
 *
 * @since 1.0
 */
public final class PostfixTreeBuilder {

    private PostfixTreeBuilder() {}

    public static ParseOutcome build(List<Token> postfix) {
        if (postfix.isEmpty()) {
            return ParseOutcome.failure(ParseError.of(DiagnosticKind.EMPTY_FORMULA,
                "Cannot build a formula from an empty expression"));
        }

        Deque<FormulaNode> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            switch (token.kind()) {
                case VARIABLE -> stack.push(new FormulaNode.Variable(token.letter(), token.span()));

                case NOT -> {
                    if (stack.isEmpty()) {
                        return ParseOutcome.failure(ParseError.of(DiagnosticKind.MISSING_NOT_OPERAND,
                            "'NOT' operator missing valid operand", token.span()));
                    }
                    FormulaNode operand = stack.pop();
                    stack.push(new FormulaNode.Negation(operand, token.span().merge(operand.span())));
                }

                case AND, OR, NOR, XOR, XNOR -> {
                    if (stack.size() < 2) {
                        return ParseOutcome.failure(ParseError.of(DiagnosticKind.DANGLING_OPERATOR,
                            String.format("'%s' operator requires two operands", token.kind()), token.span()));
                    }
                    FormulaNode right = stack.pop();
                    FormulaNode left = stack.pop();
                    stack.push(new FormulaNode.Binary(token.kind().toBinaryOperator(), left, right,
                        left.span().merge(right.span())));
                }

                default -> throw new IllegalStateException("Unexpected token in postfix stream: " + token);
            }
        }

        if (stack.size() > 1) {
            stack.pop();
            FormulaNode stray = stack.pop();
            return ParseOutcome.failure(ParseError.of(DiagnosticKind.ADJACENT_VARIABLES,
                "Missing operator between operands", stray.span()));
        }

        return ParseOutcome.success(stack.pop());
    }
}
