package io.github.cyfko.phraseql.core.validation;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import io.github.cyfko.phraseql.core.model.BinaryOperator;
import io.github.cyfko.phraseql.core.model.FormulaNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds chains of one connective holding both a letter and its negation.
 * <p>
 * Nested uses of the same connective are flattened first, so {@code (A AND B) AND NOT A} is a
 * single chain {@code A, B, NOT A}. Double negations cancel before literals are compared. Each
 * letter is reported at most once per formula, located at the first chain where it clashes.
 * </p>
 * <ul>
 *   <li>{@link #paradoxes()}: AND-chains, reported as {@link DiagnosticKind#PARADOX};</li>
 *   <li>{@link #tautologies()}: OR-chains, reported as {@link DiagnosticKind#TAUTOLOGY}.</li>
 * </ul>
 *
 * @since 1.0
 */
public final class ComplementaryLiteralCheck implements SemanticCheck {

    private final BinaryOperator connective;
    private final DiagnosticKind kind;
    private final String messageFormat;

    private ComplementaryLiteralCheck(BinaryOperator connective, DiagnosticKind kind, String messageFormat) {
        this.connective = connective;
        this.kind = kind;
        this.messageFormat = messageFormat;
    }

    public static ComplementaryLiteralCheck paradoxes() {
        return new ComplementaryLiteralCheck(BinaryOperator.AND, DiagnosticKind.PARADOX,
            "Logical paradox detected: '%1$s AND NOT %1$s' - this will always be false");
    }

    public static ComplementaryLiteralCheck tautologies() {
        return new ComplementaryLiteralCheck(BinaryOperator.OR, DiagnosticKind.TAUTOLOGY,
            "Tautology detected: '%1$s OR NOT %1$s' - this will always be true");
    }

    @Override
    public void inspect(FormulaNode root, Map<Character, String> phraseTexts, List<Diagnostic> warnings) {
        Set<Character> reported = new LinkedHashSet<>();
        visit(root, false, reported, warnings);
    }

    /**
     * @param insideChain true when the parent already belongs to a chain of this connective
     */
    private void visit(FormulaNode node, boolean insideChain, Set<Character> reported, List<Diagnostic> warnings) {
        FormulaNode current = stripDoubleNegation(node);

        if (current instanceof FormulaNode.Negation negation) {
            visit(negation.operand(), false, reported, warnings);
            return;
        }
        if (!(current instanceof FormulaNode.Binary binary)) {
            return;
        }

        boolean chain = binary.operator() == connective;
        if (chain && !insideChain) {
            inspectChain(binary, reported, warnings);
        }
        visit(binary.left(), chain, reported, warnings);
        visit(binary.right(), chain, reported, warnings);
    }

    private void inspectChain(FormulaNode.Binary chain, Set<Character> reported, List<Diagnostic> warnings) {
        List<FormulaNode> operands = new ArrayList<>();
        flatten(chain, operands);

        // letter -> polarities seen, bit 1 positive, bit 2 negative
        Map<Character, Integer> polarities = new HashMap<>();
        List<Character> order = new ArrayList<>();
        for (FormulaNode operand : operands) {
            FormulaNode literal = stripDoubleNegation(operand);
            boolean negative = false;
            if (literal instanceof FormulaNode.Negation negation) {
                literal = stripDoubleNegation(negation.operand());
                negative = true;
            }
            if (literal instanceof FormulaNode.Variable variable) {
                char letter = variable.letter();
                if (!polarities.containsKey(letter)) {
                    order.add(letter);
                }
                polarities.merge(letter, negative ? 2 : 1, (a, b) -> a | b);
            }
        }

        for (Character letter : order) {
            if (polarities.get(letter) == 3 && reported.add(letter)) {
                warnings.add(Diagnostic.forLetter(kind, letter, String.format(messageFormat, letter), chain.span()));
            }
        }
    }

    private void flatten(FormulaNode node, List<FormulaNode> operands) {
        FormulaNode current = stripDoubleNegation(node);
        if (current instanceof FormulaNode.Binary binary && binary.operator() == connective) {
            flatten(binary.left(), operands);
            flatten(binary.right(), operands);
        } else {
            operands.add(current);
        }
    }

    static FormulaNode stripDoubleNegation(FormulaNode node) {
        FormulaNode current = node;
        while (current instanceof FormulaNode.Negation outer
            && outer.operand() instanceof FormulaNode.Negation inner) {
            current = inner.operand();
        }
        return current;
    }
}
