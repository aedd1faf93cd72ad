package io.github.cyfko.phraseql.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable abstract syntax tree of a compiled formula.
 * <p>
 * Grouping brackets do not survive parsing: they only shape the tree. Every node records the
 * span of normalized text it was built from so diagnostics can point back into the formula.
 * </p>
 *
 * <pre>
 * (A OR B) AND NOT C
 *
 *          Binary(AND)
 *          /         \
 *    Binary(OR)    Negation
 *     /     \          |
 *   Var(A) Var(B)    Var(C)
 * </pre>
 *
 * <p>Trees hold no back-references and no mutable state, so a single tree can be shared by any
 * number of threads.</p>
 *
 * @since 1.0
 */
public sealed interface FormulaNode {

    /**
     * Span of normalized text covered by this node.
     */
    TextSpan span();

    /**
     * Records every variable referenced below this node, keeping the span of its first occurrence.
     *
     * @param firstOccurrences accumulator, in first-reference order
     */
    void collectReferences(Map<Character, TextSpan> firstOccurrences);

    /**
     * Letters referenced anywhere in this tree mapped to their first occurrence, in reading order.
     */
    default Map<Character, TextSpan> references() {
        Map<Character, TextSpan> references = new LinkedHashMap<>();
        collectReferences(references);
        return references;
    }

    /**
     * A phrase variable such as {@code A}.
     */
    record Variable(char letter, TextSpan span) implements FormulaNode {
        public Variable {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public void collectReferences(Map<Character, TextSpan> firstOccurrences) {
            firstOccurrences.putIfAbsent(letter, span);
        }
    }

    /**
     * Prefix {@code NOT}.
     */
    record Negation(FormulaNode operand, TextSpan span) implements FormulaNode {
        public Negation {
            Objects.requireNonNull(operand, "operand");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public void collectReferences(Map<Character, TextSpan> firstOccurrences) {
            operand.collectReferences(firstOccurrences);
        }
    }

    /**
     * Infix connective applied to two operands.
     */
    record Binary(BinaryOperator operator, FormulaNode left, FormulaNode right, TextSpan span) implements FormulaNode {
        public Binary {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public void collectReferences(Map<Character, TextSpan> firstOccurrences) {
            left.collectReferences(firstOccurrences);
            right.collectReferences(firstOccurrences);
        }
    }
}
