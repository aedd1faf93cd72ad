package io.github.cyfko.phraseql.core.evaluation;

import io.github.cyfko.phraseql.core.model.BinaryOperator;
import io.github.cyfko.phraseql.core.model.FormulaNode;
import io.github.cyfko.phraseql.core.model.PhraseBinding;
import io.github.cyfko.phraseql.core.model.PhraseBindingSet;

import java.util.Locale;
import java.util.Objects;

/**
 * Pure interpreter of {@link FormulaNode} trees.
 * <p>
 * Evaluation is total: it never throws for a tree produced by the parser, performs no I/O and
 * keeps no state between calls, so it may run concurrently on any number of threads.
 * </p>
 *
 * <pre>{@code
 * boolean hit = FormulaEvaluator.evaluate(formula.root(), bindings, line);
 * }</pre>
 *
 * @since 1.0
 */
public final class FormulaEvaluator {

    /**
     * Truth value of each letter, for evaluation independent of any content.
     */
    @FunctionalInterface
    public interface Assignment {
        boolean valueOf(char letter);
    }

    private FormulaEvaluator() {}

    /**
     * Evaluates a formula against one piece of content.
     * <p>
     * A variable is true when its phrase occurs in {@code content}, honouring the binding's
     * case-sensitivity; blank phrases are always false.
     * </p>
     */
    public static boolean evaluate(FormulaNode root, PhraseBindingSet bindings, String content) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(bindings, "bindings");
        Objects.requireNonNull(content, "content");
        return evaluate(root, new ContentProbe(bindings, content));
    }

    /**
     * Evaluates a formula under an explicit truth assignment.
     */
    public static boolean evaluate(FormulaNode node, Assignment assignment) {
        if (node instanceof FormulaNode.Variable variable) {
            return assignment.valueOf(variable.letter());
        }
        if (node instanceof FormulaNode.Negation negation) {
            return !evaluate(negation.operand(), assignment);
        }
        FormulaNode.Binary binary = (FormulaNode.Binary) node;
        boolean left = evaluate(binary.left(), assignment);
        if (binary.operator() == BinaryOperator.AND && !left) {
            return false;
        }
        if (binary.operator() == BinaryOperator.OR && left) {
            return true;
        }
        return binary.operator().apply(left, evaluate(binary.right(), assignment));
    }

    /**
     * Resolves letters against content, lower-casing it at most once and only if a
     * case-insensitive phrase is actually consulted.
     */
    private static final class ContentProbe implements Assignment {
        private final PhraseBindingSet bindings;
        private final String content;
        private String foldedContent;

        ContentProbe(PhraseBindingSet bindings, String content) {
            this.bindings = bindings;
            this.content = content;
        }

        @Override
        public boolean valueOf(char letter) {
            PhraseBinding binding = bindings.binding(letter);
            if (binding.isEmpty()) {
                return false;
            }
            if (binding.caseSensitive()) {
                return content.contains(binding.text());
            }
            if (foldedContent == null) {
                foldedContent = content.toLowerCase(Locale.ROOT);
            }
            return foldedContent.contains(binding.foldedText());
        }
    }
}
