package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.model.FormulaNode;

/**
 * Renders a tree back to text, bracketing every nested binary node so the grouping actually
 * applied by the parser is visible.
 *
 * <pre>{@code
 * // "A OR B AND NOT C"
 * FormulaRenderer.render(root); // "A OR (B AND NOT C)"
 * }</pre>
 *
 * Rendering the output again yields the same tree.
 *
 * @since 1.0
 */
public final class FormulaRenderer {

    private FormulaRenderer() {}

    public static String render(FormulaNode root) {
        StringBuilder sb = new StringBuilder();
        if (root instanceof FormulaNode.Binary binary) {
            appendBinary(binary, sb);
        } else {
            append(root, sb);
        }
        return sb.toString();
    }

    private static void append(FormulaNode node, StringBuilder sb) {
        if (node instanceof FormulaNode.Variable variable) {
            sb.append(variable.letter());
        } else if (node instanceof FormulaNode.Negation negation) {
            sb.append("NOT ");
            append(negation.operand(), sb);
        } else if (node instanceof FormulaNode.Binary binary) {
            sb.append('(');
            appendBinary(binary, sb);
            sb.append(')');
        }
    }

    private static void appendBinary(FormulaNode.Binary binary, StringBuilder sb) {
        append(binary.left(), sb);
        sb.append(' ').append(binary.operator().keyword()).append(' ');
        append(binary.right(), sb);
    }
}
