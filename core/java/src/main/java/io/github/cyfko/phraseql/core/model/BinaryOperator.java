package io.github.cyfko.phraseql.core.model;

/**
 * Binary connectives of the formula language.
 * <p>
 * {@link #NOR} and {@link #XNOR} are kept as first-class operators rather than being
 * desugared into a negated {@link #OR} / {@link #XOR}; the evaluator gives them the
 * same meaning either way.
 * </p>
 *
 * @since 1.0
 */
public enum BinaryOperator {
    AND,
    OR,
    NOR,
    XOR,
    XNOR;

    /**
     * Keyword used when rendering this operator back to text.
     */
    public String keyword() {
        return name();
    }

    /**
     * Applies the operator to two already-evaluated operands.
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case NOR -> !(left || right);
            case XOR -> left != right;
            case XNOR -> left == right;
        };
    }
}
