package io.github.cyfko.phraseql.core.diagnostic;

/**
 * Every problem the engine can report about a formula.
 * <p>
 * Errors are raised while compiling: the formula is malformed and no search can run. Warnings
 * are raised by semantic validation of a well-formed formula; a <em>blocking</em> warning means
 * the formula can never match and callers must refuse to run a search, an <em>advisory</em>
 * warning is informational only.
 * </p>
 *
 * @since 1.0
 */
public enum DiagnosticKind {

    EMPTY_FORMULA(Severity.ERROR, true),
    FORMULA_TOO_LONG(Severity.ERROR, true),
    INVALID_CHARACTER(Severity.ERROR, true),
    UNMATCHED_OPEN(Severity.ERROR, true),
    UNMATCHED_CLOSE(Severity.ERROR, true),
    MISMATCHED_BRACKET_KIND(Severity.ERROR, true),
    EMPTY_GROUP(Severity.ERROR, true),
    CONSECUTIVE_BINARY_OPERATORS(Severity.ERROR, true),
    ADJACENT_VARIABLES(Severity.ERROR, true),
    DANGLING_OPERATOR(Severity.ERROR, true),
    MISSING_NOT_OPERAND(Severity.ERROR, true),

    /** An AND-chain holds both {@code X} and {@code NOT X}. */
    PARADOX(Severity.WARNING, true),
    /** The whole formula is false under every assignment. */
    UNSATISFIABLE(Severity.WARNING, true),
    /** An OR-chain holds both {@code X} and {@code NOT X}. */
    TAUTOLOGY(Severity.WARNING, false),
    /** The whole formula is true under every assignment. */
    ALWAYS_TRUE(Severity.WARNING, false),
    /** A referenced letter has no phrase text. */
    UNBOUND_VARIABLE(Severity.WARNING, false);

    public enum Severity {
        ERROR,
        WARNING
    }

    private final Severity severity;
    private final boolean blocking;

    DiagnosticKind(Severity severity, boolean blocking) {
        this.severity = severity;
        this.blocking = blocking;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * @return true when a formula carrying this diagnostic must not be used for a search
     */
    public boolean isBlocking() {
        return blocking;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
