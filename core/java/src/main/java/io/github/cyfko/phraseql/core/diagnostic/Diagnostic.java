package io.github.cyfko.phraseql.core.diagnostic;

import io.github.cyfko.phraseql.core.model.TextSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * A single error or warning about a formula.
 * <p>
 * The optional position lets a formula editor highlight the offending range without the engine
 * knowing anything about rendering; the optional letter names the variable a semantic warning is
 * about.
 * </p>
 *
 * <p>Instances are immutable and created via the static factory methods.</p>
 *
 * @since 1.0
 */
public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String message;
    private final TextSpan span;
    private final Character letter;

    private Diagnostic(DiagnosticKind kind, String message, TextSpan span, Character letter) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.span = span;
        this.letter = letter;
    }

    public static Diagnostic of(DiagnosticKind kind, String message, TextSpan span) {
        return new Diagnostic(kind, message, span, null);
    }

    public static Diagnostic of(DiagnosticKind kind, String message) {
        return new Diagnostic(kind, message, null, null);
    }

    /**
     * Diagnostic about one variable, e.g. a paradox on {@code A}.
     */
    public static Diagnostic forLetter(DiagnosticKind kind, char letter, String message, TextSpan span) {
        return new Diagnostic(kind, message, span, letter);
    }

    public DiagnosticKind kind() {
        return kind;
    }

    public String message() {
        return message;
    }

    public Optional<TextSpan> position() {
        return Optional.ofNullable(span);
    }

    public Optional<Character> letter() {
        return Optional.ofNullable(letter);
    }

    public boolean isBlocking() {
        return kind.isBlocking();
    }

    public boolean isError() {
        return kind.isError();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind
            && message.equals(that.message)
            && Objects.equals(span, that.span)
            && Objects.equals(letter, that.letter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, span, letter);
    }

    @Override
    public String toString() {
        return kind + (span != null ? span.toString() : "") + ": " + message;
    }
}
