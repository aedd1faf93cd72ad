package io.github.cyfko.phraseql.core.diagnostic;

import io.github.cyfko.phraseql.core.model.TextSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * Reason a formula failed to compile, with the position of the offending token.
 * <p>
 * Parse errors are always returned as values; a failed compilation is never confused with a
 * formula that legitimately evaluates to {@code false}.
 * </p>
 *
 * @param kind    one of the error kinds of {@link DiagnosticKind}
 * @param message human-readable explanation
 * @param span    offending range in the normalized formula, or null when the error has no position
 * @since 1.0
 */
public record ParseError(DiagnosticKind kind, String message, TextSpan span) {

    public ParseError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        if (!kind.isError()) {
            throw new IllegalArgumentException("Parse errors must use an error kind, got: " + kind);
        }
    }

    public static ParseError of(DiagnosticKind kind, String message, TextSpan span) {
        return new ParseError(kind, message, span);
    }

    public static ParseError of(DiagnosticKind kind, String message) {
        return new ParseError(kind, message, null);
    }

    public Optional<TextSpan> position() {
        return Optional.ofNullable(span);
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.of(kind, message, span);
    }
}
