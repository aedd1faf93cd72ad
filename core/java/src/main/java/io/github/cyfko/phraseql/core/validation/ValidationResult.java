package io.github.cyfko.phraseql.core.validation;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.ParseError;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a formula.
 * <p>
 * {@code isValid()} only reflects parse errors. Warnings never make a formula invalid, but a
 * blocking warning means the formula can never match and {@link #canExecute()} is false.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = engine.validate("A AND NOT A", texts);
 * result.isValid();             // true
 * result.hasBlockingWarnings(); // true
 * result.canExecute();          // false
 * }</pre>
 *
 * @since 1.0
 */
public final class ValidationResult {

    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;

    private ValidationResult(List<Diagnostic> errors, List<Diagnostic> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Result of a well-formed formula.
     *
     * @param warnings semantic warnings, possibly empty
     */
    public static ValidationResult success(List<Diagnostic> warnings) {
        Objects.requireNonNull(warnings, "warnings");
        for (Diagnostic warning : warnings) {
            if (warning.isError()) {
                throw new IllegalArgumentException("Not a warning: " + warning);
            }
        }
        return new ValidationResult(List.of(), warnings);
    }

    /**
     * Result of a malformed formula, holding exactly its parse error.
     */
    public static ValidationResult failure(ParseError error) {
        Objects.requireNonNull(error, "error");
        return new ValidationResult(List.of(error.toDiagnostic()), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<Diagnostic> errors() {
        return errors;
    }

    public List<Diagnostic> warnings() {
        return warnings;
    }

    public boolean hasBlockingWarnings() {
        return warnings.stream().anyMatch(Diagnostic::isBlocking);
    }

    /**
     * @return true when a search may run with this formula
     */
    public boolean canExecute() {
        return isValid() && !hasBlockingWarnings();
    }

    public ValidationState state() {
        if (!canExecute()) {
            return ValidationState.ERROR;
        }
        return warnings.isEmpty() ? ValidationState.VALID : ValidationState.WARNING;
    }

    /**
     * Errors followed by warnings, the order in which they are reported to users.
     */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(errors.size() + warnings.size());
        all.addAll(errors);
        all.addAll(warnings);
        return all;
    }

    @Override
    public String toString() {
        return "ValidationResult[state=" + state() + ", errors=" + errors + ", warnings=" + warnings + "]";
    }
}
