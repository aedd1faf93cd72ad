package io.github.cyfko.phraseql.core.api;

import io.github.cyfko.phraseql.core.diagnostic.ParseError;
import io.github.cyfko.phraseql.core.exception.FormulaSyntaxException;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a {@link CompiledFormula} or the {@link ParseError} that prevented compilation.
 * <p>
 * A failed compilation is a value, never an exception and never a formula that evaluates to
 * {@code false}.
 * </p>
 *
 * <pre>{@code
 * CompileResult result = engine.compile("(A OR B) AND NOT C");
 * if (result.isSuccess()) {
 *     CompiledFormula formula = result.formula().orElseThrow();
 * } else {
 *     ParseError error = result.error().orElseThrow();
 * }
 * }</pre>
 *
 * @since 1.0
 */
public final class CompileResult {

    private final CompiledFormula formula;
    private final ParseError error;

    private CompileResult(CompiledFormula formula, ParseError error) {
        this.formula = formula;
        this.error = error;
    }

    public static CompileResult success(CompiledFormula formula) {
        return new CompileResult(Objects.requireNonNull(formula, "formula"), null);
    }

    public static CompileResult failure(ParseError error) {
        return new CompileResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return formula != null;
    }

    public Optional<CompiledFormula> formula() {
        return Optional.ofNullable(formula);
    }

    public Optional<ParseError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the compiled formula
     * @throws FormulaSyntaxException carrying the parse error if compilation failed
     */
    public CompiledFormula orElseThrow() {
        if (formula == null) {
            throw new FormulaSyntaxException(error);
        }
        return formula;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "CompileResult[success=" + formula + "]"
            : "CompileResult[failure=" + error + "]";
    }
}
