package io.github.cyfko.phraseql.core.exception;

import io.github.cyfko.phraseql.core.api.CompileResult;
import io.github.cyfko.phraseql.core.diagnostic.ParseError;

import java.util.Objects;

/**
 * Thrown by {@link CompileResult#orElseThrow()} when a formula failed to compile.
 * <p>
 * The engine itself reports parse errors as values; this exception only exists for callers
 * that prefer exceptions, and always carries the underlying {@link ParseError}.
 * </p>
 *
 * <pre>{@code
 * try {
 *     CompiledFormula formula = engine.compile(userFormula).orElseThrow();
 * } catch (FormulaSyntaxException e) {
 *     highlight(e.getError().position());
 * }
 * }</pre>
 *
 * @since 1.0
 */
public class FormulaSyntaxException extends RuntimeException {

    private final ParseError error;

    public FormulaSyntaxException(ParseError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ParseError getError() {
        return error;
    }
}
