package io.github.cyfko.phraseql.core.api;

import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.model.PhraseBindingSet;
import io.github.cyfko.phraseql.core.validation.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles, validates and evaluates boolean search formulas over phrase variables.
 * <p>
 * Each variable letter stands for "this phrase occurs in the content". Letters are combined
 * with the following operators, loosest first:
 * </p>
 * <table border="1">
 * <caption>Operators</caption>
 * <thead><tr><th>Level</th><th>Operators</th><th>Symbols</th><th>Associativity</th></tr></thead>
 * <tbody>
 * <tr><td>1</td><td>OR, NOR</td><td>{@code |}, {@code ||}</td><td>left</td></tr>
 * <tr><td>2</td><td>XOR, XNOR</td><td>{@code ^}</td><td>left</td></tr>
 * <tr><td>3</td><td>AND</td><td>{@code &}, {@code &&}</td><td>left</td></tr>
 * <tr><td>4</td><td>NOT</td><td>{@code !}, {@code ~}</td><td>prefix</td></tr>
 * </tbody>
 * </table>
 * <p>
 * {@code ()}, {@code []} and {@code {}} group interchangeably, but each close must match the
 * kind of its open. Keywords and letters are case-insensitive.
 * </p>
 *
 * <h2>Typical use</h2>
 * <pre>{@code
 * FormulaEngine engine = new BasicFormulaEngine();
 * PhraseBindingSet bindings = PhraseBindingSet.builder()
 *     .phrase('A', "def")
 *     .phrase('B', "class")
 *     .phrase('C', "test")
 *     .build();
 *
 * ValidationResult check = engine.validate("(A OR B) AND NOT C", bindings.texts());
 * if (check.canExecute()) {
 *     CompiledFormula formula = engine.compile("(A OR B) AND NOT C").orElseThrow();
 *     for (String line : lines) {
 *         if (engine.evaluate(formula, bindings, line)) {
 *             matches.add(line);
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p>Implementations must be thread-safe.</p>
 *
 * @since 1.0
 */
public interface FormulaEngine {

    /**
     * Compiles a formula over the engine's configured alphabet.
     */
    CompileResult compile(String text);

    /**
     * Compiles a formula over an explicit alphabet.
     *
     * @param alphabet letters accepted as variables; case is ignored
     */
    CompileResult compile(String text, Set<Character> alphabet);

    /**
     * Compiles then runs the semantic checks.
     * <p>
     * A formula that fails to compile yields exactly its parse error and no warning. Missing or
     * blank entries in {@code phraseTexts} are reported as unbound variables.
     * </p>
     */
    ValidationResult validate(String text, Map<Character, String> phraseTexts);

    boolean evaluate(CompiledFormula formula, PhraseBindingSet bindings, String content);

    /**
     * One remediation hint per distinct problem, deduplicated, in diagnostic order.
     */
    List<String> suggest(List<Diagnostic> diagnostics);

    /**
     * Formula used when the user leaves the formula empty: every non-empty letter joined with
     * {@code AND}, or the empty string when there is none.
     */
    String autoConstruct(List<Character> nonEmptyLetters);

    /**
     * {@link #autoConstruct(List)} over the non-blank phrases of a binding set, in alphabet order.
     */
    default String autoConstruct(PhraseBindingSet bindings) {
        return autoConstruct(bindings.nonEmptyLetters());
    }
}
