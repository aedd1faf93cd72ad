package io.github.cyfko.phraseql.core.impl;

import io.github.cyfko.phraseql.core.api.CompileResult;
import io.github.cyfko.phraseql.core.api.CompiledFormula;
import io.github.cyfko.phraseql.core.api.FormulaEngine;
import io.github.cyfko.phraseql.core.cache.BoundedLRUCache;
import io.github.cyfko.phraseql.core.config.CachePolicy;
import io.github.cyfko.phraseql.core.config.FormulaPolicy;
import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import io.github.cyfko.phraseql.core.diagnostic.ParseError;
import io.github.cyfko.phraseql.core.evaluation.FormulaEvaluator;
import io.github.cyfko.phraseql.core.model.FormulaNode;
import io.github.cyfko.phraseql.core.model.PhraseBindingSet;
import io.github.cyfko.phraseql.core.model.TextSpan;
import io.github.cyfko.phraseql.core.parsing.FormulaNormalizer;
import io.github.cyfko.phraseql.core.parsing.FormulaParser;
import io.github.cyfko.phraseql.core.parsing.FormulaRenderer;
import io.github.cyfko.phraseql.core.parsing.FormulaTokenizer;
import io.github.cyfko.phraseql.core.parsing.ParseOutcome;
import io.github.cyfko.phraseql.core.utils.SuggestionUtils;
import io.github.cyfko.phraseql.core.validation.FormulaValidator;
import io.github.cyfko.phraseql.core.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * Default {@link FormulaEngine}.
 * <p>
 * Compilation runs normalize, tokenize and parse; its result, success or failure, is cached
 * per alphabet and source text according to the {@link CachePolicy}. Formulas whose normalized
 * text exceeds {@link FormulaPolicy#maxFormulaLength()} are rejected before tokenizing.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // Default policies
 * FormulaEngine engine = new BasicFormulaEngine();
 *
 * // Alphabet A-F, no cache
 * FormulaEngine engine = new BasicFormulaEngine(
 *     FormulaPolicy.builder().alphabet(FormulaPolicy.alphabetOf("ABCDEF")).build(),
 *     CachePolicy.none());
 * }</pre>
 *
 * @since 1.0
 */
public class BasicFormulaEngine implements FormulaEngine {

    private static final Logger log = Logger.getLogger(BasicFormulaEngine.class.getName());

    private final FormulaPolicy formulaPolicy;
    private final CachePolicy cachePolicy;
    private final FormulaValidator validator;
    protected final BoundedLRUCache<String, CompileResult> cache;

    public BasicFormulaEngine() {
        this(FormulaPolicy.defaults(), CachePolicy.defaults());
    }

    public BasicFormulaEngine(FormulaPolicy formulaPolicy) {
        this(formulaPolicy, CachePolicy.defaults());
    }

    /**
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicFormulaEngine(FormulaPolicy formulaPolicy, CachePolicy cachePolicy) {
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.formulaPolicy = formulaPolicy;
        this.cachePolicy = cachePolicy;
        this.validator = new FormulaValidator(formulaPolicy);
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize(),
            "hits", cache.getHits(),
            "misses", cache.getMisses()
        );
    }

    @Override
    public CompileResult compile(String text) {
        return compile(text, formulaPolicy.alphabet());
    }

    @Override
    public CompileResult compile(String text, Set<Character> alphabet) {
        Objects.requireNonNull(text, "text");
        Set<Character> letters = FormulaPolicy.alphabetOf(Objects.requireNonNull(alphabet, "alphabet"));

        if (cache == null) {
            return compileUncached(text, letters);
        }

        String cacheKey = cacheKey(text, letters);
        return cache.computeIfAbsent(cacheKey, key -> {
            log.fine(() -> String.format("Formula cache miss for '%s'", text));
            return compileUncached(text, letters);
        });
    }

    @Override
    public ValidationResult validate(String text, Map<Character, String> phraseTexts) {
        Objects.requireNonNull(phraseTexts, "phraseTexts");

        CompileResult compiled = compile(text);
        ParseOutcome outcome = compiled.formula()
            .map(formula -> ParseOutcome.success(formula.root()))
            .orElseGet(() -> ParseOutcome.failure(compiled.error().orElseThrow()));

        return validator.validate(outcome, phraseTexts);
    }

    @Override
    public boolean evaluate(CompiledFormula formula, PhraseBindingSet bindings, String content) {
        Objects.requireNonNull(formula, "formula");
        return formula.evaluate(bindings, content);
    }

    @Override
    public List<String> suggest(List<Diagnostic> diagnostics) {
        return SuggestionUtils.suggest(diagnostics);
    }

    @Override
    public String autoConstruct(List<Character> nonEmptyLetters) {
        Objects.requireNonNull(nonEmptyLetters, "nonEmptyLetters");

        StringJoiner joiner = new StringJoiner(" AND ");
        for (Character letter : nonEmptyLetters) {
            joiner.add(String.valueOf(Character.toUpperCase(letter)));
        }
        return joiner.toString();
    }

    private CompileResult compileUncached(String text, Set<Character> alphabet) {
        String normalized = FormulaNormalizer.normalize(text);

        if (normalized.length() > formulaPolicy.maxFormulaLength()) {
            ParseError tooLong = ParseError.of(DiagnosticKind.FORMULA_TOO_LONG,
                String.format("Formula too long (%d characters, max: %d). Policy applied: %s",
                    normalized.length(), formulaPolicy.maxFormulaLength(), formulaPolicy.policyName()),
                TextSpan.of(formulaPolicy.maxFormulaLength(), normalized.length()));
            log.fine(() -> "Rejected formula: " + tooLong.message());
            return CompileResult.failure(tooLong);
        }

        ParseOutcome outcome = FormulaParser.parse(FormulaTokenizer.tokenize(normalized, alphabet));
        if (!outcome.isSuccess()) {
            ParseError error = outcome.error().orElseThrow();
            log.fine(() -> String.format("Formula '%s' failed to compile: %s", text, error.message()));
            return CompileResult.failure(error);
        }

        return CompileResult.success(new TreeFormula(text, normalized, outcome.root().orElseThrow(), alphabet));
    }

    private static String cacheKey(String text, Set<Character> alphabet) {
        StringBuilder sb = new StringBuilder(alphabet.size() + 1 + text.length());
        for (Character letter : alphabet) {
            sb.append(letter);
        }
        return sb.append('|').append(text).toString();
    }

    /**
     * Immutable compiled formula backed by its tree.
     */
    private static final class TreeFormula implements CompiledFormula {
        private final String sourceText;
        private final String normalizedText;
        private final FormulaNode root;
        private final Set<Character> alphabet;
        private final List<Character> referencedLetters;
        private final String canonicalText;

        TreeFormula(String sourceText, String normalizedText, FormulaNode root, Set<Character> alphabet) {
            this.sourceText = sourceText;
            this.normalizedText = normalizedText;
            this.root = root;
            this.alphabet = alphabet;
            this.referencedLetters = List.copyOf(new ArrayList<>(root.references().keySet()));
            this.canonicalText = FormulaRenderer.render(root);
        }

        @Override
        public String sourceText() {
            return sourceText;
        }

        @Override
        public String normalizedText() {
            return normalizedText;
        }

        @Override
        public FormulaNode root() {
            return root;
        }

        @Override
        public Set<Character> alphabet() {
            return alphabet;
        }

        @Override
        public List<Character> referencedLetters() {
            return referencedLetters;
        }

        @Override
        public boolean evaluate(PhraseBindingSet bindings, String content) {
            return FormulaEvaluator.evaluate(root, bindings, content);
        }

        @Override
        public String canonicalText() {
            return canonicalText;
        }

        @Override
        public String toString() {
            return "CompiledFormula[" + canonicalText + "]";
        }
    }
}
