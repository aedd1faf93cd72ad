package io.github.cyfko.phraseql.core.config;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configuration of the formula language and its complexity limits.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: Maximum character length of a formula (default: 5000)</li>
 *   <li><strong>alphabet</strong>: Letters usable as phrase variables (default: A, B, C, D)</li>
 *   <li><strong>maxExhaustiveVariables</strong>: Largest number of distinct variables for which the
 *       validator enumerates the full truth table to detect constant formulas (default: 10, 0 disables)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * FormulaPolicy policy = FormulaPolicy.defaults();
 *
 * // Strict (formulas coming from untrusted input)
 * FormulaPolicy policy = FormulaPolicy.strict();
 *
 * // Relaxed (internal tooling)
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * // Custom alphabet A-F
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .alphabet(FormulaPolicy.alphabetOf("ABCDEF"))
 *     .build();
 * }</pre>
 *
 * @param policyName             descriptive name, reported in limit violations
 * @param maxFormulaLength       maximum character length of a formula
 * @param alphabet               upper-case letters accepted as variables, iterated in alphabetical order
 * @param maxExhaustiveVariables truth-table enumeration cap for constant-formula detection
 * @since 1.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    Set<Character> alphabet,
    int maxExhaustiveVariables
) {

    /**
     * Letters A to D, the four phrase slots of the search form.
     */
    public static final Set<Character> DEFAULT_ALPHABET = alphabetOf("ABCD");

    static final int EXHAUSTIVE_VARIABLES_CEILING = 20;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (alphabet == null) {
            throw new IllegalArgumentException("alphabet is required");
        }
        if (maxExhaustiveVariables < 0 || maxExhaustiveVariables > EXHAUSTIVE_VARIABLES_CEILING) {
            throw new IllegalArgumentException(String.format(
                "maxExhaustiveVariables must be between 0 and %d, got: %d",
                EXHAUSTIVE_VARIABLES_CEILING, maxExhaustiveVariables));
        }
        alphabet = alphabetOf(alphabet);
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Formula Length: 5000 characters</li>
     *   <li>Alphabet: A-D</li>
     *   <li>Exhaustive Variables: 10</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, DEFAULT_ALPHABET, 10);
    }

    /**
     * Strict configuration for formulas typed by untrusted users.
     * <ul>
     *   <li>Max Formula Length: 1000 characters</li>
     *   <li>Alphabet: A-D</li>
     *   <li>Exhaustive Variables: 8</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, DEFAULT_ALPHABET, 8);
    }

    /**
     * Relaxed configuration for internal tooling.
     * <ul>
     *   <li>Max Formula Length: 10000 characters</li>
     *   <li>Alphabet: A-D</li>
     *   <li>Exhaustive Variables: 16</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 10000, DEFAULT_ALPHABET, 16);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of this policy using another alphabet.
     */
    public FormulaPolicy withAlphabet(Collection<Character> letters) {
        return new FormulaPolicy(policyName, maxFormulaLength, alphabetOf(letters), maxExhaustiveVariables);
    }

    /**
     * Builds an alphabet from a string of letters, e.g. {@code "ABCD"}.
     *
     * @throws IllegalArgumentException if the string is empty or contains a non-letter
     */
    public static Set<Character> alphabetOf(String letters) {
        if (letters == null) {
            throw new IllegalArgumentException("letters are required");
        }
        Set<Character> set = new TreeSet<>();
        for (int i = 0; i < letters.length(); i++) {
            set.add(letters.charAt(i));
        }
        return alphabetOf(set);
    }

    /**
     * Validates and canonicalizes an alphabet: upper-cased, sorted, unmodifiable.
     *
     * @throws IllegalArgumentException if the collection is empty or contains a non-letter
     */
    public static Set<Character> alphabetOf(Collection<Character> letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("Alphabet must contain at least one letter");
        }
        Set<Character> canonical = new TreeSet<>();
        for (Character letter : letters) {
            if (letter == null || !Character.isLetter(letter)) {
                throw new IllegalArgumentException("Alphabet may only contain letters, got: " + letter);
            }
            canonical.add(Character.toUpperCase(letter));
        }
        return Collections.unmodifiableSet(canonical);
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 5000;
        private Set<Character> _alphabet = DEFAULT_ALPHABET;
        private int _maxExhaustiveVariables = 10;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxFormulaLength, _alphabet, _maxExhaustiveVariables);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder alphabet(Set<Character> alphabet) { this._alphabet = alphabet; return this; }
        public Builder maxExhaustiveVariables(int max) { this._maxExhaustiveVariables = max; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
