package io.github.cyfko.phraseql.core.model;

import io.github.cyfko.phraseql.core.config.FormulaPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the phrases bound to each letter of an alphabet.
 * <p>
 * A set is rebuilt whenever the user edits a phrase or a case-sensitivity flag. A scan already in
 * progress keeps evaluating against the snapshot it started with; nothing in the engine mutates a
 * binding set.
 * </p>
 *
 * <pre>{@code
 * PhraseBindingSet bindings = PhraseBindingSet.builder()
 *     .phrase('A', "def")
 *     .phrase('B', "Class", true)
 *     .build();
 *
 * bindings.binding('C').isEmpty(); // true: unbound letters resolve to an empty phrase
 * }</pre>
 *
 * @since 1.0
 */
public final class PhraseBindingSet {

    private final Set<Character> alphabet;
    private final Map<Character, PhraseBinding> bindings;

    private PhraseBindingSet(Set<Character> alphabet, Map<Character, PhraseBinding> bindings) {
        this.alphabet = alphabet;
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    /**
     * Builder over the default alphabet A-D.
     */
    public static Builder builder() {
        return new Builder(FormulaPolicy.DEFAULT_ALPHABET);
    }

    public static Builder builder(Set<Character> alphabet) {
        return new Builder(FormulaPolicy.alphabetOf(alphabet));
    }

    /**
     * Case-insensitive bindings over the default alphabet.
     *
     * @param phraseTexts letter to phrase text; null texts are treated as empty
     */
    public static PhraseBindingSet of(Map<Character, String> phraseTexts) {
        Objects.requireNonNull(phraseTexts, "phraseTexts");
        Builder builder = builder();
        phraseTexts.forEach((letter, text) -> builder.phrase(letter, text == null ? "" : text));
        return builder.build();
    }

    /**
     * Binding set in which every letter of the default alphabet is empty.
     */
    public static PhraseBindingSet empty() {
        return builder().build();
    }

    public Set<Character> alphabet() {
        return alphabet;
    }

    /**
     * Returns the binding of a letter. Letters without a phrase, including letters outside the
     * alphabet, resolve to an empty binding and therefore never match.
     */
    public PhraseBinding binding(char letter) {
        char key = Character.toUpperCase(letter);
        PhraseBinding binding = bindings.get(key);
        return binding != null ? binding : PhraseBinding.empty(key);
    }

    /**
     * Phrase text per letter, in alphabet order, as consumed by the validator.
     */
    public Map<Character, String> texts() {
        Map<Character, String> texts = new LinkedHashMap<>();
        for (Character letter : alphabet) {
            texts.put(letter, binding(letter).text());
        }
        return texts;
    }

    /**
     * Letters whose phrase is not blank, in alphabet order.
     */
    public List<Character> nonEmptyLetters() {
        List<Character> letters = new ArrayList<>();
        for (Character letter : alphabet) {
            if (!binding(letter).isEmpty()) {
                letters.add(letter);
            }
        }
        return letters;
    }

    /**
     * Multi-line description of the bound variables, suitable for a formula editor tooltip.
     * <pre>
     * Formula Variables:
     * A: 'def' (Any Case)
     * B: 'Class' (Match Case)
     * </pre>
     */
    public String summary() {
        StringBuilder sb = new StringBuilder("Formula Variables:");
        List<Character> letters = nonEmptyLetters();
        if (letters.isEmpty()) {
            sb.append("\n(No variables defined)");
        }
        for (Character letter : letters) {
            PhraseBinding binding = binding(letter);
            sb.append('\n')
              .append(letter)
              .append(": '")
              .append(binding.text())
              .append("' (")
              .append(binding.caseSensitive() ? "Match Case" : "Any Case")
              .append(')');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhraseBindingSet)) return false;
        PhraseBindingSet that = (PhraseBindingSet) o;
        return alphabet.equals(that.alphabet) && bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alphabet, bindings);
    }

    @Override
    public String toString() {
        return "PhraseBindingSet" + bindings.values();
    }

    public static final class Builder {
        private final Set<Character> alphabet;
        private final Map<Character, PhraseBinding> bindings = new LinkedHashMap<>();

        private Builder(Set<Character> alphabet) {
            this.alphabet = alphabet;
        }

        /**
         * Binds a case-insensitive phrase.
         */
        public Builder phrase(char letter, String text) {
            return phrase(letter, text, false);
        }

        /**
         * Binds a phrase, replacing any earlier binding of the same letter.
         *
         * @throws IllegalArgumentException if the letter is not part of the alphabet
         */
        public Builder phrase(char letter, String text, boolean caseSensitive) {
            char key = Character.toUpperCase(letter);
            if (!alphabet.contains(key)) {
                throw new IllegalArgumentException(String.format(
                    "Letter '%s' is not part of the alphabet %s", letter, alphabet));
            }
            bindings.put(key, PhraseBinding.of(key, Objects.requireNonNull(text, "text"), caseSensitive));
            return this;
        }

        public PhraseBindingSet build() {
            Map<Character, PhraseBinding> ordered = new LinkedHashMap<>();
            for (Character letter : alphabet) {
                PhraseBinding binding = bindings.get(letter);
                if (binding != null) {
                    ordered.put(letter, binding);
                }
            }
            return new PhraseBindingSet(alphabet, ordered);
        }
    }
}
