package io.github.cyfko.phraseql.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Literal phrase bound to a formula variable, with its case-sensitivity flag.
 * <p>
 * A blank phrase never matches: the variable evaluates to {@code false} whatever the content
 * and whatever the case-sensitivity flag says. Non-blank phrases are matched verbatim as plain
 * substrings; no pattern syntax is interpreted.
 * </p>
 *
 * @since 1.0
 */
public final class PhraseBinding {

    private final char letter;
    private final String text;
    private final boolean caseSensitive;
    private final String foldedText;

    private PhraseBinding(char letter, String text, boolean caseSensitive) {
        this.letter = Character.toUpperCase(letter);
        this.text = Objects.requireNonNull(text, "text");
        this.caseSensitive = caseSensitive;
        this.foldedText = text.toLowerCase(Locale.ROOT);
    }

    public static PhraseBinding of(char letter, String text, boolean caseSensitive) {
        return new PhraseBinding(letter, text, caseSensitive);
    }

    /**
     * Case-insensitive binding.
     */
    public static PhraseBinding of(char letter, String text) {
        return new PhraseBinding(letter, text, false);
    }

    public static PhraseBinding empty(char letter) {
        return new PhraseBinding(letter, "", false);
    }

    public char letter() {
        return letter;
    }

    public String text() {
        return text;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    /**
     * @return true when the phrase is blank and therefore can never match
     */
    public boolean isEmpty() {
        return text.isBlank();
    }

    /**
     * Phrase lower-cased with {@link Locale#ROOT}, used for case-insensitive matching.
     */
    public String foldedText() {
        return foldedText;
    }

    /**
     * Tests the phrase against a single piece of content.
     */
    public boolean occursIn(String content) {
        if (isEmpty()) {
            return false;
        }
        return caseSensitive
            ? content.contains(text)
            : content.toLowerCase(Locale.ROOT).contains(foldedText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhraseBinding)) return false;
        PhraseBinding that = (PhraseBinding) o;
        return letter == that.letter && caseSensitive == that.caseSensitive && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(letter, text, caseSensitive);
    }

    @Override
    public String toString() {
        return "PhraseBinding[" + letter + "='" + text + "'" + (caseSensitive ? ", case-sensitive" : "") + "]";
    }
}
