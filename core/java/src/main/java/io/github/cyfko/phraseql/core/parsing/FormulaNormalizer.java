package io.github.cyfko.phraseql.core.parsing;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rewrites symbolic operators into their keyword form and collapses whitespace.
 * <p>
 * Replacements are applied in a fixed order, longest symbol first, so that {@code &&} is never
 * read as two {@code &}:
 * </p>
 * <table border="1">
 * <caption>Symbol rewriting</caption>
 * <thead><tr><th>Symbol</th><th>Keyword</th></tr></thead>
 * <tbody>
 * <tr><td>{@code &&}, {@code &}</td><td>AND</td></tr>
 * <tr><td>{@code ||}, {@code |}</td><td>OR</td></tr>
 * <tr><td>{@code !}, {@code ~}</td><td>NOT</td></tr>
 * <tr><td>{@code ^}</td><td>XOR</td></tr>
 * </tbody>
 * </table>
 *
 * <p>Normalization never fails: characters it does not know are left for the tokenizer to
 * report. It is idempotent, {@code normalize(normalize(s)).equals(normalize(s))}.</p>
 *
 * <pre>{@code
 * FormulaNormalizer.normalize("A & !B");     // "A AND NOT B"
 * FormulaNormalizer.normalize("A||  B ^ C"); // "A OR B XOR C"
 * }</pre>
 *
 * @since 1.0
 */
public final class FormulaNormalizer {

    private static final String[][] REPLACEMENTS = {
        {"&&", " AND "},
        {"||", " OR "},
        {"&", " AND "},
        {"|", " OR "},
        {"!", " NOT "},
        {"~", " NOT "},
        {"^", " XOR "}
    };

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern OPERATOR_WORD =
        Pattern.compile("(?<![\\p{L}])(?:xnor|xor|nor|not|and|or)(?![\\p{L}])", Pattern.CASE_INSENSITIVE);

    private FormulaNormalizer() {}

    /**
     * @param raw formula as typed by the user
     * @return the formula with keyword operators and single spaces, trimmed
     * @throws NullPointerException if raw is null
     */
    public static String normalize(String raw) {
        Objects.requireNonNull(raw, "formula");

        String normalized = raw;
        for (String[] replacement : REPLACEMENTS) {
            normalized = normalized.replace(replacement[0], replacement[1]);
        }
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }

    /**
     * Upper-cases whole-word operator keywords without moving any other character, so an editor
     * can canonicalize keyword case while keeping the caret where it was.
     *
     * <pre>{@code
     * FormulaNormalizer.uppercaseOperators("a and not (b or Android)"); // "a AND NOT (b OR Android)"
     * }</pre>
     */
    public static String uppercaseOperators(String raw) {
        Objects.requireNonNull(raw, "formula");
        return OPERATOR_WORD.matcher(raw).replaceAll(match -> match.group().toUpperCase(Locale.ROOT));
    }
}
