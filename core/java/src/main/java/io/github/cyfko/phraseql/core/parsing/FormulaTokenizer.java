package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.model.BracketKind;
import io.github.cyfko.phraseql.core.model.TextSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Splits a normalized formula into {@link Token}s.
 * <p>
 * Letters are read as whole words, delimited by any non-letter or by the ends of the text:
 * </p>
 * <ul>
 *   <li>a word spelling an operator keyword, in any case, is that operator;</li>
 *   <li>a word made only of alphabet letters yields one variable per letter, so {@code AB}
 *       is later reported as two adjacent variables;</li>
 *   <li>any other word is a single {@link TokenKind#INVALID} token, so {@code ANDREW} is never
 *       read as {@code AND} followed by {@code REW}.</li>
 * </ul>
 * <p>
 * Whitespace separates tokens and is dropped. Every other character that is not a bracket is an
 * invalid token of its own. Tokenizing never fails; invalid input is reported by the parser.
 * </p>
 *
 * @since 1.0
 */
public final class FormulaTokenizer {

    private FormulaTokenizer() {}

    /**
     * @param normalized output of {@link FormulaNormalizer#normalize(String)}
     * @param alphabet   upper-case letters accepted as variables
     * @return tokens in reading order, with offsets into {@code normalized}
     */
    public static List<Token> tokenize(String normalized, Set<Character> alphabet) {
        Objects.requireNonNull(normalized, "normalized");
        Objects.requireNonNull(alphabet, "alphabet");

        List<Token> tokens = new ArrayList<>();
        int length = normalized.length();
        int i = 0;

        while (i < length) {
            char c = normalized.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (Character.isLetter(c)) {
                int start = i;
                while (i < length && Character.isLetter(normalized.charAt(i))) {
                    i++;
                }
                scanWord(normalized.substring(start, i), start, alphabet, tokens);
                continue;
            }

            TextSpan span = TextSpan.of(i, i + 1);
            Optional<BracketKind> opening = BracketKind.forOpening(c);
            Optional<BracketKind> closing = BracketKind.forClosing(c);
            if (opening.isPresent()) {
                tokens.add(Token.leftBracket(opening.get(), span));
            } else if (closing.isPresent()) {
                tokens.add(Token.rightBracket(closing.get(), span));
            } else {
                tokens.add(Token.invalid(String.valueOf(c), span));
            }
            i++;
        }

        return tokens;
    }

    private static void scanWord(String word, int start, Set<Character> alphabet, List<Token> tokens) {
        String upper = word.toUpperCase(Locale.ROOT);
        TextSpan span = TextSpan.of(start, start + word.length());

        Optional<TokenKind> keyword = TokenKind.keyword(upper);
        if (keyword.isPresent()) {
            tokens.add(Token.operator(keyword.get(), word, span));
            return;
        }

        // Upper-casing can change the length of some scripts; only split words it leaves aligned.
        boolean allVariables = upper.length() == word.length();
        for (int k = 0; allVariables && k < upper.length(); k++) {
            allVariables = alphabet.contains(upper.charAt(k));
        }

        if (!allVariables) {
            tokens.add(Token.invalid(word, span));
            return;
        }

        for (int k = 0; k < word.length(); k++) {
            tokens.add(Token.variable(upper.charAt(k), word.substring(k, k + 1), TextSpan.of(start + k, start + k + 1)));
        }
    }
}
