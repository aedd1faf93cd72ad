package io.github.cyfko.phraseql.core.parsing;

import io.github.cyfko.phraseql.core.config.FormulaPolicy;
import io.github.cyfko.phraseql.core.model.BracketKind;
import io.github.cyfko.phraseql.core.model.TextSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaTokenizer Tests")
class FormulaTokenizerTest {

    private static final Set<Character> ABCD = FormulaPolicy.DEFAULT_ALPHABET;

    private static List<TokenKind> kinds(String normalized) {
        return FormulaTokenizer.tokenize(normalized, ABCD).stream()
            .map(Token::kind)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Tokens carry kind, lexeme and span")
    void testSimpleFormula() {
        List<Token> tokens = FormulaTokenizer.tokenize("A AND B", ABCD);

        assertEquals(3, tokens.size());
        assertEquals(TokenKind.VARIABLE, tokens.get(0).kind());
        assertEquals('A', tokens.get(0).letter());
        assertEquals(TextSpan.of(0, 1), tokens.get(0).span());
        assertEquals(TokenKind.AND, tokens.get(1).kind());
        assertEquals(TextSpan.of(2, 5), tokens.get(1).span());
        assertEquals(TextSpan.of(6, 7), tokens.get(2).span());
    }

    @Test
    @DisplayName("Every operator keyword is recognized")
    void testAllOperators() {
        assertEquals(
            List.of(TokenKind.NOT, TokenKind.VARIABLE, TokenKind.AND, TokenKind.VARIABLE, TokenKind.OR,
                TokenKind.VARIABLE, TokenKind.NOR, TokenKind.VARIABLE, TokenKind.XOR, TokenKind.VARIABLE,
                TokenKind.XNOR, TokenKind.VARIABLE),
            kinds("NOT A AND B OR C NOR D XOR A XNOR B"));
    }

    @Test
    @DisplayName("Keywords and letters are case-insensitive")
    void testLowerCase() {
        List<Token> tokens = FormulaTokenizer.tokenize("a and b", ABCD);

        assertEquals(List.of(TokenKind.VARIABLE, TokenKind.AND, TokenKind.VARIABLE),
            tokens.stream().map(Token::kind).collect(Collectors.toList()));
        assertEquals('A', tokens.get(0).letter());
        assertEquals("and", tokens.get(1).lexeme());
        assertEquals('B', tokens.get(2).letter());
    }

    @Test
    @DisplayName("A word containing a keyword is not split")
    void testWordContainingKeyword() {
        List<Token> tokens = FormulaTokenizer.tokenize("ANDREW", ABCD);

        assertEquals(1, tokens.size());
        assertEquals(TokenKind.INVALID, tokens.get(0).kind());
        assertEquals("ANDREW", tokens.get(0).lexeme());
    }

    @Test
    @DisplayName("A run of alphabet letters yields one variable per letter")
    void testLetterRun() {
        List<Token> tokens = FormulaTokenizer.tokenize("AB", ABCD);

        assertEquals(List.of(TokenKind.VARIABLE, TokenKind.VARIABLE),
            tokens.stream().map(Token::kind).collect(Collectors.toList()));
        assertEquals(TextSpan.of(1, 2), tokens.get(1).span());
    }

    @Test
    @DisplayName("Brackets record their kind")
    void testBrackets() {
        List<Token> tokens = FormulaTokenizer.tokenize("([{A}])", ABCD);

        assertEquals(BracketKind.PAREN, tokens.get(0).bracketKind());
        assertEquals(BracketKind.SQUARE, tokens.get(1).bracketKind());
        assertEquals(BracketKind.CURLY, tokens.get(2).bracketKind());
        assertEquals(TokenKind.RIGHT_BRACKET, tokens.get(4).kind());
        assertEquals(BracketKind.CURLY, tokens.get(4).bracketKind());
    }

    @Test
    @DisplayName("Letters outside the alphabet are invalid")
    void testAlphabet() {
        assertEquals(TokenKind.INVALID, FormulaTokenizer.tokenize("E", ABCD).get(0).kind());
        assertEquals(TokenKind.VARIABLE,
            FormulaTokenizer.tokenize("E", FormulaPolicy.alphabetOf("ABCDEF")).get(0).kind());
    }

    @Test
    @DisplayName("Unknown characters become single invalid tokens")
    void testInvalidCharacters() {
        assertEquals(List.of(TokenKind.VARIABLE, TokenKind.INVALID, TokenKind.VARIABLE), kinds("A $ B"));
        assertEquals(List.of(TokenKind.VARIABLE, TokenKind.INVALID), kinds("A1"));
    }

    @Test
    @DisplayName("Empty text yields no token")
    void testEmpty() {
        assertTrue(FormulaTokenizer.tokenize("", ABCD).isEmpty());
    }
}
