package io.github.cyfko.phraseql.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaNormalizer Tests")
class FormulaNormalizerTest {

    @Nested
    @DisplayName("Symbol rewriting")
    class SymbolTests {

        @ParameterizedTest
        @CsvSource(delimiter = ';', value = {
            "A & B;A AND B",
            "A && B;A AND B",
            "A | B;A OR B",
            "A || B;A OR B",
            "A|B;A OR B",
            "!A;NOT A",
            "~A;NOT A",
            "A ^ B;A XOR B",
            "A & !B;A AND NOT B",
            "(A||B)&&!C;(A OR B) AND NOT C",
            "A NOR B;A NOR B"
        })
        @DisplayName("Symbols become keywords")
        void testSymbolsBecomeKeywords(String raw, String expected) {
            assertEquals(expected, FormulaNormalizer.normalize(raw));
        }

        @Test
        @DisplayName("Whitespace runs collapse and ends are trimmed")
        void testWhitespace() {
            assertEquals("A AND B", FormulaNormalizer.normalize("  A \t AND\n\nB  "));
        }

        @Test
        @DisplayName("Unknown characters pass through")
        void testUnknownCharacters() {
            assertEquals("A $ B", FormulaNormalizer.normalize("A $ B"));
        }

        @Test
        @DisplayName("Blank input normalizes to empty")
        void testBlank() {
            assertEquals("", FormulaNormalizer.normalize("   "));
        }

        @Test
        @DisplayName("Null input is rejected")
        void testNull() {
            assertThrows(NullPointerException.class, () -> FormulaNormalizer.normalize(null));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "A & !B",
        "(A||B)&&~C",
        "  a and   not b ",
        "A ^ B | C",
        "[A] & {B} | (C)",
        "A $ B",
        ""
    })
    @DisplayName("Normalization is idempotent")
    void testIdempotent(String raw) {
        String once = FormulaNormalizer.normalize(raw);
        assertEquals(once, FormulaNormalizer.normalize(once));
    }

    @Nested
    @DisplayName("Operator upper-casing")
    class UppercaseTests {

        @Test
        @DisplayName("Keywords are upper-cased, other words are left alone")
        void testKeywordsOnly() {
            assertEquals("a AND NOT (b OR Android)",
                FormulaNormalizer.uppercaseOperators("a and not (b or Android)"));
        }

        @Test
        @DisplayName("Every keyword is recognized")
        void testAllKeywords() {
            assertEquals("A NOR B XOR C XNOR D",
                FormulaNormalizer.uppercaseOperators("A nor B xor C Xnor D"));
        }

        @Test
        @DisplayName("Length and positions are preserved")
        void testLengthPreserved() {
            String raw = "a and   b or not c";
            String result = FormulaNormalizer.uppercaseOperators(raw);
            assertEquals(raw.length(), result.length());
            assertEquals("a AND   b OR NOT c", result);
        }
    }
}
