package io.github.cyfko.phraseql.core.validation;

import io.github.cyfko.phraseql.core.config.FormulaPolicy;
import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.diagnostic.DiagnosticKind;
import io.github.cyfko.phraseql.core.model.FormulaNode;
import io.github.cyfko.phraseql.core.model.TextSpan;
import io.github.cyfko.phraseql.core.parsing.FormulaParser;
import io.github.cyfko.phraseql.core.parsing.ParseOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("FormulaValidator Tests")
class FormulaValidatorTest {

    private static final Map<Character, String> ALL_BOUND = Map.of('A', "alpha", 'B', "beta", 'C', "gamma", 'D', "delta");

    private FormulaValidator validator;

    @Mock
    private SemanticCheck firstCheck;

    @Mock
    private SemanticCheck secondCheck;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        validator = new FormulaValidator(FormulaPolicy.defaults());
    }

    private ValidationResult validate(String raw) {
        return validate(raw, ALL_BOUND);
    }

    private ValidationResult validate(String raw, Map<Character, String> texts) {
        return validator.validate(FormulaParser.parse(raw, FormulaPolicy.DEFAULT_ALPHABET), texts);
    }

    private static List<DiagnosticKind> kinds(ValidationResult result) {
        return result.warnings().stream().map(Diagnostic::kind).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Parse failures")
    class ParseFailureTests {

        @Test
        @DisplayName("A parse error is the only diagnostic")
        void testParseErrorOnly() {
            ValidationResult result = validate("A AND NOT A)", Map.of());

            assertFalse(result.isValid());
            assertEquals(1, result.errors().size());
            assertEquals(DiagnosticKind.UNMATCHED_CLOSE, result.errors().get(0).kind());
            assertTrue(result.warnings().isEmpty());
            assertFalse(result.canExecute());
            assertEquals(ValidationState.ERROR, result.state());
        }

        @Test
        @DisplayName("Semantic checks do not run after a parse error")
        void testChecksSkipped() {
            FormulaValidator mocked = new FormulaValidator(List.of(firstCheck, secondCheck));

            mocked.validate(FormulaParser.parse("(A", FormulaPolicy.DEFAULT_ALPHABET), ALL_BOUND);

            verifyNoInteractions(firstCheck, secondCheck);
        }
    }

    @Nested
    @DisplayName("Paradoxes")
    class ParadoxTests {

        @Test
        @DisplayName("A AND NOT A is a blocking paradox on a valid formula")
        void testSimpleParadox() {
            ValidationResult result = validate("A AND NOT A");

            assertTrue(result.isValid());
            assertEquals(List.of(DiagnosticKind.PARADOX), kinds(result));
            assertTrue(result.hasBlockingWarnings());
            assertFalse(result.canExecute());
            assertEquals(ValidationState.ERROR, result.state());

            Diagnostic paradox = result.warnings().get(0);
            assertEquals("Logical paradox detected: 'A AND NOT A' - this will always be false", paradox.message());
            assertEquals(Optional.of('A'), paradox.letter());
            assertEquals(Optional.of(TextSpan.of(0, 11)), paradox.position());
        }

        @ParameterizedTest
        @CsvSource(delimiter = ';', value = {
            "NOT A AND A",
            "(A AND B) AND NOT A",
            "B AND (NOT A AND (C AND A))",
            "A AND NOT NOT NOT A",
            "NOT NOT A AND NOT A",
            "C OR (A AND B AND NOT A)"
        })
        @DisplayName("Paradoxes are found through nesting and double negation")
        void testNestedParadox(String raw) {
            assertTrue(kinds(validate(raw)).contains(DiagnosticKind.PARADOX), raw);
        }

        @Test
        @DisplayName("Complementary literals in different chains are not a paradox")
        void testNotAParadox() {
            ValidationResult result = validate("A AND (B OR NOT A)");

            assertTrue(result.warnings().isEmpty());
            assertEquals(ValidationState.VALID, result.state());
        }

        @Test
        @DisplayName("Each letter is reported once")
        void testReportedOnce() {
            ValidationResult result = validate("(A AND NOT A) OR (A AND NOT A)");
            assertEquals(List.of(DiagnosticKind.PARADOX), kinds(result));
        }
    }

    @Nested
    @DisplayName("Tautologies")
    class TautologyTests {

        @Test
        @DisplayName("A OR NOT A is an advisory tautology")
        void testSimpleTautology() {
            ValidationResult result = validate("A OR NOT A");

            assertTrue(result.isValid());
            assertEquals(List.of(DiagnosticKind.TAUTOLOGY), kinds(result));
            assertFalse(result.hasBlockingWarnings());
            assertTrue(result.canExecute());
            assertEquals(ValidationState.WARNING, result.state());
            assertEquals("Tautology detected: 'A OR NOT A' - this will always be true",
                result.warnings().get(0).message());
        }

        @Test
        @DisplayName("Tautologies inside an AND are still reported")
        void testNestedTautology() {
            assertEquals(List.of(DiagnosticKind.TAUTOLOGY), kinds(validate("C AND (B OR A OR NOT B)")));
        }
    }

    @Nested
    @DisplayName("Constant formulas")
    class ConstantTests {

        @ParameterizedTest
        @CsvSource(delimiter = ';', value = {
            "A XOR A;UNSATISFIABLE",
            "A NOR NOT A;UNSATISFIABLE",
            "NOT (A OR NOT A);UNSATISFIABLE",
            "A XNOR A;ALWAYS_TRUE",
            "NOT (A AND NOT B) OR NOT B;ALWAYS_TRUE"
        })
        @DisplayName("Constants missed by the chain checks are detected")
        void testConstants(String raw, DiagnosticKind expected) {
            assertTrue(kinds(validate(raw)).contains(expected), raw);
        }

        @Test
        @DisplayName("Unsatisfiable formulas cannot execute")
        void testUnsatisfiableBlocks() {
            ValidationResult result = validate("A XOR A");
            assertTrue(result.isValid());
            assertFalse(result.canExecute());
        }

        @Test
        @DisplayName("Constant detection can be disabled")
        void testDisabled() {
            FormulaValidator disabled = new FormulaValidator(FormulaPolicy.builder().maxExhaustiveVariables(0).build());

            ValidationResult result = disabled.validate(FormulaParser.parse("A XOR A", FormulaPolicy.DEFAULT_ALPHABET), ALL_BOUND);

            assertTrue(result.warnings().isEmpty());
        }

        @Test
        @DisplayName("Formulas above the variable limit are not enumerated")
        void testLimit() {
            FormulaValidator limited = new FormulaValidator(FormulaPolicy.builder().maxExhaustiveVariables(1).build());

            ValidationResult result = limited.validate(
                FormulaParser.parse("(A XOR A) AND B", FormulaPolicy.DEFAULT_ALPHABET), ALL_BOUND);

            assertTrue(result.warnings().isEmpty());
        }
    }

    @Nested
    @DisplayName("Unbound variables")
    class UnboundTests {

        @Test
        @DisplayName("Missing and blank phrases are reported in reading order")
        void testUnbound() {
            ValidationResult result = validate("C OR A AND B", Map.of('A', "x", 'B', "  "));

            assertEquals(List.of(DiagnosticKind.UNBOUND_VARIABLE, DiagnosticKind.UNBOUND_VARIABLE), kinds(result));
            assertEquals("Variable C is used in formula but has no corresponding phrase",
                result.warnings().get(0).message());
            assertEquals(Optional.of('B'), result.warnings().get(1).letter());
            assertEquals(Optional.of(TextSpan.of(11, 12)), result.warnings().get(1).position());
            assertTrue(result.canExecute());
        }

        @Test
        @DisplayName("Unused empty letters are not reported")
        void testUnusedLetters() {
            assertTrue(validate("A", Map.of('A', "x")).warnings().isEmpty());
        }
    }

    @Nested
    @DisplayName("Check pipeline")
    class PipelineTests {

        @Test
        @DisplayName("Checks run in order on the parsed tree")
        void testChecksInvoked() {
            doAnswer(invocation -> {
                List<Diagnostic> warnings = invocation.getArgument(2);
                warnings.add(Diagnostic.of(DiagnosticKind.ALWAYS_TRUE, "first"));
                return null;
            }).when(firstCheck).inspect(any(), any(), anyList());

            FormulaValidator mocked = new FormulaValidator(List.of(firstCheck, secondCheck));
            ParseOutcome outcome = FormulaParser.parse("A AND B", FormulaPolicy.DEFAULT_ALPHABET);
            FormulaNode root = outcome.root().orElseThrow();

            ValidationResult result = mocked.validate(outcome, ALL_BOUND);

            verify(firstCheck).inspect(eq(root), eq(ALL_BOUND), anyList());
            verify(secondCheck).inspect(eq(root), eq(ALL_BOUND),
                argThat(warnings -> warnings.size() == 1 && "first".equals(warnings.get(0).message())));
            assertEquals(List.of(DiagnosticKind.ALWAYS_TRUE), kinds(result));
        }

        @Test
        @DisplayName("Error kinds are rejected as warnings")
        void testSuccessRejectsErrors() {
            assertThrows(IllegalArgumentException.class, () -> ValidationResult.success(
                List.of(Diagnostic.of(DiagnosticKind.EMPTY_FORMULA, "empty"))));
        }
    }
}
