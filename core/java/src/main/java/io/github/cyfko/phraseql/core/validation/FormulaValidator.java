package io.github.cyfko.phraseql.core.validation;

import io.github.cyfko.phraseql.core.config.FormulaPolicy;
import io.github.cyfko.phraseql.core.diagnostic.Diagnostic;
import io.github.cyfko.phraseql.core.model.FormulaNode;
import io.github.cyfko.phraseql.core.parsing.ParseOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs semantic checks over a parsed formula.
 * <p>
 * A failed parse short-circuits: the result holds exactly the parse error and no check runs.
 * The default checks, in order, are paradoxes, tautologies, unbound variables and constant
 * formulas.
 * </p>
 *
 * @since 1.0
 */
public final class FormulaValidator {

    private static final Logger log = Logger.getLogger(FormulaValidator.class.getName());

    private final List<SemanticCheck> checks;

    public FormulaValidator(FormulaPolicy policy) {
        this(defaultChecks(Objects.requireNonNull(policy, "policy")));
    }

    public FormulaValidator(List<SemanticCheck> checks) {
        this.checks = List.copyOf(Objects.requireNonNull(checks, "checks"));
    }

    public static List<SemanticCheck> defaultChecks(FormulaPolicy policy) {
        return List.of(
            ComplementaryLiteralCheck.paradoxes(),
            ComplementaryLiteralCheck.tautologies(),
            new UnboundVariableCheck(),
            new ConstantFormulaCheck(policy.maxExhaustiveVariables())
        );
    }

    public ValidationResult validate(ParseOutcome outcome, Map<Character, String> phraseTexts) {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(phraseTexts, "phraseTexts");

        if (!outcome.isSuccess()) {
            return ValidationResult.failure(outcome.error().orElseThrow());
        }

        FormulaNode root = outcome.root().orElseThrow();
        List<Diagnostic> warnings = new ArrayList<>();
        for (SemanticCheck check : checks) {
            check.inspect(root, phraseTexts, warnings);
        }

        ValidationResult result = ValidationResult.success(warnings);
        log.fine(() -> String.format("Validated formula %s: %s", root.span(), result));
        return result;
    }
}
