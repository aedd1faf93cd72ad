package io.github.cyfko.phraseql.core.validation;

/**
 * Overall status of a validated formula, as an editor would show it.
 *
 * @since 1.0
 */
public enum ValidationState {
    /** Well formed, no warnings. */
    VALID,
    /** Well formed, with advisory warnings only. */
    WARNING,
    /** Malformed, or carrying a blocking warning: no search may run. */
    ERROR
}
