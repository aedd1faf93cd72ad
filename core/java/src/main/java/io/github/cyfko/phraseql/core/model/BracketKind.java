package io.github.cyfko.phraseql.core.model;

import java.util.Optional;

/**
 * The three grouping symbols accepted in a formula.
 * <p>
 * All kinds group identically, but a group must be closed by the same kind that opened it:
 * {@code (A]} is a mismatch, not merely an unbalanced count.
 * </p>
 *
 * @since 1.0
 */
public enum BracketKind {
    PAREN('(', ')'),
    SQUARE('[', ']'),
    CURLY('{', '}');

    private final char open;
    private final char close;

    BracketKind(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }

    public static Optional<BracketKind> forOpening(char c) {
        for (BracketKind kind : values()) {
            if (kind.open == c) return Optional.of(kind);
        }
        return Optional.empty();
    }

    public static Optional<BracketKind> forClosing(char c) {
        for (BracketKind kind : values()) {
            if (kind.close == c) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
