package io.github.cyfko.phraseql.core.model;

/**
 * Half-open range {@code [start, end)} of character offsets in a normalized formula.
 * <p>
 * Offsets always refer to the normalized text (see
 * {@link io.github.cyfko.phraseql.core.parsing.FormulaNormalizer#normalize(String)}),
 * never to the raw text typed by the user.
 * </p>
 *
 * @param start inclusive start offset
 * @param end   exclusive end offset
 * @since 1.0
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative, got: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end (" + end + ") must not precede start (" + start + ")");
        }
    }

    public static TextSpan of(int start, int end) {
        return new TextSpan(start, end);
    }

    public int length() {
        return end - start;
    }

    /**
     * Smallest span covering both this span and {@code other}.
     */
    public TextSpan merge(TextSpan other) {
        return new TextSpan(Math.min(start, other.start), Math.max(end, other.end));
    }

    public String extract(String text) {
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
