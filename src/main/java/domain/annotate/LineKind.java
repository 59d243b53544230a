package domain.annotate;

/**
 * Kinds of report lines, in classification priority order.
 */
public enum LineKind {
    /** The whole line is rule characters. */
    SEPARATOR,
    /** The column-title row of the plan table ({@code | Id | Operation | ...}). */
    HEADER,
    /** A plan row: delimiter, optional marker, step id, delimiter. */
    DATA,
    /** A line with delimiters that is not a plan row (a wrapped field). */
    CONTINUATION,
    /** Anything else; emitted as-is. */
    PASSTHROUGH
}
