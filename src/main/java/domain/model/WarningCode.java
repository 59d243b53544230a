package domain.model;

/**
 * Standard warning codes for annotation.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * A data line carries a step id that is not in the catalog; the line is emitted unannotated.
     */
    RENDER_MISMATCH,

    /**
     * The catalog returned no plan rows; the rendered report is passed through unannotated.
     */
    EMPTY_CATALOG,

    /**
     * Name qualification was requested but the report has no {@code Name} column.
     */
    NAME_COLUMN_NOT_FOUND,

    /**
     * Annotating a single group exceeded the configured slow threshold.
     */
    SLOW_STEP
}
