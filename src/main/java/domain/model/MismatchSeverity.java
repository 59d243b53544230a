package domain.model;

import java.util.Locale;

/**
 * What to do when a data line refers to a step id that is missing from the catalog.
 * <ul>
 *   <li>{@link #IGNORE}: emit the line unannotated, record nothing</li>
 *   <li>{@link #WARN}: emit the line unannotated and record a {@link WarningCode#RENDER_MISMATCH}</li>
 *   <li>{@link #FAIL}: abort the run</li>
 * </ul>
 */
public enum MismatchSeverity {
    IGNORE,
    WARN,
    FAIL;

    /** Lenient parse; {@code null} when the value is not recognised. */
    public static MismatchSeverity parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        switch (v) {
            case "IGNORE":
            case "SILENT":
            case "NONE":
                return IGNORE;
            case "WARN":
            case "WARNING":
                return WARN;
            case "FAIL":
            case "ERROR":
            case "STRICT":
                return FAIL;
            default:
                return null;
        }
    }
}
