package domain.model;

import java.util.Locale;

/**
 * How many footer blocks an annotated report carries.
 * <ul>
 *   <li>{@link #REPORT}: one footer after the last line of the whole report</li>
 *   <li>{@link #BLOCK}: one footer after every group block</li>
 * </ul>
 */
public enum FooterMode {
    REPORT,
    BLOCK;

    public static FooterMode parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        if (v.equals("REPORT") || v.equals("ONCE")) return REPORT;
        if (v.equals("BLOCK") || v.equals("GROUP") || v.equals("PER_GROUP")) return BLOCK;
        return null;
    }
}
