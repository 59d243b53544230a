package domain.annotate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies the lines of a {@code DBMS_XPLAN} style report.
 *
 * <p>All literal markers the annotator relies on are declared here. Anything that does not
 * match them falls back to {@link LineKind#PASSTHROUGH} and is emitted untouched.</p>
 */
public final class PlanLineClassifier {

    /** Rule character of the table borders. */
    public static final char RULE = '-';
    /** Column delimiter. */
    public static final char DELIMITER = '|';
    /** Title of the first column in the header row. */
    public static final String HEADER_TOKEN = "Id";

    /**
     * Delimiter, optional markers ({@code *} predicate, {@code -} inactive adaptive row),
     * the step id, delimiter.
     */
    private static final Pattern DATA = Pattern.compile("^\\|[ *\\-]*([0-9]+) *\\|");

    /** Kind of a single line, without context. */
    public LineKind kindOf(String line) {
        if (line == null || line.isEmpty()) return LineKind.PASSTHROUGH;
        if (isRule(line)) return LineKind.SEPARATOR;
        if (isHeader(line)) return LineKind.HEADER;
        if (DATA.matcher(line).find()) return LineKind.DATA;
        if (line.indexOf(DELIMITER) >= 0) return LineKind.CONTINUATION;
        return LineKind.PASSTHROUGH;
    }

    /** Step id of a data line (first digit run after the opening delimiter), or {@code null}. */
    public Integer stepIdOf(String line) {
        if (line == null) return null;
        Matcher m = DATA.matcher(line);
        if (!m.find()) return null;
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            // more digits than an int holds: not a plan row we can annotate
            return null;
        }
    }

    /**
     * Classifies all lines. Separators look one line ahead (a header follows) and one line back
     * (a header, plan row or in-table wrap precedes) to decide whether they border the plan table.
     */
    public List<PlanLine> classify(List<String> lines) {
        if (lines == null || lines.isEmpty()) return Collections.emptyList();

        int n = lines.size();
        LineKind[] kinds = new LineKind[n];
        for (int i = 0; i < n; i++) kinds[i] = kindOf(lines.get(i));

        List<PlanLine> out = new ArrayList<>(n);
        boolean open = false;
        boolean prevInTable = false;

        for (int i = 0; i < n; i++) {
            String text = lines.get(i) == null ? "" : lines.get(i);
            LineKind kind = kinds[i];
            LineKind prev = (i > 0) ? kinds[i - 1] : null;
            LineKind next = (i + 1 < n) ? kinds[i + 1] : null;

            boolean inTable;
            Integer stepId = null;

            switch (kind) {
                case SEPARATOR:
                    boolean opens = next == LineKind.HEADER;
                    boolean afterHeader = prev == LineKind.HEADER;
                    boolean closes = prev == LineKind.DATA
                            || (prev == LineKind.CONTINUATION && prevInTable);
                    inTable = opens || afterHeader || closes;
                    if (opens || afterHeader) {
                        open = true;
                    } else if (closes) {
                        open = false;
                    }
                    break;
                case HEADER:
                    inTable = true;
                    open = true;
                    break;
                case DATA:
                    stepId = stepIdOf(text);
                    inTable = true;
                    break;
                case CONTINUATION:
                    inTable = open;
                    break;
                default:
                    inTable = false;
                    break;
            }

            out.add(new PlanLine(text, kind, stepId, inTable));
            prevInTable = inTable;
        }
        return out;
    }

    private static boolean isRule(String line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == ' ') end--;
        if (end == 0) return false;
        for (int i = 0; i < end; i++) {
            if (line.charAt(i) != RULE) return false;
        }
        return true;
    }

    private static boolean isHeader(String line) {
        if (line.charAt(0) != DELIMITER) return false;
        int second = line.indexOf(DELIMITER, 1);
        if (second < 0) return false;
        return line.substring(1, second).trim().equals(HEADER_TOKEN);
    }
}
