package domain.annotate;

import java.util.List;

/**
 * Informational block appended after an annotated report.
 *
 * <p>The underline uses {@code =} rather than the table rule character so that a footer never
 * classifies as a table border when a report is annotated again.</p>
 */
public final class ReportFooter {

    public static final String TOOL_NAME = "xplan-annotator";
    public static final String VERSION = "1.3.0";

    private static final List<String> LINES = List.of(
            "",
            "About",
            "=====",
            "  - " + TOOL_NAME + " v" + VERSION + ": Pid = parent operation id, Ord = execution order"
    );

    private ReportFooter() {
    }

    public static List<String> lines() {
        return LINES;
    }
}
