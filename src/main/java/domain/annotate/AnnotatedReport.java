package domain.annotate;

import domain.model.AnnotationWarning;

import java.util.Collections;
import java.util.List;

/**
 * Result of one invocation: the output lines (footer included) and what went wrong on the way.
 */
public final class AnnotatedReport {

    private final List<String> lines;
    private final int groupCount;
    private final int annotatedRows;
    private final List<AnnotationWarning> warnings;

    public AnnotatedReport(List<String> lines, int groupCount, int annotatedRows, List<AnnotationWarning> warnings) {
        this.lines = lines == null ? Collections.emptyList() : Collections.unmodifiableList(lines);
        this.groupCount = groupCount;
        this.annotatedRows = annotatedRows;
        this.warnings = warnings == null ? Collections.emptyList() : Collections.unmodifiableList(warnings);
    }

    public List<String> getLines() {
        return lines;
    }

    /** Number of plans (groups) found in the catalog; 0 when nothing matched. */
    public int getGroupCount() {
        return groupCount;
    }

    /** Number of plan rows that received a {@code Pid}/{@code Ord} value. */
    public int getAnnotatedRows() {
        return annotatedRows;
    }

    public List<AnnotationWarning> getWarnings() {
        return warnings;
    }
}
