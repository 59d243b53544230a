package domain.annotate;

/**
 * One classified report line.
 */
public final class PlanLine {

    private final String text;
    private final LineKind kind;
    private final Integer stepId;
    private final boolean inPlanTable;

    PlanLine(String text, LineKind kind, Integer stepId, boolean inPlanTable) {
        this.text = text;
        this.kind = kind;
        this.stepId = stepId;
        this.inPlanTable = inPlanTable;
    }

    public String getText() {
        return text;
    }

    public LineKind getKind() {
        return kind;
    }

    /** Step id of a {@link LineKind#DATA} line, otherwise {@code null}. */
    public Integer getStepId() {
        return stepId;
    }

    /**
     * For separators: the line borders the plan table. For continuation lines: the line sits
     * between the table borders. Always {@code true} for header and data lines.
     */
    public boolean isInPlanTable() {
        return inPlanTable;
    }

    @Override
    public String toString() {
        return kind + (stepId == null ? "" : "#" + stepId) + (inPlanTable ? "" : "~") + ": " + text;
    }
}
