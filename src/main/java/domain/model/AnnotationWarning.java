package domain.model;

/**
 * A single warning emitted while annotating a report.
 *
 * <p>Warnings are not fatal; the affected line is emitted as rendered and the
 * warning is reported at the end of the run.</p>
 */
public final class AnnotationWarning {

    private final WarningCode code;
    private final String groupKey;
    private final Integer stepId;
    private final String message;
    private final String detail;

    public AnnotationWarning(
            WarningCode code,
            String groupKey,
            Integer stepId,
            String message,
            String detail
    ) {
        this.code = code == null ? WarningCode.RENDER_MISMATCH : code;
        this.groupKey = nullToEmpty(groupKey);
        this.stepId = stepId;
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static AnnotationWarning of(
            WarningCode code,
            String groupKey,
            Integer stepId,
            String message
    ) {
        return new AnnotationWarning(code, groupKey, stepId, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getGroupKey() {
        return groupKey;
    }

    /** Step id the warning refers to, or {@code null} for group-level warnings. */
    public Integer getStepId() {
        return stepId;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(code.name());
        if (!groupKey.isEmpty()) sb.append(" group=").append(groupKey);
        if (stepId != null) sb.append(" id=").append(stepId);
        sb.append(" : ").append(message);
        if (!detail.isEmpty()) sb.append(" (").append(detail).append(')');
        return sb.toString();
    }
}
