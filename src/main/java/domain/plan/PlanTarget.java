package domain.plan;

import java.util.Objects;

/**
 * Which plan to annotate.
 *
 * <p>Fields that do not apply to a source are {@code null}. A target is immutable; resolution of
 * defaults (latest explained plan, previous cursor, current dbid) produces a new instance via the
 * {@code with*} methods.</p>
 */
public final class PlanTarget {

    public static final String DEFAULT_PLAN_TABLE = "PLAN_TABLE";
    public static final String DEFAULT_FORMAT = "TYPICAL";

    private final ReportSource source;
    private final String planTable;
    private final String statementId;
    private final Long planId;
    private final String sqlId;
    private final Integer childNumber;
    private final Long planHashValue;
    private final Long dbid;
    private final String format;

    private PlanTarget(ReportSource source, String planTable, String statementId, Long planId,
                       String sqlId, Integer childNumber, Long planHashValue, Long dbid, String format) {
        this.source = Objects.requireNonNull(source, "source");
        this.planTable = planTable;
        this.statementId = statementId;
        this.planId = planId;
        this.sqlId = sqlId;
        this.childNumber = childNumber;
        this.planHashValue = planHashValue;
        this.dbid = dbid;
        this.format = (format == null || format.isBlank()) ? DEFAULT_FORMAT : format.trim();
    }

    public static PlanTarget planTable(String planTable, String statementId, String format) {
        String table = (planTable == null || planTable.isBlank()) ? DEFAULT_PLAN_TABLE : planTable.trim();
        return new PlanTarget(ReportSource.PLAN_TABLE, table, statementId, null,
                null, null, null, null, format);
    }

    public static PlanTarget cursor(String sqlId, Integer childNumber, String format) {
        return new PlanTarget(ReportSource.CURSOR, null, null, null,
                sqlId, childNumber, null, null, format);
    }

    public static PlanTarget awr(String sqlId, Long planHashValue, Long dbid, String format) {
        return new PlanTarget(ReportSource.AWR, null, null, null,
                sqlId, null, planHashValue, dbid, format);
    }

    public PlanTarget withPlan(Long planId, String statementId) {
        return new PlanTarget(source, planTable, statementId, planId, sqlId, childNumber, planHashValue, dbid, format);
    }

    public PlanTarget withCursor(String sqlId, Integer childNumber) {
        return new PlanTarget(source, planTable, statementId, planId, sqlId, childNumber, planHashValue, dbid, format);
    }

    public PlanTarget withDbid(Long dbid) {
        return new PlanTarget(source, planTable, statementId, planId, sqlId, childNumber, planHashValue, dbid, format);
    }

    public ReportSource getSource() {
        return source;
    }

    public String getPlanTable() {
        return planTable;
    }

    public String getStatementId() {
        return statementId;
    }

    /** Resolved plan id inside the plan table; {@code null} until resolved. */
    public Long getPlanId() {
        return planId;
    }

    public String getSqlId() {
        return sqlId;
    }

    public Integer getChildNumber() {
        return childNumber;
    }

    public Long getPlanHashValue() {
        return planHashValue;
    }

    public Long getDbid() {
        return dbid;
    }

    public String getFormat() {
        return format;
    }

    @Override
    public String toString() {
        switch (source) {
            case PLAN_TABLE:
                return "PLAN_TABLE[table=" + planTable + ", statementId=" + statementId
                        + ", planId=" + planId + ", format=" + format + "]";
            case CURSOR:
                return "CURSOR[sqlId=" + sqlId + ", child=" + childNumber + ", format=" + format + "]";
            default:
                return "AWR[sqlId=" + sqlId + ", planHashValue=" + planHashValue
                        + ", dbid=" + dbid + ", format=" + format + "]";
        }
    }
}
