package domain.plan;

/**
 * Where plan rows and the rendered report come from.
 * <ul>
 *   <li>{@link #PLAN_TABLE}: an explained statement in a plan table ({@code DBMS_XPLAN.DISPLAY})</li>
 *   <li>{@link #CURSOR}: a cursor in the shared pool ({@code DBMS_XPLAN.DISPLAY_CURSOR})</li>
 *   <li>{@link #AWR}: plan history, one plan per plan hash value ({@code DBMS_XPLAN.DISPLAY_AWR})</li>
 * </ul>
 */
public enum ReportSource {
    PLAN_TABLE,
    CURSOR,
    AWR
}
