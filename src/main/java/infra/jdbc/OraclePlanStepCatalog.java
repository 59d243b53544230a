package infra.jdbc;

import domain.error.CatalogAccessException;
import domain.plan.PlanStep;
import domain.plan.PlanStepCatalog;
import domain.plan.PlanTarget;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Plan rows from the Oracle dictionary: {@code PLAN_TABLE}, {@code GV$SQL_PLAN} or
 * {@code DBA_HIST_SQL_PLAN} (grouped by plan hash value).
 *
 * <p>Expects a target resolved by {@link OraclePlanTargetResolver}.</p>
 */
public final class OraclePlanStepCatalog implements PlanStepCatalog {

    static final String SQL_PLAN_TABLE =
            "SELECT id, parent_id, object_owner, object_name"
                    + " FROM %s"
                    + " WHERE plan_id = ?"
                    + " ORDER BY id";

    static final String SQL_CURSOR =
            "SELECT id, parent_id, object_owner, object_name"
                    + " FROM gv$sql_plan"
                    + " WHERE inst_id = SYS_CONTEXT('USERENV', 'INSTANCE')"
                    + " AND sql_id = ?"
                    + " AND child_number = ?"
                    + " ORDER BY id";

    static final String SQL_AWR =
            "SELECT id, parent_id, object_owner, object_name, plan_hash_value"
                    + " FROM dba_hist_sql_plan"
                    + " WHERE sql_id = ?"
                    + " AND plan_hash_value = NVL(?, plan_hash_value)"
                    + " AND dbid = ?"
                    + " ORDER BY plan_hash_value, id";

    private final ConnectionProvider connections;

    public OraclePlanStepCatalog(ConnectionProvider connections) {
        this.connections = connections;
    }

    @Override
    public List<PlanStep> fetch(PlanTarget target) {
        try {
            switch (target.getSource()) {
                case PLAN_TABLE:
                    return fetchPlanTable(target);
                case CURSOR:
                    return fetchCursor(target);
                case AWR:
                    return fetchAwr(target);
                default:
                    return Collections.emptyList();
            }
        } catch (SQLException e) {
            throw new CatalogAccessException("Failed to read plan rows for " + target + ": " + e.getMessage(), e);
        }
    }

    private List<PlanStep> fetchPlanTable(PlanTarget target) throws SQLException {
        Long planId = target.getPlanId();
        if (planId == null || planId == OraclePlanTargetResolver.NO_PLAN) return Collections.emptyList();

        String sql = String.format(SQL_PLAN_TABLE, OracleIdentifiers.requireTableName(target.getPlanTable()));
        Connection c = connections.get();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, planId);
            return read(ps, false);
        }
    }

    private List<PlanStep> fetchCursor(PlanTarget target) throws SQLException {
        Connection c = connections.get();
        try (PreparedStatement ps = c.prepareStatement(SQL_CURSOR)) {
            ps.setString(1, target.getSqlId());
            ps.setInt(2, target.getChildNumber() == null ? 0 : target.getChildNumber());
            return read(ps, false);
        }
    }

    private List<PlanStep> fetchAwr(PlanTarget target) throws SQLException {
        Connection c = connections.get();
        try (PreparedStatement ps = c.prepareStatement(SQL_AWR)) {
            ps.setString(1, target.getSqlId());
            if (target.getPlanHashValue() == null) {
                ps.setNull(2, Types.NUMERIC);
            } else {
                ps.setLong(2, target.getPlanHashValue());
            }
            if (target.getDbid() == null) {
                ps.setNull(3, Types.NUMERIC);
            } else {
                ps.setLong(3, target.getDbid());
            }
            return read(ps, true);
        }
    }

    private static List<PlanStep> read(PreparedStatement ps, boolean grouped) throws SQLException {
        List<PlanStep> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                int id = rs.getInt(1);
                int pid = rs.getInt(2);
                Integer parentId = rs.wasNull() ? null : pid;
                String owner = rs.getString(3);
                String name = rs.getString(4);
                String group = grouped ? rs.getString(5) : null;
                out.add(new PlanStep(id, parentId, owner, name, group));
            }
        }
        return out;
    }
}
