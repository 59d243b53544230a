package infra.jdbc;

import domain.error.CatalogAccessException;
import domain.plan.PlanTarget;
import domain.plan.PlanTargetResolver;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Resolves target defaults against the dictionary.
 * <ul>
 *   <li>plan table: the latest plan (highest {@code plan_id}) for the statement id, any statement
 *       id when none was given</li>
 *   <li>cursor: the previous cursor of the session when no sql id was given; child 0 otherwise</li>
 *   <li>history: the current database id when none was given</li>
 * </ul>
 */
public final class OraclePlanTargetResolver implements PlanTargetResolver {

    static final long NO_PLAN = -1L;

    static final String SQL_LATEST_PLAN =
            "SELECT NVL(MAX(plan_id), -1) AS plan_id"
                    + ", MAX(statement_id) KEEP (DENSE_RANK FIRST ORDER BY plan_id DESC) AS statement_id"
                    + " FROM %s"
                    + " WHERE id = 0"
                    + " AND NVL(statement_id, '~') = COALESCE(?, statement_id, '~')";

    static final String SQL_PREVIOUS_CURSOR =
            "SELECT prev_sql_id, prev_child_number"
                    + " FROM gv$session"
                    + " WHERE inst_id = SYS_CONTEXT('USERENV', 'INSTANCE')"
                    + " AND sid = SYS_CONTEXT('USERENV', 'SID')"
                    + " AND username IS NOT NULL"
                    + " AND prev_hash_value <> 0";

    static final String SQL_DBID = "SELECT dbid FROM v$database";

    private final ConnectionProvider connections;

    public OraclePlanTargetResolver(ConnectionProvider connections) {
        this.connections = connections;
    }

    @Override
    public PlanTarget resolve(PlanTarget target) {
        try {
            switch (target.getSource()) {
                case PLAN_TABLE:
                    return resolveLatestPlan(target);
                case CURSOR:
                    return resolveCursor(target);
                case AWR:
                    return target.getDbid() != null ? target : target.withDbid(currentDbid());
                default:
                    return target;
            }
        } catch (SQLException e) {
            throw new CatalogAccessException("Failed to resolve " + target + ": " + e.getMessage(), e);
        }
    }

    private PlanTarget resolveLatestPlan(PlanTarget target) throws SQLException {
        String sql = String.format(SQL_LATEST_PLAN, OracleIdentifiers.requireTableName(target.getPlanTable()));
        Connection c = connections.get();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            if (target.getStatementId() == null) {
                ps.setNull(1, Types.VARCHAR);
            } else {
                ps.setString(1, target.getStatementId());
            }
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return target.withPlan(NO_PLAN, target.getStatementId());
                long planId = rs.getLong(1);
                String statementId = rs.getString(2);
                return target.withPlan(planId, statementId);
            }
        }
    }

    private PlanTarget resolveCursor(PlanTarget target) throws SQLException {
        if (target.getSqlId() != null) {
            return target.getChildNumber() != null ? target : target.withCursor(target.getSqlId(), 0);
        }
        Connection c = connections.get();
        try (PreparedStatement ps = c.prepareStatement(SQL_PREVIOUS_CURSOR);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next() || rs.getString(1) == null) {
                throw new CatalogAccessException("no previous cursor in this session; pass --sqlId");
            }
            return target.withCursor(rs.getString(1), rs.getInt(2));
        }
    }

    private long currentDbid() throws SQLException {
        Connection c = connections.get();
        try (PreparedStatement ps = c.prepareStatement(SQL_DBID);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) throw new CatalogAccessException("v$database returned no row");
            return rs.getLong(1);
        }
    }
}
