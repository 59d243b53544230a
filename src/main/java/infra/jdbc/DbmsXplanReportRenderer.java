package infra.jdbc;

import domain.error.CatalogAccessException;
import domain.plan.PlanReportRenderer;
import domain.plan.PlanTarget;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * The unannotated report, straight from the {@code DBMS_XPLAN} pipelined functions.
 */
public final class DbmsXplanReportRenderer implements PlanReportRenderer {

    static final String SQL_DISPLAY =
            "SELECT plan_table_output FROM TABLE(DBMS_XPLAN.DISPLAY(?, ?, ?))";
    static final String SQL_DISPLAY_CURSOR =
            "SELECT plan_table_output FROM TABLE(DBMS_XPLAN.DISPLAY_CURSOR(?, ?, ?))";
    static final String SQL_DISPLAY_AWR =
            "SELECT plan_table_output FROM TABLE(DBMS_XPLAN.DISPLAY_AWR(?, ?, ?, ?))";

    private final ConnectionProvider connections;

    public DbmsXplanReportRenderer(ConnectionProvider connections) {
        this.connections = connections;
    }

    @Override
    public List<String> render(PlanTarget target, String groupKey) {
        try {
            Connection c = connections.get();
            switch (target.getSource()) {
                case PLAN_TABLE:
                    try (PreparedStatement ps = c.prepareStatement(SQL_DISPLAY)) {
                        ps.setString(1, target.getPlanTable());
                        setNullableString(ps, 2, target.getStatementId());
                        ps.setString(3, target.getFormat());
                        return read(ps);
                    }
                case CURSOR:
                    try (PreparedStatement ps = c.prepareStatement(SQL_DISPLAY_CURSOR)) {
                        ps.setString(1, target.getSqlId());
                        ps.setInt(2, target.getChildNumber() == null ? 0 : target.getChildNumber());
                        ps.setString(3, target.getFormat());
                        return read(ps);
                    }
                default:
                    try (PreparedStatement ps = c.prepareStatement(SQL_DISPLAY_AWR)) {
                        ps.setString(1, target.getSqlId());
                        Long phv = planHashValue(target, groupKey);
                        if (phv == null) {
                            ps.setNull(2, Types.NUMERIC);
                        } else {
                            ps.setLong(2, phv);
                        }
                        if (target.getDbid() == null) {
                            ps.setNull(3, Types.NUMERIC);
                        } else {
                            ps.setLong(3, target.getDbid());
                        }
                        ps.setString(4, target.getFormat());
                        return read(ps);
                    }
            }
        } catch (SQLException e) {
            throw new CatalogAccessException("Failed to render " + target
                    + (groupKey == null ? "" : " plan " + groupKey) + ": " + e.getMessage(), e);
        }
    }

    private static Long planHashValue(PlanTarget target, String groupKey) {
        if (groupKey == null) return target.getPlanHashValue();
        try {
            return Long.valueOf(groupKey.trim());
        } catch (NumberFormatException e) {
            throw new CatalogAccessException("plan hash value is not numeric: " + groupKey, e);
        }
    }

    private static void setNullableString(PreparedStatement ps, int idx, String v) throws SQLException {
        if (v == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, v);
        }
    }

    private static List<String> read(PreparedStatement ps) throws SQLException {
        List<String> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String line = rs.getString(1);
                out.add(line == null ? "" : line);
            }
        }
        return out;
    }
}
