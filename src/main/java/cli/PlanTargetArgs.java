package cli;

import domain.error.ParameterException;
import domain.plan.PlanTarget;
import domain.plan.ReportSource;
import infra.jdbc.OracleIdentifiers;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds and validates the {@link PlanTarget} of a command before anything is read.
 *
 * <pre>
 * display [plan_table]  [statement_id]    [format]   --table --statementId --format
 * cursor  [sql_id]      [child_number]    [format]   --sqlId --child       --format
 * awr     &lt;sql_id&gt;      [plan_hash_value] [format]   --sqlId --planHashValue --dbid --format
 * </pre>
 * Named options win over positional ones.
 */
public final class PlanTargetArgs {

    private static final Pattern SQL_ID = Pattern.compile("[0-9a-z]{13}");
    private static final Pattern FORMAT = Pattern.compile("[A-Za-z0-9 +\\-_,()]{0,200}");
    private static final int MAX_STATEMENT_ID = 30;

    private PlanTargetArgs() {
    }

    public static PlanTarget parse(ReportSource source, Map<String, String> argv, List<String> positional,
                                   String defaultFormat) {
        String format = format(firstNonBlank(argv.get("format"), pos(positional, 2), defaultFormat));

        switch (source) {
            case PLAN_TABLE: {
                String table = firstNonBlank(argv.get("table"), pos(positional, 0));
                if (table != null && !OracleIdentifiers.isTableName(table)) {
                    throw new ParameterException("--table is not a plain [schema.]table name: '" + table + "'");
                }
                String statementId = firstNonBlank(argv.get("statementId"), pos(positional, 1));
                if (statementId != null && statementId.length() > MAX_STATEMENT_ID) {
                    throw new ParameterException("--statementId longer than " + MAX_STATEMENT_ID + " characters");
                }
                return PlanTarget.planTable(table, statementId, format);
            }
            case CURSOR: {
                String sqlId = sqlId(firstNonBlank(argv.get("sqlId"), pos(positional, 0)), false);
                Integer child = CliArgParser.requireInt(firstNonBlank(argv.get("child"), pos(positional, 1)), "--child");
                if (sqlId == null && child != null) {
                    throw new ParameterException("--child needs --sqlId");
                }
                return PlanTarget.cursor(sqlId, child, format);
            }
            case AWR: {
                String sqlId = sqlId(firstNonBlank(argv.get("sqlId"), pos(positional, 0)), true);
                Long phv = CliArgParser.requireLong(firstNonBlank(argv.get("planHashValue"), pos(positional, 1)), "--planHashValue");
                Long dbid = CliArgParser.requireLong(argv.get("dbid"), "--dbid");
                return PlanTarget.awr(sqlId, phv, dbid, format);
            }
            default:
                throw new ParameterException("unsupported report source: " + source);
        }
    }

    static String sqlId(String raw, boolean required) {
        if (raw == null) {
            if (required) throw new ParameterException("--sqlId is required");
            return null;
        }
        if (!SQL_ID.matcher(raw).matches()) {
            throw new ParameterException("--sqlId must be 13 lower-case letters/digits: '" + raw + "'");
        }
        return raw;
    }

    static String format(String raw) {
        if (raw == null) return PlanTarget.DEFAULT_FORMAT;
        if (!FORMAT.matcher(raw).matches()) {
            throw new ParameterException("--format contains unsupported characters: '" + raw + "'");
        }
        return raw.isBlank() ? PlanTarget.DEFAULT_FORMAT : raw.trim();
    }

    /** Positional value; {@code ""} (an explicit empty argument) counts as absent. */
    private static String pos(List<String> positional, int idx) {
        if (positional == null || idx >= positional.size()) return null;
        return CliPathResolver.trimToNull(positional.get(idx));
    }

    private static String firstNonBlank(String... values) {
        if (values == null) return null;
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }
}
