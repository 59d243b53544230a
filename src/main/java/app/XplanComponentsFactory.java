package app;

import cli.CliPathResolver;
import cli.XplanSettings;
import domain.error.ParameterException;
import domain.output.ReportWriter;
import domain.plan.PlanStepCatalog;
import domain.plan.PlanTargetResolver;
import infra.file.CsvPlanStepCatalog;
import infra.file.TextFilePlanReportRenderer;
import infra.file.XlsxPlanStepCatalog;
import infra.jdbc.DbmsXplanReportRenderer;
import infra.jdbc.JdbcSession;
import infra.jdbc.OraclePlanStepCatalog;
import infra.jdbc.OraclePlanTargetResolver;
import infra.output.FileReportWriter;
import infra.output.StdoutReportWriter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Object-assembly factory for {@link XplanCliApp}.
 * <p>
 * Goal: keep the CLI app focused on orchestration/logging and move object
 * creation ("new") and source selection here.
 * <ul>
 *   <li>{@code --catalog} + {@code --report}: offline files (CSV/XLSX rows, saved report text)</li>
 *   <li>otherwise {@code --url}: Oracle dictionary and {@code DBMS_XPLAN} over JDBC</li>
 * </ul>
 */
class XplanComponentsFactory {

    XplanComponents create(Map<String, String> argv, XplanSettings settings, PrintStream stdout) {
        Path baseDir = CliPathResolver.resolveBaseDir(argv);
        ReportWriter writer = createWriter(baseDir, argv.get("out"), stdout);

        String catalogArg = CliPathResolver.trimToNull(argv.get("catalog"));
        String reportArg = CliPathResolver.trimToNull(argv.get("report"));

        if (catalogArg != null || reportArg != null) {
            if (catalogArg == null || reportArg == null) {
                throw new ParameterException("--catalog and --report must be given together");
            }
            Path catalogPath = CliPathResolver.resolvePath(baseDir, catalogArg);
            Path reportPath = CliPathResolver.resolvePath(baseDir, reportArg);

            // missing files fall through to a classpath lookup inside the file collaborators
            String catalogLoc = CliPathResolver.fileExists(catalogPath) ? catalogPath.toString() : catalogArg;
            String reportLoc = CliPathResolver.fileExists(reportPath) ? reportPath.toString() : reportArg;

            PlanStepCatalog catalog = CliPathResolver.isXlsx(catalogPath)
                    ? new XlsxPlanStepCatalog(catalogLoc)
                    : new CsvPlanStepCatalog(catalogLoc);

            return new XplanComponents(
                    PlanTargetResolver.identity(),
                    catalog,
                    new TextFilePlanReportRenderer(reportLoc),
                    writer,
                    null,
                    "files catalog=" + catalogLoc + " report=" + reportLoc);
        }

        String url = CliPathResolver.trimToNull(settings.get(XplanSettings.JDBC_URL, "url"));
        if (url == null) {
            throw new ParameterException("no plan source: pass --url (or -Dxplan.jdbc.url) or --catalog with --report");
        }

        JdbcSession session = new JdbcSession(url,
                settings.get(XplanSettings.JDBC_USER, "user"),
                settings.get(XplanSettings.JDBC_PASSWORD, "password"));

        return new XplanComponents(
                new OraclePlanTargetResolver(session),
                new OraclePlanStepCatalog(session),
                new DbmsXplanReportRenderer(session),
                writer,
                session,
                "jdbc " + session.getUrl());
    }

    ReportWriter createWriter(Path baseDir, String outArg, PrintStream stdout) {
        String out = CliPathResolver.trimToNull(outArg);
        if (out == null || out.equals("-")) return new StdoutReportWriter(stdout);
        return new FileReportWriter(CliPathResolver.resolvePath(baseDir, out));
    }
}
