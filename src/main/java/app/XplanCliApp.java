package app;

import cli.CliArgParser;
import cli.PlanTargetArgs;
import cli.XplanSettings;
import domain.annotate.AnnotatedReport;
import domain.annotate.AnnotationOptions;
import domain.annotate.PlanGroupRouter;
import domain.error.ParameterException;
import domain.error.XplanException;
import domain.model.AnnotationWarning;
import domain.model.AnnotationWarningSink;
import domain.model.FooterMode;
import domain.model.MismatchSeverity;
import domain.model.WarningCode;
import domain.order.ExecutionOrderBuilder;
import domain.plan.PlanTarget;
import domain.plan.ReportSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by the {@code Xplan*Cli} facades). Returns the process exit code. */
public final class XplanCliApp {

    private static final Logger log = LoggerFactory.getLogger(XplanCliApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_UNEXPECTED = 1;

    static final String LICENCE_NOTICE =
            "DBMS_XPLAN.DISPLAY_AWR reads the Automatic Workload Repository, which is part of the"
                    + " Oracle Diagnostics Pack. Re-run with --licensed to confirm the database is licensed for it.";

    private XplanCliApp() {
    }

    public static int run(ReportSource source, String[] args, PrintStream stdout) {
        return run(source, args, stdout, new XplanComponentsFactory());
    }

    static int run(ReportSource source, String[] args, PrintStream stdout, XplanComponentsFactory factory) {
        long t0 = System.nanoTime();
        try {
            Map<String, String> argv = CliArgParser.parseArgs(args);
            if (CliArgParser.flag(argv, "help")) {
                stdout.println(usage(source));
                stdout.flush();
                return EXIT_OK;
            }

            // ------------------------------------------------------------
            // parameters: everything is validated before any catalog access
            // ------------------------------------------------------------
            XplanSettings settings = XplanSettings.load(argv);
            PlanTarget target = PlanTargetArgs.parse(source, argv, CliArgParser.positional(args),
                    settings.get(XplanSettings.FORMAT));

            if (source == ReportSource.AWR && !CliArgParser.flag(argv, "licensed")) {
                log.error("[LICENCE] {}", LICENCE_NOTICE);
                throw new ParameterException("--licensed is required for AWR reports");
            }

            AnnotationOptions options = options(source, settings);

            log.info("==================================================");
            log.info("[START] xplan annotation ({})", source);
            log.info("[CONF] target       = {}", target);
            log.info("[CONF] options      = {}", options);

            try (XplanComponents components = factory.create(argv, settings, stdout)) {
                log.info("[CONF] source       = {}", components.description());
                log.info("==================================================");

                log.info("[STEP1] resolve target");
                PlanTarget resolved = components.resolver().resolve(target);
                log.debug("resolved target = {}", resolved);

                log.info("[STEP2] build execution order and annotate");
                PlanGroupRouter router = new PlanGroupRouter(
                        components.catalog(), components.renderer(), new ExecutionOrderBuilder(), options);
                AnnotatedReport report = router.annotate(resolved, loggingSink());

                log.info("[STEP3] write report ({} lines)", report.getLines().size());
                components.writer().write(report.getLines());

                long ms = (System.nanoTime() - t0) / 1_000_000L;
                log.info("[STAT] groups={}, annotatedRows={}, warnings={}",
                        report.getGroupCount(), report.getAnnotatedRows(), report.getWarnings().size());
                logWarningSummary(report.getWarnings());
                log.info("[DONE] elapsed={}ms", ms);
            }
            return EXIT_OK;
        } catch (XplanException e) {
            log.error("[ERROR] {} (exit {})", e.getMessage(), e.exitCode());
            log.debug("stack", e);
            return e.exitCode();
        } catch (Exception e) {
            log.error("[ERROR] unexpected failure: {}", e.toString(), e);
            return EXIT_UNEXPECTED;
        }
    }

    static AnnotationOptions options(ReportSource source, XplanSettings settings) {
        MismatchSeverity severity = CliArgParser.parseSeverity(settings.get(XplanSettings.ON_MISMATCH));
        FooterMode footer = CliArgParser.parseFooterMode(settings.get(XplanSettings.FOOTER));
        // only the cursor report carries owner-less names worth qualifying by default
        boolean qualify = settings.getBoolean(XplanSettings.QUALIFY_NAMES, source == ReportSource.CURSOR);
        Long slow = CliArgParser.requireLong(settings.get(XplanSettings.SLOW_MS), "--slowMs");
        long slowMs = slow == null ? AnnotationOptions.DEFAULT_SLOW_MS : slow;

        return AnnotationOptions.defaults()
                .withQualifyNames(qualify)
                .withMismatchSeverity(severity)
                .withFooterMode(footer)
                .withSlowMs(slowMs);
    }

    private static AnnotationWarningSink loggingSink() {
        return w -> log.warn("[WARN] {}", w);
    }

    private static void logWarningSummary(List<AnnotationWarning> warnings) {
        if (warnings.isEmpty()) return;
        Map<WarningCode, Integer> byCode = new EnumMap<>(WarningCode.class);
        for (AnnotationWarning w : warnings) {
            byCode.merge(w.getCode(), 1, Integer::sum);
        }
        for (Map.Entry<WarningCode, Integer> e : byCode.entrySet()) {
            log.info("[STAT] warning {} = {}", e.getKey(), e.getValue());
        }
    }

    static String usage(ReportSource source) {
        String common = "\n  common: --url <jdbc-url> --user <u> --password <p>"
                + " | --catalog <rows.csv|rows.xlsx> --report <report.txt>"
                + "\n          [--out <file>] [--qualifyNames[=false]] [--footer=report|block]"
                + " [--onMismatch=ignore|warn|fail]";
        switch (source) {
            case PLAN_TABLE:
                return "usage: xplan display [plan_table] [statement_id] [format]"
                        + "\n  --table <name> --statementId <id> --format <fmt>" + common;
            case CURSOR:
                return "usage: xplan cursor [sql_id] [child_number] [format]"
                        + "\n  --sqlId <sql_id> --child <n> --format <fmt>" + common;
            case AWR:
                return "usage: xplan awr <sql_id> [plan_hash_value] [format] --licensed"
                        + "\n  --sqlId <sql_id> --planHashValue <phv> --dbid <dbid> --format <fmt>" + common;
            default:
                return "usage: xplan <display|cursor|awr> ...";
        }
    }
}
