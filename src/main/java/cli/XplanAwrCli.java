package cli;

import app.XplanCliApp;
import domain.plan.ReportSource;

/**
 * CLI entrypoint facade: annotated plan from the workload repository (DBA_HIST_SQL_PLAN), the counterpart of DBMS_XPLAN.DISPLAY_AWR.
 *
 * <p>The logic lives in {@link XplanCliApp}.</p>
 */
public class XplanAwrCli {

    public static void main(String[] args) {
        System.exit(XplanCliApp.run(ReportSource.AWR, args, System.out));
    }
}
