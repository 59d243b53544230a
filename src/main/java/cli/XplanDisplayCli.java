package cli;

import app.XplanCliApp;
import domain.plan.ReportSource;

/**
 * CLI entrypoint facade: annotated plan from the plan table (EXPLAIN PLAN output), the counterpart of DBMS_XPLAN.DISPLAY.
 *
 * <p>The logic lives in {@link XplanCliApp}.</p>
 */
public class XplanDisplayCli {

    public static void main(String[] args) {
        System.exit(XplanCliApp.run(ReportSource.PLAN_TABLE, args, System.out));
    }
}
