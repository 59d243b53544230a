package cli;

import app.XplanCliApp;
import domain.plan.ReportSource;

/**
 * CLI entrypoint facade: annotated plan from the cursor cache (GV$SQL_PLAN), the counterpart of DBMS_XPLAN.DISPLAY_CURSOR.
 *
 * <p>The logic lives in {@link XplanCliApp}.</p>
 */
public class XplanCursorCli {

    public static void main(String[] args) {
        System.exit(XplanCliApp.run(ReportSource.CURSOR, args, System.out));
    }
}
