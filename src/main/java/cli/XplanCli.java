package cli;

import app.XplanCliApp;
import domain.plan.ReportSource;

import java.util.Arrays;
import java.util.Locale;

/**
 * Jar entrypoint: {@code xplan <display|cursor|awr> [args...]}.
 */
public class XplanCli {

    static final int EXIT_PARAMETER = 2;

    public static void main(String[] args) {
        System.exit(dispatch(args));
    }

    static int dispatch(String[] args) {
        ReportSource source = args == null || args.length == 0 ? null : command(args[0]);
        if (source == null) {
            System.err.println("usage: xplan <display|cursor|awr> [args...]  (--help for the options of a command)");
            return EXIT_PARAMETER;
        }
        return XplanCliApp.run(source, Arrays.copyOfRange(args, 1, args.length), System.out);
    }

    static ReportSource command(String raw) {
        if (raw == null) return null;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "display":
            case "plan":
                return ReportSource.PLAN_TABLE;
            case "cursor":
            case "display_cursor":
                return ReportSource.CURSOR;
            case "awr":
            case "display_awr":
                return ReportSource.AWR;
            default:
                return null;
        }
    }
}
