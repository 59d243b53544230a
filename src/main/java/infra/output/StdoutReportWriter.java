package infra.output;

import domain.output.ReportWriter;

import java.io.PrintStream;
import java.util.List;

/**
 * {@link ReportWriter} for a console stream, one {@code println} per line.
 */
public final class StdoutReportWriter implements ReportWriter {

    private final PrintStream out;

    public StdoutReportWriter(PrintStream out) {
        this.out = (out == null) ? System.out : out;
    }

    @Override
    public void write(List<String> lines) {
        if (lines == null) return;
        for (String line : lines) {
            out.println(line == null ? "" : line);
        }
        out.flush();
    }
}
