package domain.output;

import java.util.List;

/** Where the annotated report goes. */
public interface ReportWriter {
    void write(List<String> lines);
}
