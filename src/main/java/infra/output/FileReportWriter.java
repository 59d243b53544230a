package infra.output;

import domain.output.ReportWriter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ReportWriter} that stores the report in a text file (UTF-8, platform line separator).
 * Missing parent directories are created.
 */
public final class FileReportWriter implements ReportWriter {

    private final Path target;

    public FileReportWriter(Path target) {
        if (target == null) throw new IllegalArgumentException("target is null");
        this.target = target;
    }

    @Override
    public void write(List<String> lines) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                if (lines == null) return;
                for (String line : lines) {
                    w.write(line == null ? "" : line);
                    w.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report: " + target, e);
        }
    }
}
