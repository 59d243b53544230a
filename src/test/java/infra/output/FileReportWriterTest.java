package infra.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_create_parent_directories_and_write_lines() throws Exception {
        Path target = tempDir.resolve("a").resolve("b").resolve("plan.txt");

        new FileReportWriter(target).write(Arrays.asList("line 1", null, "line 3"));

        assertTrue(Files.exists(target), "expected file not found: " + target);
        assertEquals(List.of("line 1", "", "line 3"), Files.readAllLines(target, StandardCharsets.UTF_8));
    }

    @Test
    void should_print_one_line_per_entry() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new StdoutReportWriter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).write(List.of("a", "b"));

        assertEquals("a" + System.lineSeparator() + "b" + System.lineSeparator(),
                buffer.toString(StandardCharsets.UTF_8));
    }
}
