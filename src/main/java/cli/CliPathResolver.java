package cli;

import java.nio.file.Files;

import java.nio.file.Path;

import java.nio.file.Paths;

import java.util.Map;

/** CLI path resolver (baseDir and offline inputs). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "xplan.baseDir";

    public static Path resolveBaseDir(Map<String, String> argv) {
        String bd = (argv == null) ? null : trimToNull(argv.get("baseDir"));
        if (bd == null) bd = trimToNull(System.getProperty(PROP_BASE_DIR));
        if (bd != null) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }

    public static Path resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return null;
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute()) {
            if (baseDir != null) p = baseDir.resolve(p);
            else p = resolveAgainstUserDir(input.trim());
        }
        return p.toAbsolutePath().normalize();
    }

    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    public static boolean fileExists(Path p) {
        return p != null && Files.isRegularFile(p);
    }

    public static boolean isXlsx(Path p) {
        if (p == null || p.getFileName() == null) return false;
        return p.getFileName().toString().toLowerCase().endsWith(".xlsx");
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
