package cli;

import domain.error.ParameterException;
import domain.model.FooterMode;
import domain.model.MismatchSeverity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CLI argument parsing helpers.
 *
 * <p>Named options are {@code --key=value} or {@code --key value}; presence flags never take the
 * next token. Everything else is positional, in the order of the original SQL*Plus scripts
 * ({@code [1] [2] [3]}).</p>
 */
public final class CliArgParser {

    /** Options that are switched on by their presence alone. */
    public static final Set<String> PRESENCE_FLAGS = Set.of("licensed", "qualifyNames", "help");

    private CliArgParser() {
    }

    /**
     * Strict boolean: true/yes/y/1 or false/no/n/0, case-insensitive; {@code def} when blank.
     */
    public static boolean requireBoolean(String raw, String label, boolean def) {
        if (raw == null || raw.isBlank()) return def;
        switch (raw.trim().toLowerCase()) {
            case "true":
            case "yes":
            case "y":
            case "1":
                return true;
            case "false":
            case "no":
            case "n":
            case "0":
                return false;
            default:
                throw new ParameterException(label + " must be true or false: '" + raw + "'");
        }
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--licensed       => true</li>
     *   <li>--licensed=true  => true</li>
     *   <li>--licensed=false => false</li>
     *   <li>--licensed=maybe => {@link ParameterException}</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        return requireBoolean(argv.get(key), "--" + key, true);
    }

    /** Strict variant for values that must be numbers; {@code null} when absent. */
    public static Long requireLong(String raw, String label) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim();
        if (!v.matches("[0-9]{1,18}")) {
            throw new ParameterException(label + " must be a non-negative integer: '" + raw + "'");
        }
        return Long.parseLong(v);
    }

    public static Integer requireInt(String raw, String label) {
        Long v = requireLong(raw, label);
        if (v == null) return null;
        if (v > Integer.MAX_VALUE) throw new ParameterException(label + " is too large: " + raw);
        return v.intValue();
    }

    /**
     * --onMismatch parsing.
     * <ul>
     *   <li>ignore / silent / none</li>
     *   <li>warn / warning (default)</li>
     *   <li>fail / error / strict</li>
     * </ul>
     */
    public static MismatchSeverity parseSeverity(String raw) {
        if (raw == null || raw.isBlank()) return MismatchSeverity.WARN;
        MismatchSeverity s = MismatchSeverity.parse(raw);
        if (s == null) throw new ParameterException("--onMismatch must be ignore, warn or fail: '" + raw + "'");
        return s;
    }

    /** --footer parsing: report (default) / block. */
    public static FooterMode parseFooterMode(String raw) {
        if (raw == null || raw.isBlank()) return FooterMode.REPORT;
        FooterMode m = FooterMode.parse(raw);
        if (m == null) throw new ParameterException("--footer must be report or block: '" + raw + "'");
        return m;
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        parse(args, m, null);
        return m;
    }

    /** Tokens that are neither options nor option values. */
    public static List<String> positional(String[] args) {
        List<String> p = new ArrayList<>();
        parse(args, new HashMap<>(), p);
        return Collections.unmodifiableList(p);
    }

    private static void parse(String[] args, Map<String, String> named, List<String> positional) {
        if (args == null) return;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) {
                if (positional != null) positional.add(a);
                continue;
            }

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (!PRESENCE_FLAGS.contains(k)
                        && i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) named.put(k, v);
        }
    }
}
