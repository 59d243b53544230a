package cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Effective configuration of one invocation.
 *
 * <p>Lookup order for key {@code k}: {@code --k} on the command line, then the system property
 * {@code xplan.k}, then {@code xplan.k} in {@code xplan.properties} on the class path.</p>
 */
public final class XplanSettings {

    public static final String RESOURCE = "xplan.properties";
    public static final String PREFIX = "xplan.";

    public static final String JDBC_URL = "jdbc.url";
    public static final String JDBC_USER = "jdbc.user";
    public static final String JDBC_PASSWORD = "jdbc.password";
    public static final String FORMAT = "format";
    public static final String FOOTER = "footer";
    public static final String ON_MISMATCH = "onMismatch";
    public static final String QUALIFY_NAMES = "qualifyNames";
    public static final String SLOW_MS = "slowMs";

    private final Map<String, String> argv;
    private final Properties defaults;

    XplanSettings(Map<String, String> argv, Properties defaults) {
        this.argv = argv == null ? Map.of() : argv;
        this.defaults = defaults == null ? new Properties() : defaults;
    }

    public static XplanSettings load(Map<String, String> argv) {
        return new XplanSettings(argv, loadDefaults());
    }

    static Properties loadDefaults() {
        Properties p = new Properties();
        try (InputStream is = XplanSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) p.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return p;
    }

    /**
     * @param key     setting key without prefix, e.g. {@code jdbc.url}
     * @param argName command-line alias, e.g. {@code url}; may be {@code null}
     */
    public String get(String key, String argName) {
        if (argName != null && argv.containsKey(argName)) return argv.get(argName);
        if (argv.containsKey(key)) return argv.get(key);

        String sys = System.getProperty(PREFIX + key);
        if (sys != null) return sys;

        return defaults.getProperty(PREFIX + key);
    }

    public String get(String key) {
        return get(key, null);
    }

    /** Boolean setting; a bare {@code --flag} counts as {@code true}, anything unreadable is rejected. */
    public boolean getBoolean(String key, boolean def) {
        if (argv.containsKey(key)) return CliArgParser.flag(argv, key);
        return CliArgParser.requireBoolean(get(key), PREFIX + key, def);
    }
}
