package cli;

import domain.error.ParameterException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class XplanSettingsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty("xplan.footer");
    }

    @Test
    void should_prefer_argument_over_system_property_over_file() {
        Properties defaults = new Properties();
        defaults.setProperty("xplan.footer", "report");
        defaults.setProperty("xplan.format", "TYPICAL");

        XplanSettings none = new XplanSettings(Map.of(), defaults);
        assertEquals("report", none.get(XplanSettings.FOOTER));

        System.setProperty("xplan.footer", "block");
        assertEquals("block", none.get(XplanSettings.FOOTER));

        XplanSettings arg = new XplanSettings(Map.of("footer", "report"), defaults);
        assertEquals("report", arg.get(XplanSettings.FOOTER));
        assertEquals("TYPICAL", arg.get(XplanSettings.FORMAT));
    }

    @Test
    void should_map_command_line_alias() {
        XplanSettings s = new XplanSettings(Map.of("url", "jdbc:oracle:thin:@//db:1521/PDB"), new Properties());
        assertEquals("jdbc:oracle:thin:@//db:1521/PDB", s.get(XplanSettings.JDBC_URL, "url"));
        assertNull(s.get(XplanSettings.JDBC_USER, "user"));
    }

    @Test
    void should_treat_bare_flag_as_true() {
        XplanSettings s = new XplanSettings(Map.of("qualifyNames", ""), new Properties());
        assertTrue(s.getBoolean(XplanSettings.QUALIFY_NAMES, false));
        assertFalse(new XplanSettings(Map.of(), new Properties()).getBoolean(XplanSettings.QUALIFY_NAMES, false));
    }

    @Test
    void should_reject_unreadable_boolean_from_any_source() {
        Properties defaults = new Properties();
        defaults.setProperty("xplan.qualifyNames", "sometimes");
        XplanSettings fromFile = new XplanSettings(Map.of(), defaults);
        ParameterException e = assertThrows(ParameterException.class,
                () -> fromFile.getBoolean(XplanSettings.QUALIFY_NAMES, false));
        assertTrue(e.getMessage().contains("xplan.qualifyNames"), e.getMessage());

        XplanSettings fromArg = new XplanSettings(Map.of("qualifyNames", "No"), defaults);
        assertFalse(fromArg.getBoolean(XplanSettings.QUALIFY_NAMES, true));
    }

    @Test
    void should_load_bundled_defaults() {
        assertEquals("warn", XplanSettings.load(Map.of()).get(XplanSettings.ON_MISMATCH));
    }
}
