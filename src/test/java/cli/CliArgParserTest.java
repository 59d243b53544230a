package cli;

import domain.error.ParameterException;
import domain.model.FooterMode;
import domain.model.MismatchSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void should_split_named_and_positional_arguments() {
        String[] args = {"7h35uxf5uhmm1", "--child", "1", "--qualifyNames", "ALLSTATS LAST", "--out=plan.txt"};

        Map<String, String> named = CliArgParser.parseArgs(args);
        List<String> positional = CliArgParser.positional(args);

        assertEquals("1", named.get("child"));
        assertEquals("", named.get("qualifyNames"));
        assertEquals("plan.txt", named.get("out"));
        assertEquals(List.of("7h35uxf5uhmm1", "ALLSTATS LAST"), positional);
    }

    @Test
    void should_read_presence_flags() {
        Map<String, String> named = CliArgParser.parseArgs(new String[]{"--licensed", "--qualifyNames=false"});
        assertTrue(CliArgParser.flag(named, "licensed"));
        assertFalse(CliArgParser.flag(named, "qualifyNames"));
        assertFalse(CliArgParser.flag(named, "help"));
    }

    @Test
    void should_reject_malformed_numbers() {
        assertEquals(Long.valueOf(3956160932L), CliArgParser.requireLong("3956160932", "--planHashValue"));
        assertNull(CliArgParser.requireLong(" ", "--planHashValue"));
        assertThrows(ParameterException.class, () -> CliArgParser.requireLong("-1", "--planHashValue"));
        assertThrows(ParameterException.class, () -> CliArgParser.requireLong("12ab", "--dbid"));
        assertThrows(ParameterException.class, () -> CliArgParser.requireInt("99999999999", "--child"));
    }

    @Test
    void should_default_and_validate_enums() {
        assertEquals(MismatchSeverity.WARN, CliArgParser.parseSeverity(null));
        assertEquals(MismatchSeverity.FAIL, CliArgParser.parseSeverity("fail"));
        assertThrows(ParameterException.class, () -> CliArgParser.parseSeverity("panic"));
        assertEquals(FooterMode.REPORT, CliArgParser.parseFooterMode(""));
        assertThrows(ParameterException.class, () -> CliArgParser.parseFooterMode("never"));
    }

    @Test
    void should_accept_only_known_boolean_spellings() {
        assertTrue(CliArgParser.requireBoolean(" Yes ", "--qualifyNames", false));
        assertFalse(CliArgParser.requireBoolean("0", "--qualifyNames", true));
        assertTrue(CliArgParser.requireBoolean(null, "--qualifyNames", true));

        ParameterException e = assertThrows(ParameterException.class,
                () -> CliArgParser.requireBoolean("maybe", "--qualifyNames", false));
        assertEquals("--qualifyNames must be true or false: 'maybe'", e.getMessage());

        Map<String, String> named = CliArgParser.parseArgs(new String[]{"--licensed=perhaps"});
        assertThrows(ParameterException.class, () -> CliArgParser.flag(named, "licensed"));
    }
}
