package cli;

import domain.format.KeywordCase;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parse_args_supports_equals_and_separate_value_and_presence() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--in=a.sql", "--out", "b.sql", "--tab", "--case=lower", "stray"
        });

        assertEquals("a.sql", m.get("in"));
        assertEquals("b.sql", m.get("out"));
        assertEquals("", m.get("tab"));
        assertEquals("lower", m.get("case"));
        assertFalse(m.containsKey("stray"));
    }

    @Test
    void flag_is_presence_style() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--tab", "--breakAfterComma=false"});

        assertTrue(CliArgParser.flag(m, "tab"));
        assertFalse(CliArgParser.flag(m, "breakAfterComma"));
        assertFalse(CliArgParser.flag(m, "failFast"));
    }

    @Test
    void option_falls_back_to_system_property() {
        String key = CliArgParser.PROP_PREFIX + "indent";
        String before = System.getProperty(key);
        try {
            System.setProperty(key, "2");
            assertEquals("2", CliArgParser.option(Map.of(), "indent"));
            assertEquals("8", CliArgParser.option(Map.of("indent", "8"), "indent"));
        } finally {
            if (before == null) System.clearProperty(key);
            else System.setProperty(key, before);
        }
        assertNull(CliArgParser.option(Map.of(), "noSuchOption"));
    }

    @Test
    void flag_or_property_prefers_argument() {
        String key = CliArgParser.PROP_PREFIX + "tab";
        String before = System.getProperty(key);
        try {
            System.setProperty(key, "true");
            assertTrue(CliArgParser.flagOrProperty(Map.of(), "tab", false));
            assertFalse(CliArgParser.flagOrProperty(Map.of("tab", "false"), "tab", false));
        } finally {
            if (before == null) System.clearProperty(key);
            else System.setProperty(key, before);
        }
    }

    @Test
    void parse_helpers_use_defaults_on_bad_input() {
        assertEquals(4, CliArgParser.parseInt("x", 4));
        assertEquals(7, CliArgParser.parseInt(" 7 ", 4));
        assertTrue(CliArgParser.parseBoolean("YES", false));
        assertFalse(CliArgParser.parseBoolean("no", true));
        assertEquals(KeywordCase.UPPER, CliArgParser.parseKeywordCase(null));
        assertEquals(KeywordCase.LOWER, CliArgParser.parseKeywordCase("lower"));
    }

    @Test
    void parse_boolean_keeps_default_for_unrecognized_value() {
        assertTrue(CliArgParser.parseBoolean("treu", true));
        assertFalse(CliArgParser.parseBoolean("treu", false));
        assertFalse(CliArgParser.parseBoolean("0", true));
        assertTrue(CliArgParser.parseBoolean("1", false));

        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--breakAfterComma=treu"});
        assertTrue(CliArgParser.flagOrProperty(m, "breakAfterComma", true));
    }
}
