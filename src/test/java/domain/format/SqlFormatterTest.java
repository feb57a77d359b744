package domain.format;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SqlFormatterTest {

    private final SqlFormatter formatter = new SqlFormatter();

    @Test
    void format_breaks_line_before_block_start_keyword() {
        assertEquals("SELECT a \nFROM t", formatter.format("select a from t"));
    }

    @Test
    void format_comma_breaks_after_by_default_and_keeps_space_before_comma() {
        assertEquals("SELECT a ,\nb \nFROM t", formatter.format("select a,b from t"));
    }

    @Test
    void format_parenthesis_keeps_trailing_space_before_close() {
        assertEquals("SELECT (a )", formatter.format("select(a)"));
    }

    @Test
    void format_does_not_touch_keywords_inside_string_literal() {
        assertEquals("SELECT 'FROM here'\nFROM t", formatter.format("select 'FROM here' from t"));
    }

    @Test
    void format_is_stable_when_applied_to_its_own_output() {
        for (String sql : List.of("select a from t", "select a,b from t", "select(a)", "select 'FROM here' from t")) {
            String once = formatter.format(sql);
            assertEquals(once, formatter.format(once), sql);
        }
    }

    @Test
    void format_empty_or_blank_input_returns_empty_string() {
        assertEquals("", formatter.format(""));
        assertEquals("", formatter.format("   \n\t  "));
        assertEquals("", formatter.format(null));
    }

    @Test
    void format_keeps_doubled_quote_inside_string() {
        assertEquals("SELECT 'it''s'\nFROM t", formatter.format("select 'it''s' from t"));
        assertEquals("SELECT  * \nFROM users \nWHERE name  = 'John''s Name'",
                formatter.format("SELECT * FROM users WHERE name = 'John''s Name'"));
    }

    @Test
    void format_treats_double_quotes_as_string_delimiter() {
        assertEquals("SELECT \"from\"\nFROM t", formatter.format("select \"from\" from t"));
    }

    @Test
    void format_unterminated_string_consumes_rest_of_input() {
        assertEquals("SELECT 'abc from t", formatter.format("select 'abc from t"));
    }

    @Test
    void format_unbalanced_close_paren_does_not_go_below_zero_indent() {
        assertEquals("SELECT ((a ))))\nFROM t", formatter.format("select ((a)))) from t"));
        assertEquals("SELECT a )\nFROM (b", formatter.format("select a) from (b"));
    }

    @Test
    void format_indents_block_start_keywords_by_paren_depth() {
        assertEquals("SELECT  * \nFROM (\n    SELECT id \n    FROM t )",
                formatter.format("select * from (select id from t)"));
    }

    @Test
    void format_uses_indent_size_and_tabs() {
        FormatOptions two = FormatOptions.builder().indentSize(2).build();
        assertEquals("SELECT  * \nFROM (\n  SELECT id \n  FROM t )",
                formatter.format("select * from (select id from t)", two));

        FormatOptions tab = FormatOptions.builder().useTab(true).build();
        assertEquals("SELECT  * \nFROM (\n\tSELECT id \n\tFROM t )",
                formatter.format("select * from (select id from t)", tab));
    }

    @Test
    void format_with_huge_indent_size_stays_total() {
        FormatOptions huge = FormatOptions.builder().indentSize(1 << 30).build();
        String pad = " ".repeat(2 * FormatOptions.MAX_INDENT_SIZE);
        assertEquals("((SELECT a \n" + pad + "FROM t", formatter.format("((select a from t", huge));
        assertEquals("((a ,\n" + pad + "b", formatter.format("((a,b", FormatOptions.builder().indentSize(Integer.MAX_VALUE).build()));
    }

    @Test
    void format_indents_comma_breaks_inside_parens() {
        assertEquals("SELECT f (a ,\n    b )\nFROM t", formatter.format("select f(a,b) from t"));
    }

    @Test
    void format_applies_keyword_case() {
        FormatOptions lower = FormatOptions.builder().keywordCase(KeywordCase.LOWER).build();
        assertEquals("select Name \nfrom Users", formatter.format("SELECT Name FROM Users", lower));

        FormatOptions unchanged = FormatOptions.builder().keywordCase(KeywordCase.UNCHANGED).build();
        assertEquals("SeLeCt a \nFrOm t", formatter.format("SeLeCt a FrOm t", unchanged));

        assertEquals("SELECT MyCol \nFROM MyTable", formatter.format("Select MyCol from MyTable"));
    }

    @Test
    void format_lower_case_does_not_touch_string_contents() {
        FormatOptions lower = FormatOptions.builder().keywordCase(KeywordCase.LOWER).build();
        assertEquals("select 'SELECT'\nfrom t", formatter.format("SELECT 'SELECT' FROM t", lower));
    }

    @Test
    void format_break_before_comma_takes_priority() {
        FormatOptions before = FormatOptions.builder().breakBeforeComma(true).build();
        assertEquals("SELECT a \n, b \nFROM t", formatter.format("select a,b from t", before));
    }

    @Test
    void format_without_comma_breaks_keeps_single_line_list() {
        FormatOptions none = FormatOptions.builder().breakAfterComma(false).build();
        assertEquals("SELECT a , b \nFROM t", formatter.format("select a,b from t", none));
    }

    @Test
    void format_recognizes_compound_operators() {
        assertEquals("SELECT a  >= 1 \nFROM t \nWHERE b  <> 2 AND c  <= 3",
                formatter.format("select a>=1 from t where b<>2 and c<=3"));
    }

    @Test
    void format_does_not_treat_bang_as_operator() {
        assertEquals("SELECT a!  = b", formatter.format("select a!=b"));
    }

    @Test
    void format_splits_statements_and_resets_indent() {
        assertEquals("SELECT 1 ;\n\nSELECT 2 ;", formatter.format("select 1; select 2;"));
        assertEquals("SELECT (a ;\n\nSELECT b \nFROM t", formatter.format("select (a; select b from t"));
    }

    @Test
    void format_breaks_before_each_join_keyword() {
        assertEquals("SELECT a \nFROM t \nLEFT \nJOIN u ON t.id  = u.id",
                formatter.format("select a from t left join u on t.id=u.id"));
    }

    @Test
    void format_collapses_ascii_whitespace_only() {
        assertEquals("SELECT a \nFROM t", formatter.format("select\ta\nfrom\r\nt"));
        assertEquals("SELECT a b", formatter.format("select a b"));
    }

    @Test
    void format_passes_non_ascii_text_through() {
        assertEquals("SELECT 'ü日本'AS 名前 \nFROM t", formatter.format("select 'ü日本' as 名前 from t"));
    }

    @Test
    void format_with_custom_vocabulary() {
        SqlFormatter custom = new SqlFormatter(KeywordVocabulary.of(List.of("select", "foo")));
        assertEquals("SELECT a from t", custom.format("select a from t"));
        assertEquals("SELECT FOO", custom.format("select foo"));
    }

    @Test
    void format_never_fails_and_never_ends_with_whitespace() {
        String alphabet = "abcSELECTfromWHERE ,;()'\"=<>!+-*/\n\t_.0123";
        Random rnd = new Random(42);
        for (int n = 0; n < 500; n++) {
            int len = rnd.nextInt(80);
            StringBuilder sb = new StringBuilder(len);
            for (int i = 0; i < len; i++) sb.append(alphabet.charAt(rnd.nextInt(alphabet.length())));

            String out = formatter.format(sb.toString());
            assertNotNull(out);
            if (!out.isEmpty()) {
                assertFalse(Character.isWhitespace(out.charAt(out.length() - 1)), sb.toString());
            }
        }
    }

    @Test
    void format_is_safe_for_concurrent_calls() throws Exception {
        String sql = "select a, b, c from t join u on t.id = u.id where x in (1,2,3) order by a";
        String expected = formatter.format(sql);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                futures.add(pool.submit(() -> formatter.format(sql)));
            }
            for (Future<String> f : futures) {
                assertEquals(expected, f.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
