package domain.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeywordCaseNormalizerTest {

    private final KeywordCaseNormalizer normalizer = new KeywordCaseNormalizer();

    @Test
    void uppercase_keywords_keeps_layout() {
        String sql = "select a,b\n  from t\twhere x = 1";
        assertEquals("SELECT a,b\n  FROM t\tWHERE x = 1", normalizer.uppercaseKeywords(sql));
    }

    @Test
    void literals_and_comments_are_copied_verbatim() {
        String sql = "select 'from' as \"where\" -- from here\nfrom t /* select */ where y = 'it''s from'";
        assertEquals("SELECT 'from' AS \"where\" -- from here\nFROM t /* select */ WHERE y = 'it''s from'",
                normalizer.uppercaseKeywords(sql));
    }

    @Test
    void lower_case_mode_and_identifiers_with_keyword_prefix() {
        assertEquals("select selected_col from t_from",
                normalizer.apply("SELECT selected_col FROM t_from", KeywordCase.LOWER));
    }

    @Test
    void unterminated_literal_or_comment_runs_to_end() {
        assertEquals("SELECT 'from where", normalizer.uppercaseKeywords("select 'from where"));
        assertEquals("SELECT /* from", normalizer.uppercaseKeywords("select /* from"));
        assertEquals("", normalizer.uppercaseKeywords(null));
    }
}
