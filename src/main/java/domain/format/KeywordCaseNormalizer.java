package domain.format;

/**
 * Re-cases SQL keywords without touching layout.
 *
 * <p>Unlike {@link SqlFormatter} this keeps every other character where it is:
 * whitespace, punctuation, string literals, quoted identifiers and comments
 * ({@code -- ...}, {@code /* ... *}{@code /}) are copied verbatim.</p>
 */
public final class KeywordCaseNormalizer {

    private final KeywordVocabulary vocabulary;

    public KeywordCaseNormalizer() {
        this(KeywordVocabulary.standard());
    }

    public KeywordCaseNormalizer(KeywordVocabulary vocabulary) {
        this.vocabulary = (vocabulary == null) ? KeywordVocabulary.standard() : vocabulary;
    }

    public String uppercaseKeywords(String sql) {
        return apply(sql, KeywordCase.UPPER);
    }

    public String apply(String sql, KeywordCase keywordCase) {
        if (sql == null || sql.isEmpty()) return "";
        KeywordCase kc = (keywordCase == null) ? KeywordCase.UPPER : keywordCase;

        final String s = sql;
        final StringBuilder out = new StringBuilder(s.length());
        int i = 0;

        while (i < s.length()) {
            char c = s.charAt(i);

            if (c == '-' && i + 1 < s.length() && s.charAt(i + 1) == '-') {
                int end = s.indexOf('\n', i);
                end = (end < 0) ? s.length() : end;
                out.append(s, i, end);
                i = end;
                continue;
            }

            if (c == '/' && i + 1 < s.length() && s.charAt(i + 1) == '*') {
                int end = s.indexOf("*/", i + 2);
                end = (end < 0) ? s.length() : end + 2;
                out.append(s, i, end);
                i = end;
                continue;
            }

            if (c == '\'' || c == '"') {
                int end = skipQuoted(s, i, c);
                out.append(s, i, end);
                i = end;
                continue;
            }

            if (isWordChar(c)) {
                int start = i;
                while (i < s.length() && isWordChar(s.charAt(i))) i++;
                String word = s.substring(start, i);
                out.append(vocabulary.isKeyword(KeywordCase.UPPER.apply(word)) ? kc.apply(word) : word);
                continue;
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    // returns the index just past the closing delimiter, or the input length when unterminated
    private static int skipQuoted(String s, int open, char delimiter) {
        int i = open + 1;
        while (i < s.length()) {
            if (s.charAt(i) == delimiter) {
                if (i + 1 < s.length() && s.charAt(i + 1) == delimiter) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }
}
