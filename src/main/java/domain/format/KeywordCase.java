package domain.format;

import java.util.Locale;

/**
 * How recognized keywords are re-cased on output.
 */
public enum KeywordCase {

    UPPER,
    LOWER,
    UNCHANGED;

    /**
     * Applies this casing to the original token text.
     * Only ASCII letters are touched; everything else is copied as-is.
     */
    String apply(String word) {
        switch (this) {
            case UPPER:
                return asciiUpper(word);
            case LOWER:
                return asciiLower(word);
            case UNCHANGED:
            default:
                return word;
        }
    }

    /**
     * Lenient parse (upper / lower / unchanged, also "keep" / "none" / "as-is").
     * Falls back to {@code def} when the value is blank or unknown.
     */
    public static KeywordCase parse(String raw, KeywordCase def) {
        if (raw == null || raw.isBlank()) return def;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_');

        if (v.equals("upper") || v.equals("uppercase") || v.equals("u")) return UPPER;
        if (v.equals("lower") || v.equals("lowercase") || v.equals("l")) return LOWER;
        if (v.equals("unchanged") || v.equals("keep") || v.equals("none") || v.equals("as_is")) return UNCHANGED;
        return def;
    }

    private static String asciiUpper(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'a' && c <= 'z') {
                if (sb == null) sb = new StringBuilder(s);
                sb.setCharAt(i, (char) (c - 32));
            }
        }
        return sb == null ? s : sb.toString();
    }

    private static String asciiLower(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                if (sb == null) sb = new StringBuilder(s);
                sb.setCharAt(i, (char) (c + 32));
            }
        }
        return sb == null ? s : sb.toString();
    }
}
