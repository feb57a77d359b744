package domain.format;

/**
 * Per-call cursor and layout state for {@link SqlFormatter}.
 *
 * <p>Created for one format call and dropped when it returns.</p>
 */
final class ReflowState {

    final String s;
    int pos = 0;

    int indentLevel = 0;
    boolean atLineStart = true;

    boolean inString = false;
    char stringDelimiter = 0;

    final StringBuilder token = new StringBuilder(32);
    final StringBuilder out;

    ReflowState(String s) {
        this.s = (s == null) ? "" : s;
        this.out = new StringBuilder(this.s.length() * 2);
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    void enterString(char delimiter) {
        inString = true;
        stringDelimiter = delimiter;
    }

    void openParen() {
        indentLevel++;
    }

    // unmatched ')' never drives the level below zero
    void closeParen() {
        indentLevel = Math.max(0, indentLevel - 1);
    }

    void endStatement() {
        indentLevel = 0;
        atLineStart = true;
    }

    /** Removes trailing whitespace (including newlines) from the output. */
    String finish() {
        int end = out.length();
        while (end > 0 && SqlFormatter.isSpace(out.charAt(end - 1))) end--;
        out.setLength(end);
        return out.toString();
    }
}
