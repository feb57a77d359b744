package domain.format;

/**
 * Lexical SQL re-flow formatter.
 *
 * <p>Re-emits SQL text with keyword casing, line breaks before block-start
 * keywords, comma placement and spacing around operators. It does not parse
 * the statement: one left-to-right pass, no backtracking, and any input
 * (unbalanced parentheses, unterminated strings, garbage) produces output.</p>
 *
 * <p>Layout rules:
 * <ul>
 *   <li>every flushed token is followed by exactly one space</li>
 *   <li>a block-start keyword (SELECT, FROM, WHERE, ...) starts a new line unless the cursor is at line start</li>
 *   <li>string literals ('...' or "...", doubled delimiter escapes) are copied verbatim</li>
 *   <li>parentheses only move the indent level used for later line breaks</li>
 *   <li>';' ends the statement with a blank line and resets the indent</li>
 * </ul>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class SqlFormatter {

    private final KeywordVocabulary vocabulary;

    public SqlFormatter() {
        this(KeywordVocabulary.standard());
    }

    public SqlFormatter(KeywordVocabulary vocabulary) {
        this.vocabulary = (vocabulary == null) ? KeywordVocabulary.standard() : vocabulary;
    }

    public KeywordVocabulary getVocabulary() {
        return vocabulary;
    }

    public String format(String sql) {
        return format(sql, FormatOptions.defaults());
    }

    public String format(String sql, FormatOptions options) {
        final FormatOptions opt = (options == null) ? FormatOptions.defaults() : options;
        final ReflowState st = new ReflowState(sql);

        while (st.hasNext()) {
            char c = st.read();

            if (!st.inString && (c == '\'' || c == '"')) {
                flushToken(st, opt);
                st.enterString(c);
                st.out.append(c);
                continue;
            }

            if (st.inString) {
                st.out.append(c);
                if (c == st.stringDelimiter) {
                    if (st.hasNext() && st.peek() == st.stringDelimiter) {
                        // doubled delimiter: literal quote, still inside the string
                        st.out.append(st.read());
                    } else {
                        st.inString = false;
                    }
                }
                continue;
            }

            if (c == '(') {
                flushToken(st, opt);
                st.out.append(c);
                st.openParen();
                continue;
            }

            if (c == ')') {
                flushToken(st, opt);
                st.closeParen();
                st.out.append(c);
                continue;
            }

            if (c == ',') {
                flushToken(st, opt);
                appendComma(st, opt);
                continue;
            }

            if (isSpace(c)) {
                if (st.token.length() > 0) flushToken(st, opt);
                continue;
            }

            if (isOperator(c)) {
                flushToken(st, opt);
                appendOperator(st, c);
                continue;
            }

            if (c == ';') {
                flushToken(st, opt);
                st.out.append(";\n\n");
                st.endStatement();
                continue;
            }

            st.token.append(c);
        }

        flushToken(st, opt);
        return st.finish();
    }

    private void flushToken(ReflowState st, FormatOptions opt) {
        if (st.token.length() == 0) return;

        String word = st.token.toString();
        String upper = KeywordCase.UPPER.apply(word);

        if (vocabulary.isKeyword(upper)) {
            if (vocabulary.isBlockStart(upper) && !st.atLineStart) {
                st.out.append('\n')
                        .append(opt.indent(st.indentLevel));
                st.atLineStart = true;
            }
            st.out.append(opt.getKeywordCase().apply(word));
        } else {
            st.out.append(word);
        }

        st.out.append(' ');
        st.token.setLength(0);
        // Always cleared, including right after the line break above.
        st.atLineStart = false;
    }

    private static void appendComma(ReflowState st, FormatOptions opt) {
        if (opt.isBreakBeforeComma()) {
            st.out.append('\n')
                    .append(opt.indent(st.indentLevel))
                    .append(", ");
        } else if (opt.isBreakAfterComma()) {
            st.out.append(",\n")
                    .append(opt.indent(st.indentLevel));
        } else {
            st.out.append(", ");
        }
        st.atLineStart = opt.isBreakAfterComma();
    }

    private static void appendOperator(ReflowState st, char c) {
        st.out.append(' ')
                .append(c);

        if (st.hasNext()) {
            char next = st.peek();
            // NOTE: the '!' case never matches; '!' is not an operator character here.
            if ((c == '<' && (next == '=' || next == '>'))
                    || (c == '>' && next == '=')
                    || (c == '!' && next == '=')) {
                st.out.append(st.read());
            }
        }

        st.out.append(' ');
    }

    private static boolean isOperator(char c) {
        return c == '=' || c == '<' || c == '>' || c == '+' || c == '-' || c == '*' || c == '/';
    }

    // ASCII whitespace only (C isspace set)
    static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\u000B' || c == '\f' || c == '\r';
    }
}
