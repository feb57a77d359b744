package domain.format;

/**
 * Formatting options for {@link SqlFormatter}.
 *
 * <p>Immutable value object. Use {@link #defaults()} or {@link #builder()}.</p>
 */
public final class FormatOptions {

    public static final int DEFAULT_INDENT_SIZE = 4;
    public static final int DEFAULT_MAX_LINE_LENGTH = 120;

    /** Upper bound for {@code indentSize}; larger values are clamped. */
    public static final int MAX_INDENT_SIZE = 32;

    private static final FormatOptions DEFAULTS = builder().build();

    private final int indentSize;
    private final boolean useTab;
    private final KeywordCase keywordCase;
    private final boolean breakBeforeComma;
    private final boolean breakAfterComma;

    /**
     * Carried for configuration compatibility; the formatter does not wrap lines.
     */
    private final int maxLineLength;

    private FormatOptions(Builder b) {
        this.indentSize = Math.min(MAX_INDENT_SIZE, Math.max(0, b.indentSize));
        this.useTab = b.useTab;
        this.keywordCase = b.keywordCase == null ? KeywordCase.UPPER : b.keywordCase;
        this.breakBeforeComma = b.breakBeforeComma;
        this.breakAfterComma = b.breakAfterComma;
        this.maxLineLength = b.maxLineLength;
    }

    public static FormatOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .indentSize(indentSize)
                .useTab(useTab)
                .keywordCase(keywordCase)
                .breakBeforeComma(breakBeforeComma)
                .breakAfterComma(breakAfterComma)
                .maxLineLength(maxLineLength);
    }

    public int getIndentSize() {
        return indentSize;
    }

    public boolean isUseTab() {
        return useTab;
    }

    public KeywordCase getKeywordCase() {
        return keywordCase;
    }

    public boolean isBreakBeforeComma() {
        return breakBeforeComma;
    }

    public boolean isBreakAfterComma() {
        return breakAfterComma;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    /** Whitespace prefix for a new line at the given nesting level. */
    String indent(int level) {
        int n = Math.max(0, level);
        if (n == 0) return "";
        if (useTab) return "\t".repeat(n);
        return " ".repeat(n * indentSize);
    }

    @Override
    public String toString() {
        return "indentSize=" + indentSize
                + ", useTab=" + useTab
                + ", keywordCase=" + keywordCase
                + ", breakBeforeComma=" + breakBeforeComma
                + ", breakAfterComma=" + breakAfterComma
                + ", maxLineLength=" + maxLineLength;
    }

    public static final class Builder {

        private int indentSize = DEFAULT_INDENT_SIZE;
        private boolean useTab = false;
        private KeywordCase keywordCase = KeywordCase.UPPER;
        private boolean breakBeforeComma = false;
        private boolean breakAfterComma = true;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

        private Builder() {
        }

        public Builder indentSize(int indentSize) {
            this.indentSize = indentSize;
            return this;
        }

        public Builder useTab(boolean useTab) {
            this.useTab = useTab;
            return this;
        }

        public Builder keywordCase(KeywordCase keywordCase) {
            this.keywordCase = keywordCase;
            return this;
        }

        public Builder breakBeforeComma(boolean breakBeforeComma) {
            this.breakBeforeComma = breakBeforeComma;
            return this;
        }

        public Builder breakAfterComma(boolean breakAfterComma) {
            this.breakAfterComma = breakAfterComma;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public FormatOptions build() {
            return new FormatOptions(this);
        }
    }
}
