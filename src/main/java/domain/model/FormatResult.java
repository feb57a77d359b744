package domain.model;

/**
 * Outcome of formatting one input (file or stream) for reporting.
 *
 * <p>Simple value object, not tied to any report format.</p>
 */
public final class FormatResult {

    public static final String SUCCESS = "SUCCESS";
    public static final String FAIL = "FAIL";

    private final String status;
    private final String source;
    private final String target;
    private final int inputChars;
    private final int outputChars;
    private final long elapsedMs;

    /**
     * failure reason (exception class + message); empty on success
     */
    private final String message;

    public FormatResult(
            String status,
            String source,
            String target,
            int inputChars,
            int outputChars,
            long elapsedMs,
            String message
    ) {
        this.status = nullToEmpty(status);
        this.source = nullToEmpty(source);
        this.target = nullToEmpty(target);
        this.inputChars = Math.max(0, inputChars);
        this.outputChars = Math.max(0, outputChars);
        this.elapsedMs = Math.max(0L, elapsedMs);
        this.message = nullToEmpty(message);
    }

    public static FormatResult success(String source, String target, int inputChars, int outputChars, long elapsedMs) {
        return new FormatResult(SUCCESS, source, target, inputChars, outputChars, elapsedMs, "");
    }

    public static FormatResult fail(String source, String target, long elapsedMs, String message) {
        return new FormatResult(FAIL, source, target, 0, 0, elapsedMs, message);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public String getStatus() {
        return status;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public int getInputChars() {
        return inputChars;
    }

    public int getOutputChars() {
        return outputChars;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getMessage() {
        return message;
    }
}
