package domain.model;

/**
 * A single per-file outcome row for reporting.
 *
 * <p>Kept as a simple value object so CLI and report writers can share it.</p>
 */
public final class FileConversionResult {

    public static final String SUCCESS = "SUCCESS";
    public static final String SKIP = "SKIP";

    /**
     * SUCCESS / SKIP
     */
    private final String status;
    private final String inputFile;
    private final String outputFile;

    /**
     * null for SKIP rows.
     */
    private final ConversionMetrics metrics;

    /**
     * optional reason message for SKIP
     */
    private final String message;

    /**
     * exception class and the like; may be null
     */
    private final String detail;

    public FileConversionResult(
            String status,
            String inputFile,
            String outputFile,
            ConversionMetrics metrics,
            String message,
            String detail
    ) {
        this.status = nullToEmpty(status);
        this.inputFile = nullToEmpty(inputFile);
        this.outputFile = nullToEmpty(outputFile);
        this.metrics = metrics;
        this.message = nullToEmpty(message);
        this.detail = nullToNullIfBlank(detail);
    }

    public static FileConversionResult success(String inputFile, String outputFile, ConversionMetrics metrics) {
        return new FileConversionResult(SUCCESS, inputFile, outputFile, metrics, "", null);
    }

    public static FileConversionResult skip(String inputFile, String message, String detail) {
        return new FileConversionResult(SKIP, inputFile, "", null, message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String nullToNullIfBlank(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public String getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public String getInputFile() {
        return inputFile;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public ConversionMetrics getMetrics() {
        return metrics;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
