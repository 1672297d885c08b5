package domain.convert;

/**
 * Outcome of {@link StructuralValidator}: OK, or an error with a short description.
 */
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(null);

    private final String error;

    private ValidationResult(String error) {
        this.error = error;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult error(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description is blank");
        }
        return new ValidationResult(description);
    }

    public boolean isOk() {
        return error == null;
    }

    /** null when OK. */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "OK" : "ERROR(" + error + ")";
    }
}
