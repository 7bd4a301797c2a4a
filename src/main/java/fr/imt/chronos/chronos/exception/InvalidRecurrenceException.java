package fr.imt.chronos.chronos.exception;

/**
 * Exception thrown when a recurrence configuration value is out of bounds.
 * Raised before anything is persisted.
 */
public class InvalidRecurrenceException extends ChronosException {

    private static final String ERROR_CODE = "INVALID_RECURRENCE";

    private final String field;

    public InvalidRecurrenceException(String field, int value, int min, int max) {
        super(ERROR_CODE, field + " must be between " + min + " and " + max + " (was " + value + ")");
        this.field = field;
    }

    public InvalidRecurrenceException(String field, String message) {
        super(ERROR_CODE, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
