package fr.imt.chronos.chronos.exception;

/**
 * Base exception class for all Chronos domain exceptions.
 * Carries an error code that is echoed back in API error responses.
 */
public class ChronosException extends RuntimeException {

    private final String errorCode;

    public ChronosException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ChronosException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
