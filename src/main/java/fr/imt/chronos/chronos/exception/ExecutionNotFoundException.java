package fr.imt.chronos.chronos.exception;

/**
 * Exception thrown when a requested job execution is not found.
 */
public class ExecutionNotFoundException extends ChronosException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public ExecutionNotFoundException(String executionId) {
        super(ERROR_CODE, "Job execution not found: " + executionId);
    }
}
