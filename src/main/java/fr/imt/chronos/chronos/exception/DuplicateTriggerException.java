package fr.imt.chronos.chronos.exception;

/**
 * Exception thrown when a live trigger is already registered for a job id.
 */
public class DuplicateTriggerException extends ChronosException {

    private static final String ERROR_CODE = "DUPLICATE_TRIGGER";

    public DuplicateTriggerException(String jobId) {
        super(ERROR_CODE, "A live trigger is already registered for job: " + jobId);
    }
}
