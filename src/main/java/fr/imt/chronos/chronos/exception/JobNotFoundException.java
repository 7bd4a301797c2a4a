package fr.imt.chronos.chronos.exception;

/**
 * Exception thrown when a requested job is not found.
 */
public class JobNotFoundException extends ChronosException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public JobNotFoundException(String jobId) {
        super(ERROR_CODE, "Job not found: " + jobId);
    }
}
