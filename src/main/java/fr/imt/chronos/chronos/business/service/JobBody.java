package fr.imt.chronos.chronos.business.service;

import fr.imt.chronos.chronos.business.model.JobInvocation;

/**
 * The unit of work a job runs on each firing.
 */
@FunctionalInterface
public interface JobBody {

    /**
     * @return output recorded on a successful execution, {@code null} is recorded as an empty output
     * @throws Exception any failure, recorded as a failed execution. Errors are recorded the same way
     */
    String execute(JobInvocation invocation) throws Exception;

}
