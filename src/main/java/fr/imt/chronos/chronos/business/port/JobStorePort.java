package fr.imt.chronos.chronos.business.port;

import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import fr.imt.chronos.chronos.infrastructure.persistence.Job;

import java.util.List;
import java.util.Optional;

public interface JobStorePort {
    Job insertJob(Job job);
    Optional<Job> findJob(String jobId);

    /**
     * Replaces an existing job. Never creates one.
     *
     * @return false if the job no longer exists
     */
    boolean updateJob(Job job);

    long deleteJob(String jobId);
    List<Job> listJobs();

    Execution insertExecution(Execution execution);

    /**
     * @param jobId optional filter, {@code null} for every job
     * @return executions sorted by start time, newest first
     */
    List<Execution> findExecutions(String jobId, int limit);

    Optional<Execution> findExecution(String executionId);
}
