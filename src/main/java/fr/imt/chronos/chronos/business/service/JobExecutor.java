package fr.imt.chronos.chronos.business.service;

import fr.imt.chronos.chronos.business.model.ExecutionStatus;
import fr.imt.chronos.chronos.business.model.JobInvocation;
import fr.imt.chronos.chronos.business.port.ExecutionEventPublisherPort;
import fr.imt.chronos.chronos.business.port.JobStorePort;
import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import fr.imt.chronos.chronos.infrastructure.persistence.Job;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one firing of a job and records it. Every call yields exactly one execution
 * record. Only a {@link VirtualMachineError} raised by the body is thrown back, once
 * its failed execution is recorded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobExecutor {

    private final JobStorePort jobStore;
    private final JobBody jobBody;
    private final ExecutionEventPublisherPort executionEventPublisher;
    private final RetryTemplate storeRetryTemplate;
    private final Clock clock;

    public Execution run(String jobId, String jobName, Map<String, Object> payload) {
        return run(jobId, jobName, payload, null);
    }

    /**
     * @param nextRunAt next fire time of the job's trigger, stored with the run markers when not null
     */
    public Execution run(String jobId, String jobName, Map<String, Object> payload, Instant nextRunAt) {
        log.info("Executing job {} ({})", jobId, jobName);
        Instant startTime = clock.instant();

        String output = null;
        String errorMessage = null;
        ExecutionStatus status;
        VirtualMachineError fatal = null;
        try {
            String result = jobBody.execute(new JobInvocation(jobId, jobName, payload, startTime));
            output = result != null ? result : "";
            status = ExecutionStatus.SUCCESS;
        } catch (Throwable e) {
            log.warn("Job {} ({}) failed: {}", jobId, jobName, e.getMessage(), e);
            errorMessage = describe(e);
            status = ExecutionStatus.FAILED;
            if (e instanceof VirtualMachineError) {
                fatal = (VirtualMachineError) e;
            }
        }

        Instant endTime = clock.instant();
        Execution execution = Execution.builder()
                .id(UUID.randomUUID().toString())
                .jobId(jobId)
                .jobName(jobName)
                .startTime(startTime)
                .endTime(endTime)
                .durationMs(Duration.between(startTime, endTime).toMillis())
                .status(status)
                .output(output)
                .errorMessage(errorMessage)
                .build();

        record(execution);
        if (fatal != null) {
            throw fatal;
        }
        updateRunMarkers(jobId, endTime, nextRunAt);
        executionEventPublisher.publish(execution);
        return execution;
    }

    private void record(Execution execution) {
        try {
            storeRetryTemplate.execute(context -> jobStore.insertExecution(execution));
            log.info("Execution {} of job {} recorded as {}", execution.getId(), execution.getJobId(), execution.getStatus());
        } catch (RuntimeException e) {
            log.error("Could not record execution {} of job {}", execution.getId(), execution.getJobId(), e);
        }
    }

    private void updateRunMarkers(String jobId, Instant lastRunAt, Instant nextRunAt) {
        try {
            Optional<Job> found = jobStore.findJob(jobId);
            if (found.isEmpty()) {
                log.warn("Job {} no longer exists, run markers not updated", jobId);
                return;
            }
            Job job = found.get();
            job.setLastRunAt(lastRunAt);
            if (nextRunAt != null) {
                job.setNextRunAt(nextRunAt);
            }
            job.setUpdatedAt(lastRunAt);
            if (!jobStore.updateJob(job)) {
                log.warn("Job {} was deleted during its execution, run markers not updated", jobId);
            }
        } catch (RuntimeException e) {
            log.error("Could not update run markers of job {}", jobId, e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
