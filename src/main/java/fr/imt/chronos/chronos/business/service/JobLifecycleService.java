package fr.imt.chronos.chronos.business.service;

import fr.imt.chronos.chronos.business.model.JobDefinition;
import fr.imt.chronos.chronos.business.model.JobStatus;
import fr.imt.chronos.chronos.business.model.JobView;
import fr.imt.chronos.chronos.business.port.JobStorePort;
import fr.imt.chronos.chronos.business.schedule.LiveTrigger;
import fr.imt.chronos.chronos.business.schedule.RecurrenceCompiler;
import fr.imt.chronos.chronos.business.schedule.ScheduleRegistry;
import fr.imt.chronos.chronos.business.schedule.TriggerCallback;
import fr.imt.chronos.chronos.configuration.SchedulerProperties;
import fr.imt.chronos.chronos.exception.DuplicateTriggerException;
import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import fr.imt.chronos.chronos.infrastructure.persistence.Job;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class JobLifecycleService {

    private static final int MAX_RECENT_EXECUTIONS = 10;

    private final RecurrenceCompiler recurrenceCompiler;
    private final JobStorePort jobStore;
    private final ScheduleRegistry scheduleRegistry;
    private final JobExecutor jobExecutor;
    private final SchedulerProperties properties;
    private final Clock clock;

    /**
     * Compile, persist and arm a new job.
     * <p>
     * Nothing is stored when the recurrence does not compile. When arming fails after
     * the job was stored, the error is rethrown and the job lists as inactive.
     *
     * @return the generated job id
     */
    public String create(JobDefinition definition) {
        String jobId = UUID.randomUUID().toString();
        String scheduleExpression = recurrenceCompiler.compile(definition.type(), definition.config());
        log.info("Creating job {} with schedule expression: {}", jobId, scheduleExpression);

        Instant now = clock.instant();
        Job job = Job.builder()
                .jobId(jobId)
                .name(definition.name())
                .recurrenceType(definition.type())
                .recurrenceConfig(definition.config())
                .scheduleExpression(scheduleExpression)
                .payload(definition.payload())
                .nextRunAt(recurrenceCompiler.nextFireTime(scheduleExpression, now))
                .status(JobStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobStore.insertJob(job);

        try {
            register(job);
        } catch (RuntimeException e) {
            log.error("Job {} persisted but could not be armed, it stays inactive until reconciled", jobId, e);
            throw e;
        }
        return jobId;
    }

    /**
     * Disarm then delete a job.
     *
     * @return whether the job existed in the store
     */
    public boolean delete(String jobId) {
        scheduleRegistry.remove(jobId);

        long deleted = jobStore.deleteJob(jobId);
        if (deleted > 0) {
            log.info("Job {} deleted from database", jobId);
            return true;
        }
        log.warn("Job {} not found in database", jobId);
        return false;
    }

    public List<JobView> list() {
        return jobStore.listJobs().stream()
                .map(job -> toView(job, null))
                .toList();
    }

    public Optional<JobView> getById(String jobId) {
        int limit = Math.min(properties.getRecentExecutionLimit(), MAX_RECENT_EXECUTIONS);
        return jobStore.findJob(jobId)
                .map(job -> toView(job, jobStore.findExecutions(jobId, limit)));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isReconcileOnStartup()) {
            int armed = reconcile();
            log.info("Startup reconciliation armed {} job(s)", armed);
        }
    }

    /**
     * Arm every persisted active job that has no live trigger.
     *
     * @return how many jobs were armed
     */
    public int reconcile() {
        int armed = 0;
        for (Job job : jobStore.listJobs()) {
            if (job.getStatus() != JobStatus.ACTIVE || scheduleRegistry.get(job.getJobId()).isPresent()) {
                continue;
            }
            try {
                LiveTrigger trigger = register(job);
                job.setNextRunAt(trigger.getNextFireTime());
                job.setUpdatedAt(clock.instant());
                if (!jobStore.updateJob(job)) {
                    log.info("Job {} was deleted while being re-armed, disarming it", job.getJobId());
                    scheduleRegistry.remove(job.getJobId());
                    continue;
                }
                armed++;
            } catch (DuplicateTriggerException e) {
                log.debug("Job {} was armed concurrently", job.getJobId());
            } catch (RuntimeException e) {
                log.error("Could not re-arm job {}", job.getJobId(), e);
            }
        }
        return armed;
    }

    private LiveTrigger register(Job job) {
        String jobId = job.getJobId();
        String jobName = job.getName();
        TriggerCallback callback = firing ->
                jobExecutor.run(jobId, jobName, job.getPayload(), firing.nextFireTime());
        return scheduleRegistry.add(jobId, job.getScheduleExpression(), callback);
    }

    private JobView toView(Job job, List<Execution> executions) {
        Optional<LiveTrigger> trigger = scheduleRegistry.get(job.getJobId());
        return JobView.builder()
                .jobId(job.getJobId())
                .name(job.getName())
                .recurrenceType(job.getRecurrenceType())
                .recurrenceConfig(job.getRecurrenceConfig())
                .scheduleExpression(job.getScheduleExpression())
                .payload(job.getPayload())
                .status(job.getStatus())
                .active(trigger.isPresent())
                .nextRun(trigger.map(LiveTrigger::getNextFireTime).orElse(job.getNextRunAt()))
                .lastRunAt(job.getLastRunAt())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .executions(executions)
                .build();
    }
}
