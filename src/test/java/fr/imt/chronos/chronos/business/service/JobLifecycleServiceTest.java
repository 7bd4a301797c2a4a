package fr.imt.chronos.chronos.business.service;

import fr.imt.chronos.chronos.business.model.ExecutionStatus;
import fr.imt.chronos.chronos.business.model.JobDefinition;
import fr.imt.chronos.chronos.business.model.JobStatus;
import fr.imt.chronos.chronos.business.model.JobView;
import fr.imt.chronos.chronos.business.model.RecurrenceType;
import fr.imt.chronos.chronos.business.port.ExecutionEventPublisherPort;
import fr.imt.chronos.chronos.business.schedule.Dispatcher;
import fr.imt.chronos.chronos.business.schedule.RecurrenceCompiler;
import fr.imt.chronos.chronos.business.schedule.ScheduleRegistry;
import fr.imt.chronos.chronos.configuration.SchedulerProperties;
import fr.imt.chronos.chronos.exception.InvalidRecurrenceException;
import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import fr.imt.chronos.chronos.infrastructure.persistence.Job;
import fr.imt.chronos.chronos.infrastructure.persistence.RecurrenceConfig;
import fr.imt.chronos.chronos.support.InMemoryJobStore;
import fr.imt.chronos.chronos.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class JobLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-05T14:10:00Z");

    private InMemoryJobStore jobStore;
    private TaskScheduler taskScheduler;
    private ScheduleRegistry scheduleRegistry;
    private MutableClock clock;
    private JobLifecycleService service;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        clock = new MutableClock(NOW);
        taskScheduler = mock(TaskScheduler.class);
        doReturn(mock(ScheduledFuture.class)).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        RecurrenceCompiler compiler = new RecurrenceCompiler(ZoneOffset.UTC);
        scheduleRegistry = new ScheduleRegistry(new Dispatcher(taskScheduler, Runnable::run, compiler, clock));
        JobExecutor executor = new JobExecutor(jobStore, invocation -> "Hello " + invocation.jobName(),
                mock(ExecutionEventPublisherPort.class), new RetryTemplate(), clock);
        service = new JobLifecycleService(compiler, jobStore, scheduleRegistry, executor, new SchedulerProperties(), clock);
    }

    @Test
    void createdJobListsAsActiveWithAFutureNextRun() {
        String jobId = service.create(hourlyAt(30));

        List<JobView> jobs = service.list();

        assertThat(jobs).hasSize(1);
        JobView view = jobs.get(0);
        assertThat(view.getJobId()).isEqualTo(jobId);
        assertThat(view.isActive()).isTrue();
        assertThat(view.getNextRun()).isAfter(NOW).isEqualTo(Instant.parse("2024-03-05T14:30:00Z"));
        assertThat(view.getScheduleExpression()).isEqualTo("0 30 * * * *");
        assertThat(view.getStatus()).isEqualTo(JobStatus.ACTIVE);
    }

    @Test
    void createPersistsTheFirstFireTime() {
        String jobId = service.create(hourlyAt(30));

        Job stored = jobStore.findJob(jobId).orElseThrow();
        assertThat(stored.getNextRunAt()).isEqualTo(Instant.parse("2024-03-05T14:30:00Z"));
        assertThat(stored.getLastRunAt()).isNull();
        assertThat(stored.getPayload()).containsEntry("reportType", "sales");
    }

    @Test
    void invalidRecurrencePersistsNothing() {
        JobDefinition invalid = new JobDefinition("Bad", RecurrenceType.DAILY,
                RecurrenceConfig.builder().hour(25).build(), null);

        assertThatThrownBy(() -> service.create(invalid)).isInstanceOf(InvalidRecurrenceException.class);

        assertThat(jobStore.listJobs()).isEmpty();
        assertThat(scheduleRegistry.size()).isZero();
    }

    @Test
    void deletingAnUnknownJobReturnsFalse() {
        assertThat(service.delete("does-not-exist")).isFalse();
    }

    @Test
    void deleteDisarmsAndRemovesTheJob() {
        String jobId = service.create(hourlyAt(0));

        assertThat(service.delete(jobId)).isTrue();

        assertThat(scheduleRegistry.get(jobId)).isEmpty();
        assertThat(jobStore.findJob(jobId)).isEmpty();
        assertThat(service.delete(jobId)).isFalse();
    }

    @Test
    void jobWithoutTriggerIsReportedInactiveWithItsStoredNextRun() {
        Instant stale = Instant.parse("2024-03-01T00:00:00Z");
        jobStore.insertJob(storedJob("orphan", stale));

        JobView view = service.getById("orphan").orElseThrow();

        assertThat(view.getStatus()).isEqualTo(JobStatus.ACTIVE);
        assertThat(view.isActive()).isFalse();
        assertThat(view.getNextRun()).isEqualTo(stale);
    }

    @Test
    void getByIdReturnsAtMostTenExecutionsNewestFirst() {
        String jobId = service.create(hourlyAt(0));
        for (int i = 0; i < 12; i++) {
            jobStore.insertExecution(Execution.builder()
                    .id("exec-" + i)
                    .jobId(jobId)
                    .startTime(NOW.plusSeconds(i))
                    .status(ExecutionStatus.SUCCESS)
                    .build());
        }

        JobView view = service.getById(jobId).orElseThrow();

        assertThat(view.getExecutions()).hasSize(10);
        assertThat(view.getExecutions().get(0).getId()).isEqualTo("exec-11");
        assertThat(view.getExecutions().get(9).getId()).isEqualTo("exec-2");
    }

    @Test
    void getByIdOfUnknownJobIsEmpty() {
        assertThat(service.getById("missing")).isEmpty();
    }

    @Test
    void firingRunsTheJobAndRecordsIt() {
        String jobId = service.create(hourlyAt(30));
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), eq(Instant.parse("2024-03-05T14:30:00Z")));

        clock.set(Instant.parse("2024-03-05T14:30:00Z"));
        task.getValue().run();

        List<Execution> executions = jobStore.findExecutions(jobId, 10);
        assertThat(executions).hasSize(1);
        assertThat(executions.get(0).getOutput()).isEqualTo("Hello Report");
        Job stored = jobStore.findJob(jobId).orElseThrow();
        assertThat(stored.getLastRunAt()).isEqualTo(Instant.parse("2024-03-05T14:30:00Z"));
        assertThat(stored.getNextRunAt()).isEqualTo(Instant.parse("2024-03-05T15:30:00Z"));
    }

    @Test
    void reconcileArmsPersistedActiveJobsOnly() {
        jobStore.insertJob(storedJob("a", null));
        jobStore.insertJob(storedJob("b", null));
        Job deleted = storedJob("c", null);
        deleted.setStatus(JobStatus.DELETED);
        jobStore.insertJob(deleted);

        assertThat(service.reconcile()).isEqualTo(2);
        assertThat(service.reconcile()).isZero();

        assertThat(scheduleRegistry.get("a")).isPresent();
        assertThat(scheduleRegistry.get("b")).isPresent();
        assertThat(scheduleRegistry.get("c")).isEmpty();
        assertThat(jobStore.findJob("a").orElseThrow().getNextRunAt()).isEqualTo(Instant.parse("2024-03-05T15:00:00Z"));
    }

    @Test
    void jobDeletedDuringReconcileIsNotLeftArmed() {
        InMemoryJobStore racingStore = new InMemoryJobStore() {
            @Override
            public List<Job> listJobs() {
                List<Job> snapshot = super.listJobs();
                deleteJob("a");
                return snapshot;
            }
        };
        racingStore.insertJob(storedJob("a", null));
        racingStore.insertJob(storedJob("b", null));
        JobLifecycleService racingService = new JobLifecycleService(new RecurrenceCompiler(ZoneOffset.UTC), racingStore,
                scheduleRegistry, mock(JobExecutor.class), new SchedulerProperties(), clock);

        assertThat(racingService.reconcile()).isEqualTo(1);

        assertThat(racingStore.findJob("a")).isEmpty();
        assertThat(scheduleRegistry.get("a")).isEmpty();
        assertThat(scheduleRegistry.get("b")).isPresent();
    }

    @Test
    void jobStoredButNotArmedSurfacesTheErrorAndListsInactive() {
        doThrow(new TaskRejectedException("timer pool shut down"))
                .when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        assertThatThrownBy(() -> service.create(hourlyAt(30))).isInstanceOf(TaskRejectedException.class);

        assertThat(jobStore.listJobs()).hasSize(1);
        List<JobView> jobs = service.list();
        assertThat(jobs).hasSize(1);
        assertThat(jobs.get(0).isActive()).isFalse();
        assertThat(jobs.get(0).getNextRun()).isEqualTo(Instant.parse("2024-03-05T14:30:00Z"));
        assertThat(scheduleRegistry.size()).isZero();
    }

    private static JobDefinition hourlyAt(int minute) {
        return new JobDefinition("Report", RecurrenceType.HOURLY,
                RecurrenceConfig.builder().minute(minute).build(), Map.of("reportType", "sales"));
    }

    private static Job storedJob(String jobId, Instant nextRunAt) {
        return Job.builder()
                .jobId(jobId)
                .name("Stored " + jobId)
                .recurrenceType(RecurrenceType.HOURLY)
                .recurrenceConfig(new RecurrenceConfig())
                .scheduleExpression("0 0 * * * *")
                .status(JobStatus.ACTIVE)
                .nextRunAt(nextRunAt)
                .build();
    }
}
