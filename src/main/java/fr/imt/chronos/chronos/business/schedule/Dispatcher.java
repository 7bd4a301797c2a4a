package fr.imt.chronos.chronos.business.schedule;

import fr.imt.chronos.chronos.configuration.SchedulingConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Timer side of the scheduler. Each live trigger is one pending task on the timer pool;
 * when it comes due the callback is handed to the worker pool and the trigger re-arms
 * straight away, so a slow or failing job never holds up any other trigger.
 */
@Component
@Slf4j
public class Dispatcher implements TriggerSource {

    private final TaskScheduler taskScheduler;
    private final Executor workerExecutor;
    private final RecurrenceCompiler recurrenceCompiler;
    private final Clock clock;

    public Dispatcher(@Qualifier(SchedulingConfiguration.TIMER_SCHEDULER) TaskScheduler taskScheduler,
                      @Qualifier(SchedulingConfiguration.WORKER_EXECUTOR) Executor workerExecutor,
                      RecurrenceCompiler recurrenceCompiler,
                      Clock clock) {
        this.taskScheduler = taskScheduler;
        this.workerExecutor = workerExecutor;
        this.recurrenceCompiler = recurrenceCompiler;
        this.clock = clock;
    }

    @Override
    public LiveTrigger arm(String jobId, String scheduleExpression, TriggerCallback callback) {
        LiveTrigger trigger = new LiveTrigger(jobId, scheduleExpression, callback);
        Instant first = recurrenceCompiler.nextFireTime(scheduleExpression, clock.instant());
        synchronized (trigger) {
            scheduleAt(trigger, first);
        }
        log.info("Job {} armed with schedule '{}', first fire at {}", jobId, scheduleExpression, first);
        return trigger;
    }

    @Override
    public void disarm(LiveTrigger trigger) {
        if (trigger.remove()) {
            log.info("Job {} disarmed", trigger.getJobId());
        }
    }

    void fire(LiveTrigger trigger, Instant dueTime) {
        // A late timer must not replay the occurrences it missed
        Instant now = clock.instant();
        Instant base = now.isAfter(dueTime) ? now : dueTime;
        Instant following = recurrenceCompiler.nextFireTime(trigger.getScheduleExpression(), base);

        if (!trigger.beginFiring(following)) {
            log.debug("Job {} was removed before its firing at {}", trigger.getJobId(), dueTime);
            return;
        }

        log.info("Firing job {} (due {})", trigger.getJobId(), dueTime);
        try {
            dispatch(trigger, new TriggerFiring(trigger.getJobId(), dueTime, following));
        } finally {
            rearm(trigger, following);
        }
    }

    private void rearm(LiveTrigger trigger, Instant following) {
        synchronized (trigger) {
            if (trigger.isRemoved()) {
                log.info("Job {} removed while firing, not re-armed", trigger.getJobId());
                return;
            }
            try {
                scheduleAt(trigger, following);
            } catch (TaskRejectedException e) {
                log.error("Could not re-arm job {} for {}", trigger.getJobId(), following, e);
            }
        }
    }

    private void scheduleAt(LiveTrigger trigger, Instant fireTime) {
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(trigger, fireTime), fireTime);
        trigger.armed(fireTime, future);
    }

    private void dispatch(LiveTrigger trigger, TriggerFiring firing) {
        try {
            workerExecutor.execute(() -> invoke(trigger, firing));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected firing of job {} due at {}", firing.jobId(), firing.dueTime(), e);
        }
    }

    private void invoke(LiveTrigger trigger, TriggerFiring firing) {
        try {
            trigger.getCallback().onFire(firing);
        } catch (RuntimeException e) {
            log.error("Callback of job {} failed for firing at {}", firing.jobId(), firing.dueTime(), e);
        }
    }
}
