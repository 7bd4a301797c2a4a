package fr.imt.chronos.chronos.business.schedule;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * In-memory handle of an armed schedule. Lives in the {@link ScheduleRegistry} only.
 * <p>
 * State changes are guarded by the instance monitor: {@code ARMED -> FIRING -> ARMED}
 * until {@code REMOVED}, which is terminal.
 */
public class LiveTrigger {

    @Getter
    private final String jobId;

    @Getter
    private final String scheduleExpression;

    @Getter
    private final TriggerCallback callback;

    private TriggerState state = TriggerState.ARMED;
    private Instant nextFireTime;
    private ScheduledFuture<?> future;

    public LiveTrigger(String jobId, String scheduleExpression, TriggerCallback callback) {
        this.jobId = jobId;
        this.scheduleExpression = scheduleExpression;
        this.callback = callback;
    }

    public synchronized TriggerState getState() {
        return state;
    }

    public synchronized Instant getNextFireTime() {
        return nextFireTime;
    }

    synchronized void armed(Instant fireTime, ScheduledFuture<?> scheduled) {
        this.nextFireTime = fireTime;
        this.future = scheduled;
        this.state = TriggerState.ARMED;
    }

    /**
     * @return false if the trigger was removed before its due time came
     */
    synchronized boolean beginFiring(Instant following) {
        if (state == TriggerState.REMOVED) {
            return false;
        }
        state = TriggerState.FIRING;
        nextFireTime = following;
        return true;
    }

    synchronized boolean isRemoved() {
        return state == TriggerState.REMOVED;
    }

    /**
     * @return false if the trigger was already removed
     */
    synchronized boolean remove() {
        if (state == TriggerState.REMOVED) {
            return false;
        }
        state = TriggerState.REMOVED;
        if (future != null) {
            future.cancel(false);
        }
        return true;
    }
}
