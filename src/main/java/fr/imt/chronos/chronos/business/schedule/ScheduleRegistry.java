package fr.imt.chronos.chronos.business.schedule;

import fr.imt.chronos.chronos.exception.DuplicateTriggerException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index of the live triggers, keyed by job id. Whether a job is currently scheduled
 * is decided here and nowhere else.
 * <p>
 * Every access to the map goes through a single lock.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScheduleRegistry {

    private final TriggerSource triggerSource;

    private final Map<String, LiveTrigger> triggers = new HashMap<>();
    private final Object lock = new Object();

    /**
     * Arm a trigger for a job.
     *
     * @throws DuplicateTriggerException if the job already has one
     */
    public LiveTrigger add(String jobId, String scheduleExpression, TriggerCallback callback) {
        synchronized (lock) {
            if (triggers.containsKey(jobId)) {
                throw new DuplicateTriggerException(jobId);
            }
            LiveTrigger trigger = triggerSource.arm(jobId, scheduleExpression, callback);
            triggers.put(jobId, trigger);
            return trigger;
        }
    }

    /**
     * Disarm and forget a job's trigger.
     *
     * @return false if the job had no live trigger
     */
    public boolean remove(String jobId) {
        LiveTrigger trigger;
        synchronized (lock) {
            trigger = triggers.remove(jobId);
        }
        if (trigger == null) {
            log.warn("Job {} not found in schedule registry", jobId);
            return false;
        }
        triggerSource.disarm(trigger);
        return true;
    }

    public Optional<LiveTrigger> get(String jobId) {
        synchronized (lock) {
            return Optional.ofNullable(triggers.get(jobId));
        }
    }

    /**
     * Copy of the registry at call time. Triggers may fire right after it is taken.
     */
    public List<TriggerSnapshot> listAll() {
        List<LiveTrigger> live;
        synchronized (lock) {
            live = new ArrayList<>(triggers.values());
        }
        return live.stream()
                .map(trigger -> new TriggerSnapshot(trigger.getJobId(), trigger.getNextFireTime()))
                .toList();
    }

    public int size() {
        synchronized (lock) {
            return triggers.size();
        }
    }

    @PreDestroy
    public void shutdown() {
        List<LiveTrigger> live;
        synchronized (lock) {
            live = new ArrayList<>(triggers.values());
            triggers.clear();
        }
        live.forEach(triggerSource::disarm);
        log.info("Schedule registry shut down, {} trigger(s) disarmed", live.size());
    }
}
