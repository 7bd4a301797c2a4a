package fr.imt.chronos.chronos.business.schedule;

/**
 * Owns the timing side of live triggers: arming, re-arming after each firing, disarming.
 */
public interface TriggerSource {

    /**
     * Create a trigger and arm it for its first fire time.
     */
    LiveTrigger arm(String jobId, String scheduleExpression, TriggerCallback callback);

    /**
     * Stop a trigger for good. A firing already in progress completes but is not followed by another.
     */
    void disarm(LiveTrigger trigger);

}
