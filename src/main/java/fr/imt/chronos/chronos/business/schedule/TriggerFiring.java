package fr.imt.chronos.chronos.business.schedule;

import java.time.Instant;

/**
 * @param dueTime        the instant the trigger was armed for
 * @param nextFireTime   the instant it re-arms for once this firing is dispatched
 */
public record TriggerFiring(String jobId, Instant dueTime, Instant nextFireTime) {
}
