package fr.imt.chronos.chronos.business.schedule;

import java.time.Instant;

public record TriggerSnapshot(String jobId, Instant nextFireTime) {
}
