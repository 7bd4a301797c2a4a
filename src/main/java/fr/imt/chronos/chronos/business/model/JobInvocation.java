package fr.imt.chronos.chronos.business.model;

import java.time.Instant;
import java.util.Map;

public record JobInvocation(String jobId, String jobName, Map<String, Object> payload, Instant startedAt) {
}
