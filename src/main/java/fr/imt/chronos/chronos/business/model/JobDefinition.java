package fr.imt.chronos.chronos.business.model;

import fr.imt.chronos.chronos.infrastructure.persistence.RecurrenceConfig;

import java.util.Map;

/**
 * What a caller asks for when creating a job.
 */
public record JobDefinition(String name,
                            RecurrenceType type,
                            RecurrenceConfig config,
                            Map<String, Object> payload) {
}
