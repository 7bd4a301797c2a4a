package fr.imt.chronos.chronos.business.model;

import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import fr.imt.chronos.chronos.infrastructure.persistence.RecurrenceConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A persisted job merged with what the schedule registry knows about it.
 * {@code active} is true only while a live trigger exists, whatever the stored status says.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobView {
    private String jobId;
    private String name;
    private RecurrenceType recurrenceType;
    private RecurrenceConfig recurrenceConfig;
    private String scheduleExpression;
    private Map<String, Object> payload;
    private JobStatus status;
    private boolean active;
    private Instant nextRun;
    private Instant lastRunAt;
    private Instant createdAt;
    private Instant updatedAt;

    // Only filled for single-job lookups
    private List<Execution> executions;
}
