package fr.imt.chronos.chronos.infrastructure.persistence;

import fr.imt.chronos.chronos.business.model.JobStatus;
import fr.imt.chronos.chronos.business.model.RecurrenceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "jobs")
public class Job {

    @Id
    private String jobId; // UUID generated at creation

    private String name;

    private RecurrenceType recurrenceType;

    private RecurrenceConfig recurrenceConfig;

    // Derived from recurrenceType + recurrenceConfig, never edited afterwards
    private String scheduleExpression;

    private Map<String, Object> payload;

    private Instant nextRunAt;

    private Instant lastRunAt;

    @Builder.Default
    private JobStatus status = JobStatus.ACTIVE;

    private Instant createdAt;

    private Instant updatedAt;

}
