package fr.imt.chronos.chronos.infrastructure.persistence;

import fr.imt.chronos.chronos.business.model.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One record per trigger firing. Written once, never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "job_executions")
public class Execution {

    @Id
    private String id;

    // Reference only: the job may be deleted while its history stays
    @Indexed
    private String jobId;

    private String jobName;

    private Instant startTime;

    private Instant endTime;

    private long durationMs;

    private ExecutionStatus status;

    private String errorMessage;

    private String output;

}
