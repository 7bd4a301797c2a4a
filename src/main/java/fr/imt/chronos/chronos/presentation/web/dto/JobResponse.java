package fr.imt.chronos.chronos.presentation.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.imt.chronos.chronos.business.model.JobStatus;
import fr.imt.chronos.chronos.business.model.RecurrenceType;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
public class JobResponse {
    private String jobId;
    private String name;
    private RecurrenceType type;
    private RecurrenceConfigDto config;
    private String scheduleExpression;
    private Map<String, Object> payload;
    private JobStatus status;
    private boolean active;
    private Instant nextRun;
    private Instant lastRunAt;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<ExecutionResponse> executions;
}
