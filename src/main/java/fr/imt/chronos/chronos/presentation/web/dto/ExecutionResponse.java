package fr.imt.chronos.chronos.presentation.web.dto;

import fr.imt.chronos.chronos.business.model.ExecutionStatus;
import lombok.Data;

import java.time.Instant;

@Data
public class ExecutionResponse {
    private String id;
    private String jobId;
    private String jobName;
    private Instant startTime;
    private Instant endTime;
    private long durationMs;
    private ExecutionStatus status;
    private String errorMessage;
    private String output;
}
