package fr.imt.chronos.chronos.business.service;

import fr.imt.chronos.chronos.business.port.JobStorePort;
import fr.imt.chronos.chronos.configuration.SchedulerProperties;
import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ExecutionQueryService {

    private final JobStorePort jobStore;
    private final SchedulerProperties properties;

    /**
     * @param jobId optional filter, {@code null} for every job
     */
    public List<Execution> list(String jobId) {
        return jobStore.findExecutions(jobId, properties.getExecutionListLimit());
    }

    public Optional<Execution> getById(String executionId) {
        return jobStore.findExecution(executionId);
    }
}
