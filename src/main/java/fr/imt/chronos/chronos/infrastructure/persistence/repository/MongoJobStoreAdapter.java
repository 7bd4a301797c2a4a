package fr.imt.chronos.chronos.infrastructure.persistence.repository;

import fr.imt.chronos.chronos.business.port.JobStorePort;
import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import fr.imt.chronos.chronos.infrastructure.persistence.Job;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoJobStoreAdapter implements JobStorePort {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "startTime");

    private final JobRepository jobRepository;
    private final ExecutionRepository executionRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Job insertJob(Job job) {
        return jobRepository.insert(job);
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public boolean updateJob(Job job) {
        // findAndReplace does not upsert, so a job deleted in the meantime stays deleted
        Query query = Query.query(Criteria.where("_id").is(job.getJobId()));
        return mongoTemplate.findAndReplace(query, job) != null;
    }

    @Override
    public long deleteJob(String jobId) {
        Query query = Query.query(Criteria.where("_id").is(jobId));
        return mongoTemplate.remove(query, Job.class).getDeletedCount();
    }

    @Override
    public List<Job> listJobs() {
        return jobRepository.findAll();
    }

    @Override
    public Execution insertExecution(Execution execution) {
        return executionRepository.insert(execution);
    }

    @Override
    public List<Execution> findExecutions(String jobId, int limit) {
        Pageable page = PageRequest.of(0, limit, NEWEST_FIRST);
        if (jobId == null) {
            return executionRepository.findAll(page).getContent();
        }
        return executionRepository.findByJobId(jobId, page);
    }

    @Override
    public Optional<Execution> findExecution(String executionId) {
        return executionRepository.findById(executionId);
    }
}
