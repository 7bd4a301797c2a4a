package fr.imt.chronos.chronos.infrastructure.persistence.repository;

import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExecutionRepository extends MongoRepository<Execution, String> {

    List<Execution> findByJobId(String jobId, Pageable pageable);
}
