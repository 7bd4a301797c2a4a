package fr.imt.chronos.chronos.infrastructure.persistence.repository;

import fr.imt.chronos.chronos.infrastructure.persistence.Job;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JobRepository extends MongoRepository<Job, String> {
}
