package fr.imt.chronos.chronos.presentation.web;

import fr.imt.chronos.chronos.business.service.JobLifecycleService;
import fr.imt.chronos.chronos.exception.JobNotFoundException;
import fr.imt.chronos.chronos.presentation.web.dto.CreateJobRequest;
import fr.imt.chronos.chronos.presentation.web.dto.CreateJobResponse;
import fr.imt.chronos.chronos.presentation.web.dto.DeleteJobResponse;
import fr.imt.chronos.chronos.presentation.web.dto.JobResponse;
import fr.imt.chronos.chronos.presentation.web.dto.mappers.JobMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/scheduler/jobs")
@RequiredArgsConstructor
public class SchedulerController {

    private final JobLifecycleService jobLifecycleService;
    private final JobMapper jobMapper;

    @PostMapping
    public ResponseEntity<CreateJobResponse> createJob(@Valid @RequestBody CreateJobRequest request) {
        String jobId = jobLifecycleService.create(jobMapper.toDefinition(request));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CreateJobResponse(jobId, "Job created successfully with ID: " + jobId));
    }

    @GetMapping
    public ResponseEntity<List<JobResponse>> getAllJobs() {
        return ResponseEntity.ok(jobMapper.toResponses(jobLifecycleService.list()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<JobResponse> getJobById(@PathVariable("id") String jobId) {
        return jobLifecycleService.getById(jobId)
                .map(jobMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<DeleteJobResponse> deleteJob(@PathVariable("id") String jobId) {
        boolean deleted = jobLifecycleService.delete(jobId);
        String message = deleted
                ? "Job " + jobId + " deleted successfully"
                : "Failed to delete job " + jobId;
        return ResponseEntity.ok(new DeleteJobResponse(deleted, message));
    }

}
