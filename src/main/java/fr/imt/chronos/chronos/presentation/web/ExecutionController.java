package fr.imt.chronos.chronos.presentation.web;

import fr.imt.chronos.chronos.business.service.ExecutionQueryService;
import fr.imt.chronos.chronos.exception.ExecutionNotFoundException;
import fr.imt.chronos.chronos.presentation.web.dto.ExecutionResponse;
import fr.imt.chronos.chronos.presentation.web.dto.mappers.ExecutionMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/jobs/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionQueryService executionQueryService;
    private final ExecutionMapper executionMapper;

    @GetMapping
    public ResponseEntity<List<ExecutionResponse>> getExecutionHistory(
            @RequestParam(name = "jobId", required = false) String jobId) {
        String filter = StringUtils.hasText(jobId) ? jobId : null;
        return ResponseEntity.ok(executionMapper.toResponses(executionQueryService.list(filter)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExecutionResponse> getExecutionById(@PathVariable("id") String executionId) {
        return executionQueryService.getById(executionId)
                .map(executionMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }
}
