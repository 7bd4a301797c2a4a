package fr.imt.chronos.chronos.presentation.web.dto.mappers;

import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import fr.imt.chronos.chronos.presentation.web.dto.ExecutionResponse;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface ExecutionMapper {
    ExecutionResponse toResponse(Execution execution);
    List<ExecutionResponse> toResponses(List<Execution> executions);
}
