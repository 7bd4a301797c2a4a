package fr.imt.chronos.chronos.presentation.web.dto.mappers;

import fr.imt.chronos.chronos.business.model.JobDefinition;
import fr.imt.chronos.chronos.business.model.JobView;
import fr.imt.chronos.chronos.presentation.web.dto.CreateJobRequest;
import fr.imt.chronos.chronos.presentation.web.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring", uses = ExecutionMapper.class)
public interface JobMapper {

    @Mapping(target = "type", source = "recurrenceType")
    @Mapping(target = "config", source = "recurrenceConfig")
    JobResponse toResponse(JobView view);

    List<JobResponse> toResponses(List<JobView> views);

    JobDefinition toDefinition(CreateJobRequest request);
}
