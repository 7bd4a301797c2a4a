package fr.imt.chronos.chronos.presentation.web.dto;

import fr.imt.chronos.chronos.business.model.RecurrenceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;

@Data
public class CreateJobRequest {

    @NotBlank
    private String name;

    @NotNull
    private RecurrenceType type;

    // Bounds are checked when the recurrence is compiled
    private RecurrenceConfigDto config;

    private Map<String, Object> payload;
}
