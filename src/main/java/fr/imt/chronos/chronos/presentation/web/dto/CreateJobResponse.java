package fr.imt.chronos.chronos.presentation.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CreateJobResponse {
    private String jobId;
    private String message;
}
