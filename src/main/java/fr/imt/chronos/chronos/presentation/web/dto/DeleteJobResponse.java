package fr.imt.chronos.chronos.presentation.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DeleteJobResponse {
    private boolean success;
    private String message;
}
