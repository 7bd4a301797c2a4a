package fr.imt.chronos.chronos.presentation.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecurrenceConfigDto {
    private Integer minute;
    private Integer hour;
    private Integer dayOfWeek;
}
