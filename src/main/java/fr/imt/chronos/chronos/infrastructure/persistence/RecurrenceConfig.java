package fr.imt.chronos.chronos.infrastructure.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Offsets of a recurrence rule. Every field is optional and defaults to 0 when compiled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurrenceConfig {
    private Integer minute;
    private Integer hour;
    private Integer dayOfWeek; // 0 = Sunday ... 6 = Saturday
}
