package fr.imt.chronos.chronos.business.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum RecurrenceType {
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly");

    private final String label;

    RecurrenceType(String label) {
        this.label = label;
    }

    @JsonValue
    public String toJson() {
        return label;
    }

    @JsonCreator
    public static RecurrenceType fromJson(String value) {
        return Arrays.stream(values())
                .filter(type -> type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported job type: " + value));
    }
}
