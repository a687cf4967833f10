package fr.tictak.pulse.dto.in;

import fr.tictak.pulse.model.enums.SourceType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record SourceRequest(
        SourceType sourceType,
        @Size(max = 100, message = "name must not exceed 100 characters") String name,
        Map<String, String> credentials,
        Map<String, Object> settings,
        Boolean enabled,
        @Min(value = 5, message = "syncFrequencyMinutes must be at least 5")
        @Max(value = 1440, message = "syncFrequencyMinutes must not exceed 1440") Integer syncFrequencyMinutes
) {
}
