package fr.tictak.pulse.dto.in;

import fr.tictak.pulse.model.enums.NotificationType;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Creation body. Omitted flags take the fail-open defaults.
 */
public record PreferenceRequest(
        @NotNull(message = "notificationType is required") NotificationType notificationType,
        Boolean enabled,
        Boolean inAppEnabled,
        Boolean emailEnabled,
        Boolean pushEnabled,
        Map<String, Object> settings
) {
}
