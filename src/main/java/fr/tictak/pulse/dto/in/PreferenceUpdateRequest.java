package fr.tictak.pulse.dto.in;

import java.util.Map;

/**
 * Partial update: null fields leave the stored value untouched.
 */
public record PreferenceUpdateRequest(
        Boolean enabled,
        Boolean inAppEnabled,
        Boolean emailEnabled,
        Boolean pushEnabled,
        Map<String, Object> settings
) {
}
