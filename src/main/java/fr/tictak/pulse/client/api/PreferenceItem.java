package fr.tictak.pulse.client.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreferenceItem(
        String notificationType,
        Boolean enabled,
        Boolean inAppEnabled,
        Boolean emailEnabled,
        Boolean pushEnabled,
        Map<String, Object> settings
) {

    /**
     * Fields set in {@code patch} replace ours, the others are kept.
     */
    public PreferenceItem merge(PreferenceItem patch) {
        return new PreferenceItem(
                notificationType,
                patch.enabled() != null ? patch.enabled() : enabled,
                patch.inAppEnabled() != null ? patch.inAppEnabled() : inAppEnabled,
                patch.emailEnabled() != null ? patch.emailEnabled() : emailEnabled,
                patch.pushEnabled() != null ? patch.pushEnabled() : pushEnabled,
                patch.settings() != null ? patch.settings() : settings);
    }

    public static PreferenceItem defaults(String type) {
        return new PreferenceItem(type, true, true, false, false, null);
    }
}
