package fr.tictak.pulse.service;

import fr.tictak.pulse.dto.in.PreferenceRequest;
import fr.tictak.pulse.dto.in.PreferenceUpdateRequest;
import fr.tictak.pulse.model.NotificationPreference;
import fr.tictak.pulse.model.enums.NotificationType;

import java.util.List;

public interface PreferenceService {

    List<NotificationPreference> list(String userId);

    NotificationPreference get(String userId, NotificationType type);

    NotificationPreference create(String userId, PreferenceRequest request);

    /**
     * Partial merge. A missing row is created from the fail-open defaults with the patch applied on top.
     */
    NotificationPreference update(String userId, NotificationType type, PreferenceUpdateRequest patch);

    void delete(String userId, NotificationType type);

    /**
     * Effective preference: the stored override, or the fail-open default when there is none.
     */
    NotificationPreference resolve(String userId, NotificationType type);
}
