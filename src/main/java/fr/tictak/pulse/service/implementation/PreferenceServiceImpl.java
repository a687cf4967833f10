package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.dto.in.PreferenceRequest;
import fr.tictak.pulse.dto.in.PreferenceUpdateRequest;
import fr.tictak.pulse.exception.ConflictException;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.model.NotificationPreference;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.repository.NotificationPreferenceRepository;
import fr.tictak.pulse.service.PreferenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;

@Slf4j
@Service
public class PreferenceServiceImpl implements PreferenceService {

    private final NotificationPreferenceRepository preferenceRepository;
    private final Clock clock;

    public PreferenceServiceImpl(NotificationPreferenceRepository preferenceRepository, Clock clock) {
        this.preferenceRepository = preferenceRepository;
        this.clock = clock;
    }

    @Override
    public List<NotificationPreference> list(String userId) {
        return preferenceRepository.findByUserId(userId);
    }

    @Override
    public NotificationPreference get(String userId, NotificationType type) {
        return preferenceRepository.findByUserIdAndNotificationType(userId, type)
                .orElseThrow(() -> new ResourceNotFoundException("No preference stored for type " + type.getValue()));
    }

    @Override
    public NotificationPreference create(String userId, PreferenceRequest request) {
        if (preferenceRepository.existsByUserIdAndNotificationType(userId, request.notificationType())) {
            throw new ConflictException("Preference for type " + request.notificationType().getValue() + " already exists");
        }
        NotificationPreference preference = NotificationPreference.defaults(userId, request.notificationType());
        merge(preference, new PreferenceUpdateRequest(request.enabled(), request.inAppEnabled(),
                request.emailEnabled(), request.pushEnabled(), request.settings()));
        Instant now = clock.instant();
        preference.setCreatedAt(now);
        preference.setUpdatedAt(now);
        try {
            NotificationPreference saved = preferenceRepository.save(preference);
            log.info("Preference created for user {} and type {}", userId, request.notificationType().getValue());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Preference for type " + request.notificationType().getValue() + " already exists");
        }
    }

    @Override
    public NotificationPreference update(String userId, NotificationType type, PreferenceUpdateRequest patch) {
        Instant now = clock.instant();
        NotificationPreference preference = preferenceRepository.findByUserIdAndNotificationType(userId, type)
                .orElseGet(() -> {
                    log.debug("No stored preference for user {} and type {}, creating from defaults", userId, type.getValue());
                    NotificationPreference created = NotificationPreference.defaults(userId, type);
                    created.setCreatedAt(now);
                    return created;
                });
        merge(preference, patch);
        preference.setUpdatedAt(now);
        return preferenceRepository.save(preference);
    }

    @Override
    public void delete(String userId, NotificationType type) {
        NotificationPreference preference = get(userId, type);
        preferenceRepository.delete(preference);
        log.info("Preference override removed for user {} and type {}", userId, type.getValue());
    }

    @Override
    public NotificationPreference resolve(String userId, NotificationType type) {
        return preferenceRepository.findByUserIdAndNotificationType(userId, type)
                .orElseGet(() -> NotificationPreference.defaults(userId, type));
    }

    private static void merge(NotificationPreference target, PreferenceUpdateRequest patch) {
        if (patch == null) {
            return;
        }
        if (patch.enabled() != null) {
            target.setEnabled(patch.enabled());
        }
        if (patch.inAppEnabled() != null) {
            target.setInAppEnabled(patch.inAppEnabled());
        }
        if (patch.emailEnabled() != null) {
            target.setEmailEnabled(patch.emailEnabled());
        }
        if (patch.pushEnabled() != null) {
            target.setPushEnabled(patch.pushEnabled());
        }
        if (patch.settings() != null) {
            target.setSettings(new HashMap<>(patch.settings()));
        }
    }
}
