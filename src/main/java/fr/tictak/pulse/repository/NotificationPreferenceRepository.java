package fr.tictak.pulse.repository;

import fr.tictak.pulse.model.NotificationPreference;
import fr.tictak.pulse.model.enums.NotificationType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface NotificationPreferenceRepository extends MongoRepository<NotificationPreference, String> {
    List<NotificationPreference> findByUserId(String userId);
    Optional<NotificationPreference> findByUserIdAndNotificationType(String userId, NotificationType notificationType);
    boolean existsByUserIdAndNotificationType(String userId, NotificationType notificationType);
}
