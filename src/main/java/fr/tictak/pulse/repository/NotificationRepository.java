package fr.tictak.pulse.repository;

import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.enums.NotificationType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface NotificationRepository extends MongoRepository<Notification, String> {
    List<Notification> findByUserIdOrderByCreatedAtDesc(String userId);
    List<Notification> findByUserIdAndReadOrderByCreatedAtDesc(String userId, boolean read);
    List<Notification> findByUserIdAndTypeOrderByCreatedAtDesc(String userId, NotificationType type);
    List<Notification> findByUserIdAndTypeAndReadOrderByCreatedAtDesc(String userId, NotificationType type, boolean read);
    List<Notification> findByUserIdAndRead(String userId, boolean read);
    List<Notification> findByUserIdAndIdIn(String userId, Collection<String> ids);
    Optional<Notification> findByIdAndUserId(String id, String userId);
    long countByUserIdAndRead(String userId, boolean read);
    long deleteByReadIsTrueAndReadAtBefore(Instant cutoff);
}
