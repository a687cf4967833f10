package fr.tictak.pulse.repository;

import fr.tictak.pulse.model.NotificationSource;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface NotificationSourceRepository extends MongoRepository<NotificationSource, String> {
    List<NotificationSource> findByUserId(String userId);
    List<NotificationSource> findByUserIdAndEnabledIsTrue(String userId);
    List<NotificationSource> findByEnabledIsTrue();
    Optional<NotificationSource> findByIdAndUserId(String id, String userId);
}
