package fr.tictak.pulse.repository;

import fr.tictak.pulse.model.NotificationPattern;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface NotificationPatternRepository extends MongoRepository<NotificationPattern, String> {
    List<NotificationPattern> findByUserId(String userId);
    List<NotificationPattern> findByUserIdAndPatternKey(String userId, String patternKey);
    Optional<NotificationPattern> findByIdAndUserId(String id, String userId);
    List<NotificationPattern> findByLastOccurrenceBefore(Instant cutoff);
}
