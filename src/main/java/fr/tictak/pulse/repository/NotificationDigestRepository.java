package fr.tictak.pulse.repository;

import fr.tictak.pulse.model.NotificationDigest;
import fr.tictak.pulse.model.enums.DigestType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface NotificationDigestRepository extends MongoRepository<NotificationDigest, String> {
    List<NotificationDigest> findByUserIdOrderByCreatedAtDesc(String userId);
    List<NotificationDigest> findByUserIdAndDigestTypeOrderByCreatedAtDesc(String userId, DigestType digestType);
    Optional<NotificationDigest> findFirstByUserIdAndDigestTypeOrderByCreatedAtDesc(String userId, DigestType digestType);
    Optional<NotificationDigest> findByIdAndUserId(String id, String userId);
}
