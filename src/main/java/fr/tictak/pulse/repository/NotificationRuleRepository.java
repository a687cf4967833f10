package fr.tictak.pulse.repository;

import fr.tictak.pulse.model.NotificationRule;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface NotificationRuleRepository extends MongoRepository<NotificationRule, String> {
    List<NotificationRule> findByUserIdOrderByPriorityDesc(String userId);
    List<NotificationRule> findByUserIdAndEnabledIsTrue(String userId);
    Optional<NotificationRule> findByIdAndUserId(String id, String userId);
}
