package fr.tictak.pulse.repository;

import fr.tictak.pulse.model.NotificationRecipient;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface NotificationRecipientRepository extends MongoRepository<NotificationRecipient, String> {
}
