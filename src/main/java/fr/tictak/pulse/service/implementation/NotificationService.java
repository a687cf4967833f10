package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.config.webSocket.SessionMessenger;
import fr.tictak.pulse.dto.out.MarkAllReadResponse;
import fr.tictak.pulse.dto.out.NotificationListResponse;
import fr.tictak.pulse.dto.out.PushEnvelope;
import fr.tictak.pulse.exception.ForbiddenException;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationRecipient;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.repository.NotificationRecipientRepository;
import fr.tictak.pulse.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final NotificationRecipientRepository recipientRepository;
    private final MongoTemplate mongoTemplate;
    private final SessionMessenger messenger;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository,
                               NotificationRecipientRepository recipientRepository,
                               MongoTemplate mongoTemplate, SessionMessenger messenger, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.recipientRepository = recipientRepository;
        this.mongoTemplate = mongoTemplate;
        this.messenger = messenger;
        this.clock = clock;
    }

    public NotificationListResponse list(String userId, boolean unreadOnly, NotificationType type) {
        List<Notification> notifications;
        if (type != null) {
            notifications = unreadOnly
                    ? notificationRepository.findByUserIdAndTypeAndReadOrderByCreatedAtDesc(userId, type, false)
                    : notificationRepository.findByUserIdAndTypeOrderByCreatedAtDesc(userId, type);
        } else {
            notifications = unreadOnly
                    ? notificationRepository.findByUserIdAndReadOrderByCreatedAtDesc(userId, false)
                    : notificationRepository.findByUserIdOrderByCreatedAtDesc(userId);
        }
        return new NotificationListResponse(notifications, notifications.size(), unreadCount(userId));
    }

    public Notification get(String userId, String notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> ResourceNotFoundException.of("Notification", notificationId));
        if (!notification.getUserId().equals(userId)) {
            throw new ForbiddenException("You do not have permission to access this notification");
        }
        return notification;
    }

    public long unreadCount(String userId) {
        return notificationRepository.countByUserIdAndRead(userId, false);
    }

    /**
     * Idempotent: a notification that is already read keeps its original {@code readAt}.
     */
    public Notification markAsRead(String userId, String notificationId) {
        Notification notification = get(userId, notificationId);
        if (notification.markRead(clock.instant())) {
            notification = notificationRepository.save(notification);
            log.info("Notification {} marked as read by user {}", notificationId, userId);
            pushUnreadCount(userId);
        }
        return notification;
    }

    public MarkAllReadResponse markAllAsRead(String userId) {
        Query query = new Query(Criteria.where("userId").is(userId).and("read").is(false));
        Update update = new Update().set("read", true).set("readAt", clock.instant());
        long updated = mongoTemplate.updateMulti(query, update, Notification.class).getModifiedCount();
        log.info("Marked {} notification(s) as read for user {}", updated, userId);
        pushUnreadCount(userId);
        return new MarkAllReadResponse("Marked " + updated + " notifications as read", updated);
    }

    public void delete(String userId, String notificationId) {
        Notification notification = get(userId, notificationId);
        notificationRepository.delete(notification);
        log.info("Notification {} deleted by user {}", notificationId, userId);
        pushUnreadCount(userId);
    }

    public NotificationRecipient updateFcmToken(String userId, String fcmToken) {
        NotificationRecipient recipient = recipientOf(userId);
        recipient.setFcmToken(fcmToken);
        recipient.setUpdatedAt(clock.instant());
        log.info("FCM token updated for user {}", userId);
        return recipientRepository.save(recipient);
    }

    public NotificationRecipient updateEmail(String userId, String email) {
        NotificationRecipient recipient = recipientOf(userId);
        recipient.setEmail(email);
        recipient.setUpdatedAt(clock.instant());
        return recipientRepository.save(recipient);
    }

    private NotificationRecipient recipientOf(String userId) {
        return recipientRepository.findById(userId).orElseGet(() -> new NotificationRecipient(userId));
    }

    private void pushUnreadCount(String userId) {
        long count = unreadCount(userId);
        try {
            messenger.toUser(userId, PushEnvelope.unreadCount(count));
        } catch (RuntimeException e) {
            log.warn("Could not push unread count to user {}: {}", userId, e.getMessage());
        }
    }
}
