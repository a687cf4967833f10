package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.dto.out.PendingDigestResult;
import fr.tictak.pulse.exception.BadRequestException;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationDigest;
import fr.tictak.pulse.model.enums.DigestType;
import fr.tictak.pulse.repository.NotificationDigestRepository;
import fr.tictak.pulse.service.DigestService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
public class DigestServiceImpl implements DigestService {

    private static final int TOP_TYPES_IN_SUMMARY = 3;

    private final MongoTemplate mongoTemplate;
    private final NotificationDigestRepository digestRepository;
    private final Clock clock;

    public DigestServiceImpl(MongoTemplate mongoTemplate, NotificationDigestRepository digestRepository, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.digestRepository = digestRepository;
        this.clock = clock;
    }

    @Override
    public NotificationDigest generate(String userId, DigestType type, Instant start, Instant end) {
        if ((start == null) != (end == null)) {
            throw new BadRequestException("start and end must be given together");
        }
        Instant periodEnd = end;
        Instant periodStart = start;
        if (start == null) {
            periodEnd = LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay().toInstant(ZoneOffset.UTC);
            periodStart = periodEnd.minus(type.getWindowDays(), ChronoUnit.DAYS);
        } else if (!start.isBefore(end)) {
            throw new BadRequestException("start must be before end");
        }

        List<Notification> notifications = mongoTemplate.find(periodQuery(userId, periodStart, periodEnd),
                Notification.class);

        NotificationDigest digest = new NotificationDigest();
        digest.setUserId(userId);
        digest.setDigestType(type);
        digest.setPeriodStart(periodStart);
        digest.setPeriodEnd(periodEnd);
        digest.setNotificationCount(notifications.size());
        digest.setUnreadCount(notifications.stream().filter(n -> !n.isRead()).count());
        digest.setHighPriorityCount(notifications.stream().filter(Notification::isHighPriority).count());
        digest.setCountsByType(countsByType(notifications));
        digest.setSummaryText(summarize(type, digest));
        digest.setCreatedAt(clock.instant());

        NotificationDigest saved = digestRepository.save(digest);
        log.info("Created {} digest for user {}: {} notifications", type.getValue(), userId, notifications.size());
        return saved;
    }

    @Override
    public Optional<NotificationDigest> getLatest(String userId, DigestType type) {
        return digestRepository.findFirstByUserIdAndDigestTypeOrderByCreatedAtDesc(userId, type);
    }

    @Override
    public List<NotificationDigest> list(String userId, DigestType type) {
        return type == null
                ? digestRepository.findByUserIdOrderByCreatedAtDesc(userId)
                : digestRepository.findByUserIdAndDigestTypeOrderByCreatedAtDesc(userId, type);
    }

    @Override
    public NotificationDigest get(String userId, String digestId) {
        return digestRepository.findByIdAndUserId(digestId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Digest", digestId));
    }

    @Override
    public PendingDigestResult generatePending(String userId) {
        Instant now = clock.instant();
        List<NotificationDigest> generated = new ArrayList<>();
        List<DigestType> skipped = new ArrayList<>();
        for (DigestType type : DigestType.values()) {
            Optional<NotificationDigest> latest = getLatest(userId, type);
            boolean due = latest.isEmpty()
                    || latest.get().getCreatedAt() == null
                    || !latest.get().getCreatedAt().plus(type.getRegenerateAfter()).isAfter(now);
            if (due) {
                generated.add(generate(userId, type, null, null));
            } else {
                skipped.add(type);
            }
        }
        return new PendingDigestResult(generated, skipped);
    }

    private static Map<String, Long> countsByType(List<Notification> notifications) {
        return notifications.stream()
                .filter(n -> n.getType() != null)
                .collect(Collectors.groupingBy(n -> n.getType().getValue(), LinkedHashMap::new, Collectors.counting()));
    }

    /**
     * Notifications of {@code userId} created in {@code [start, end)}. Both bounds go on one criterion:
     * a document cannot hold {@code createdAt} twice.
     */
    static Query periodQuery(String userId, Instant start, Instant end) {
        return new Query(Criteria.where("userId").is(userId).and("createdAt").gte(start).lt(end));
    }

    static String summarize(DigestType type, NotificationDigest digest) {
        String period = type.getPeriodLabel();
        if (digest.getNotificationCount() == 0) {
            return "No notifications this " + period + ".";
        }
        StringBuilder summary = new StringBuilder()
                .append("You received ").append(digest.getNotificationCount())
                .append(digest.getNotificationCount() == 1 ? " notification" : " notifications")
                .append(" this ").append(period).append(". ")
                .append(digest.getUnreadCount()).append(" unread, ")
                .append(digest.getHighPriorityCount()).append(" high priority.");
        String top = digest.getCountsByType().entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TYPES_IN_SUMMARY)
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
        if (!top.isEmpty()) {
            summary.append(" Most frequent: ").append(top).append('.');
        }
        return summary.toString();
    }
}
