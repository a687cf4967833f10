package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.config.AsyncConfig;
import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.dto.out.PatternInsights;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationPattern;
import fr.tictak.pulse.repository.NotificationPatternRepository;
import fr.tictak.pulse.service.PatternService;
import fr.tictak.pulse.service.dispatch.NotificationDispatchedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregates recurring notification signatures into per-user patterns. Observations for the same key are
 * serialized on a striped lock so concurrent dispatches never lose an increment.
 */
@Slf4j
@Service
public class PatternServiceImpl implements PatternService {

    static final String PATTERN_KEY = "pattern_key";
    private static final int STRIPES = 64;

    private final NotificationPatternRepository patternRepository;
    private final PulseProperties.Patterns settings;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public PatternServiceImpl(NotificationPatternRepository patternRepository, PulseProperties properties, Clock clock) {
        this.patternRepository = patternRepository;
        this.settings = properties.getPatterns();
        this.clock = clock;
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Async(AsyncConfig.CHANNEL_EXECUTOR)
    @EventListener
    public void onDispatched(NotificationDispatchedEvent event) {
        try {
            observe(event.notification());
        } catch (RuntimeException e) {
            log.error("Pattern aggregation failed for notification {}", event.notification().getId(), e);
        }
    }

    @Override
    public String patternKeyOf(Notification notification) {
        String type = notification.getType().getValue();
        Map<String, Object> metadata = notification.getMetadata();
        if (metadata == null || metadata.isEmpty()) {
            return type;
        }
        Object explicit = metadata.get(PATTERN_KEY);
        if (explicit != null && !explicit.toString().isBlank()) {
            return explicit.toString();
        }
        for (String key : settings.getSignatureKeys()) {
            Object value = metadata.get(key);
            if (value != null && !value.toString().isBlank()) {
                return type + ":" + key + "=" + value;
            }
        }
        return type;
    }

    @Override
    public NotificationPattern observe(Notification notification) {
        String key = patternKeyOf(notification);
        String userId = notification.getUserId();
        ReentrantLock lock = locks[Math.floorMod((userId + '\u0000' + key).hashCode(), STRIPES)];
        lock.lock();
        try {
            Instant now = clock.instant();
            List<NotificationPattern> existing = patternRepository.findByUserIdAndPatternKey(userId, key);
            if (existing.isEmpty()) {
                try {
                    return patternRepository.save(newPattern(userId, key, notification, now));
                } catch (DuplicateKeyException e) {
                    // written by another instance in the meantime
                    existing = patternRepository.findByUserIdAndPatternKey(userId, key);
                    if (existing.isEmpty()) {
                        throw e;
                    }
                }
            }
            NotificationPattern pattern = existing.get(0);
            pattern.setFrequency(pattern.getFrequency() + 1);
            pattern.setConfidence(Math.min(1.0, pattern.getConfidence() + settings.getConfidenceStep()));
            pattern.setLastOccurrence(now);
            log.debug("Pattern {} of user {} now at frequency {} and confidence {}",
                    key, userId, pattern.getFrequency(), pattern.getConfidence());
            return patternRepository.save(pattern);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int decayStale(Instant now) {
        Instant cutoff = now.minus(settings.getStaleAfter());
        int decayed = 0;
        for (NotificationPattern pattern : patternRepository.findByLastOccurrenceBefore(cutoff)) {
            if (pattern.getLastDecayAt() != null && pattern.getLastDecayAt().isAfter(cutoff)) {
                continue;
            }
            pattern.setConfidence(Math.max(0.0, pattern.getConfidence() * settings.getDecayFactor()));
            pattern.setLastDecayAt(now);
            patternRepository.save(pattern);
            decayed++;
        }
        if (decayed > 0) {
            log.info("Decayed confidence of {} stale pattern(s)", decayed);
        }
        return decayed;
    }

    @Override
    public List<NotificationPattern> list(String userId, String patternKey) {
        return patternKey == null || patternKey.isBlank()
                ? patternRepository.findByUserId(userId)
                : patternRepository.findByUserIdAndPatternKey(userId, patternKey);
    }

    @Override
    public NotificationPattern get(String userId, String patternId) {
        return patternRepository.findByIdAndUserId(patternId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Pattern", patternId));
    }

    @Override
    public void delete(String userId, String patternId) {
        patternRepository.delete(get(userId, patternId));
        log.info("Pattern {} deleted for user {}", patternId, userId);
    }

    @Override
    public PatternInsights insights(String userId, int topN) {
        List<NotificationPattern> patterns = patternRepository.findByUserId(userId);
        if (patterns.isEmpty()) {
            return new PatternInsights(0, 0.0, List.of(), List.of());
        }
        double average = patterns.stream().mapToDouble(NotificationPattern::getConfidence).average().orElse(0.0);
        int limit = Math.max(0, topN);
        List<NotificationPattern> mostConfident = patterns.stream()
                .sorted(Comparator.comparingDouble(NotificationPattern::getConfidence).reversed())
                .limit(limit)
                .toList();
        List<NotificationPattern> mostFrequent = patterns.stream()
                .sorted(Comparator.comparingLong(NotificationPattern::getFrequency).reversed())
                .limit(limit)
                .toList();
        return new PatternInsights(patterns.size(),
                BigDecimal.valueOf(average).setScale(3, RoundingMode.HALF_UP).doubleValue(),
                mostConfident, mostFrequent);
    }

    private NotificationPattern newPattern(String userId, String key, Notification notification, Instant now) {
        NotificationPattern pattern = new NotificationPattern();
        pattern.setUserId(userId);
        pattern.setPatternKey(key);
        pattern.setPatternType(notification.getType().getValue());
        pattern.setFrequency(1);
        pattern.setConfidence(settings.getInitialConfidence());
        pattern.setFirstSeen(now);
        pattern.setLastOccurrence(now);
        log.debug("New pattern {} for user {}", key, userId);
        return pattern;
    }
}
