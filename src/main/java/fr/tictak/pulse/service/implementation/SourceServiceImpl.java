package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.concurrent.BoundedWorkerPool;
import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.dto.in.SourceRequest;
import fr.tictak.pulse.dto.out.AuthTestResult;
import fr.tictak.pulse.dto.out.SyncResult;
import fr.tictak.pulse.exception.BadRequestException;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.exception.TooManyRequestsException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationSource;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.repository.NotificationSourceRepository;
import fr.tictak.pulse.service.SourceService;
import fr.tictak.pulse.service.dispatch.DeliveryDispatcher;
import fr.tictak.pulse.service.source.CollectedItem;
import fr.tictak.pulse.service.source.SourceConnector;
import fr.tictak.pulse.service.source.SourceConnectorException;
import fr.tictak.pulse.service.source.SourceConnectorRegistry;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class SourceServiceImpl implements SourceService {

    private static final Logger log = LoggerFactory.getLogger(SourceServiceImpl.class);

    static final String SOURCE_ID_KEY = "source_id";
    static final String SOURCE_TYPE_KEY = "source_type";

    private final NotificationSourceRepository sourceRepository;
    private final SourceConnectorRegistry connectorRegistry;
    private final DeliveryDispatcher dispatcher;
    private final BoundedWorkerPool workerPool;
    private final Clock clock;
    private final int syncLimitPerHour;
    private final ConcurrentHashMap<String, Bucket> userBuckets = new ConcurrentHashMap<>();

    public SourceServiceImpl(NotificationSourceRepository sourceRepository, SourceConnectorRegistry connectorRegistry,
                             DeliveryDispatcher dispatcher, BoundedWorkerPool workerPool, PulseProperties properties,
                             Clock clock) {
        this.sourceRepository = sourceRepository;
        this.connectorRegistry = connectorRegistry;
        this.dispatcher = dispatcher;
        this.workerPool = workerPool;
        this.clock = clock;
        this.syncLimitPerHour = properties.getSources().getSyncLimitPerHour();
    }

    @Override
    public List<NotificationSource> list(String userId) {
        return sourceRepository.findByUserId(userId);
    }

    @Override
    public NotificationSource get(String userId, String sourceId) {
        return sourceRepository.findByIdAndUserId(sourceId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Source", sourceId));
    }

    @Override
    public NotificationSource create(String userId, SourceRequest request) {
        if (request.sourceType() == null) {
            throw new BadRequestException("sourceType is required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new BadRequestException("name is required");
        }
        NotificationSource source = new NotificationSource();
        source.setUserId(userId);
        apply(source, request);
        Instant now = clock.instant();
        source.setCreatedAt(now);
        source.setUpdatedAt(now);
        NotificationSource saved = sourceRepository.save(source);
        log.info("Source {} ({}) created for user {}", saved.getId(), saved.getSourceType().getValue(), userId);
        return saved;
    }

    @Override
    public NotificationSource update(String userId, String sourceId, SourceRequest request) {
        NotificationSource source = get(userId, sourceId);
        apply(source, request);
        source.setUpdatedAt(clock.instant());
        return sourceRepository.save(source);
    }

    @Override
    public void delete(String userId, String sourceId) {
        sourceRepository.delete(get(userId, sourceId));
        log.info("Source {} deleted for user {}", sourceId, userId);
    }

    @Override
    public AuthTestResult testAuth(String userId, String sourceId) {
        NotificationSource source = get(userId, sourceId);
        Optional<SourceConnector> connector = connectorRegistry.find(source.getSourceType());
        if (connector.isEmpty()) {
            return AuthTestResult.failed(noConnector(source));
        }
        try {
            return AuthTestResult.ok(connector.get().testAuthentication(source));
        } catch (SourceConnectorException e) {
            log.warn("Authentication test failed for source {}: {}", sourceId, e.getMessage());
            return AuthTestResult.failed(e.getMessage());
        }
    }

    @Override
    public SyncResult triggerCollection(String userId, String sourceId) {
        NotificationSource source = get(userId, sourceId);
        consumeSyncToken(userId);
        return collect(source);
    }

    @Override
    public List<SyncResult> syncAll(String userId) {
        List<NotificationSource> sources = sourceRepository.findByUserIdAndEnabledIsTrue(userId);
        consumeSyncToken(userId);
        return toResults(sources, workerPool.runAll(sources, this::collect));
    }

    @Override
    public int collectDueSources(Instant now) {
        List<NotificationSource> due = sourceRepository.findByEnabledIsTrue().stream()
                .filter(source -> isDue(source, now))
                .toList();
        if (due.isEmpty()) {
            return 0;
        }
        List<SyncResult> results = toResults(due, workerPool.runAll(due, this::collect));
        long failed = results.stream().filter(r -> !r.success()).count();
        log.info("Scheduled collection ran for {} source(s), {} failed", due.size(), failed);
        return due.size();
    }

    SyncResult collect(NotificationSource source) {
        Optional<SourceConnector> connector = connectorRegistry.find(source.getSourceType());
        Instant startedAt = clock.instant();
        if (connector.isEmpty()) {
            String error = noConnector(source);
            recordSync(source, startedAt, 0, error);
            return SyncResult.failed(source.getId(), error);
        }

        List<CollectedItem> items;
        try {
            items = connector.get().collect(source, source.getLastSync());
        } catch (SourceConnectorException e) {
            log.warn("Collection failed for source {} of user {}: {}", source.getId(), source.getUserId(), e.getMessage());
            recordSync(source, startedAt, 0, e.getMessage());
            return SyncResult.failed(source.getId(), e.getMessage());
        }

        int collected = 0;
        List<String> errors = new ArrayList<>();
        for (CollectedItem item : items) {
            try {
                dispatcher.dispatch(toNotification(source, item));
                collected++;
            } catch (RuntimeException e) {
                log.error("Could not dispatch item '{}' of source {}", item.title(), source.getId(), e);
                errors.add(item.title() + ": " + e.getMessage());
            }
        }
        recordSync(source, startedAt, collected, errors.isEmpty() ? null : String.join("; ", errors));
        log.info("Collected {} item(s) from source {} of user {}", collected, source.getId(), source.getUserId());
        return new SyncResult(source.getId(), errors.isEmpty(), collected, List.copyOf(errors));
    }

    private Notification toNotification(NotificationSource source, CollectedItem item) {
        Map<String, Object> metadata = new HashMap<>(item.metadata());
        metadata.put(SOURCE_ID_KEY, source.getId());
        metadata.put(SOURCE_TYPE_KEY, source.getSourceType().getValue());
        Notification notification = new Notification(source.getUserId(), NotificationType.SOURCE_ITEM_READY,
                item.title(), item.message(), metadata);
        notification.setSourceId(source.getId());
        return notification;
    }

    private void recordSync(NotificationSource source, Instant at, int collected, String error) {
        source.setLastSync(at);
        source.setLastError(error);
        source.setTotalCollected(source.getTotalCollected() + collected);
        sourceRepository.save(source);
    }

    private boolean isDue(NotificationSource source, Instant now) {
        return source.getLastSync() == null
                || !source.getLastSync().plus(Duration.ofMinutes(source.getSyncFrequencyMinutes())).isAfter(now);
    }

    private void consumeSyncToken(String userId) {
        Bucket bucket = userBuckets.computeIfAbsent(userId, k -> {
            Bandwidth limit = Bandwidth.classic(syncLimitPerHour, Refill.intervally(syncLimitPerHour, Duration.ofHours(1)));
            return Bucket.builder().addLimit(limit).build();
        });
        if (!bucket.tryConsume(1)) {
            log.warn("Sync rate limit reached for user {}", userId);
            throw new TooManyRequestsException("Too many sync requests. Limit is " + syncLimitPerHour + " per hour");
        }
    }

    private static List<SyncResult> toResults(List<NotificationSource> sources,
                                              List<BoundedWorkerPool.ItemResult<SyncResult>> results) {
        List<SyncResult> out = new ArrayList<>(results.size());
        for (BoundedWorkerPool.ItemResult<SyncResult> result : results) {
            out.add(result.isSuccess()
                    ? result.value()
                    : SyncResult.failed(sources.get(result.index()).getId(), String.valueOf(result.error().getMessage())));
        }
        return out;
    }

    private static String noConnector(NotificationSource source) {
        return "No connector registered for " + source.getSourceType().getValue();
    }

    private static void apply(NotificationSource source, SourceRequest request) {
        if (request.sourceType() != null) {
            source.setSourceType(request.sourceType());
        }
        if (request.name() != null) {
            source.setName(request.name().trim());
        }
        if (request.credentials() != null) {
            source.setCredentials(new HashMap<>(request.credentials()));
        }
        if (request.settings() != null) {
            source.setSettings(new HashMap<>(request.settings()));
        }
        if (request.enabled() != null) {
            source.setEnabled(request.enabled());
        }
        if (request.syncFrequencyMinutes() != null) {
            source.setSyncFrequencyMinutes(request.syncFrequencyMinutes());
        }
    }
}
