package fr.tictak.pulse.service.job;

import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.repository.NotificationRepository;
import fr.tictak.pulse.service.PatternService;
import fr.tictak.pulse.service.SourceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Component
public class NotificationMaintenanceJob {

    private final NotificationRepository notificationRepository;
    private final PatternService patternService;
    private final SourceService sourceService;
    private final PulseProperties properties;
    private final Clock clock;

    public NotificationMaintenanceJob(NotificationRepository notificationRepository, PatternService patternService,
                                      SourceService sourceService, PulseProperties properties, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.patternService = patternService;
        this.sourceService = sourceService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Daily: purge read notifications past retention, then decay idle patterns.
     */
    @Scheduled(cron = "${pulse.cleanup.cron:0 30 3 * * *}", zone = "UTC")
    public void runDaily() {
        Instant now = clock.instant();
        try {
            long deleted = purgeReadNotifications(now);
            log.info("Maintenance: deleted {} read notification(s) older than {}", deleted,
                    properties.getCleanup().getReadRetention());
        } catch (RuntimeException e) {
            log.error("Maintenance: read notification cleanup failed", e);
        }
        try {
            patternService.decayStale(now);
        } catch (RuntimeException e) {
            log.error("Maintenance: pattern decay failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${pulse.sources.collection-interval:PT5M}",
            initialDelayString = "${pulse.sources.collection-interval:PT5M}")
    public void collectDueSources() {
        try {
            sourceService.collectDueSources(clock.instant());
        } catch (RuntimeException e) {
            log.error("Maintenance: scheduled source collection failed", e);
        }
    }

    long purgeReadNotifications(Instant now) {
        return notificationRepository.deleteByReadIsTrueAndReadAtBefore(now.minus(properties.getCleanup().getReadRetention()));
    }
}
