package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.dto.out.PendingDigestResult;
import fr.tictak.pulse.exception.BadRequestException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationDigest;
import fr.tictak.pulse.model.enums.DigestType;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.repository.NotificationDigestRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DigestServiceImpl Unit Tests")
class DigestServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:00Z");
    private static final Instant MIDNIGHT = Instant.parse("2026-03-02T00:00:00Z");
    private static final String USER = "user-1";

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private NotificationDigestRepository digestRepository;

    private DigestServiceImpl digestService;

    @BeforeEach
    void setUp() {
        digestService = new DigestServiceImpl(mongoTemplate, digestRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Notification notification(NotificationType type, boolean read, String priority) {
        Notification notification = new Notification(USER, type, "t", "m",
                priority != null ? Map.of("priority", priority) : Map.of());
        if (read) {
            notification.markRead(NOW);
        }
        return notification;
    }

    @Test
    @DisplayName("Should aggregate the default window ending at today's UTC midnight")
    void shouldGenerateDefaultWindow() {
        // Given
        Instant start = MIDNIGHT.minus(Duration.ofDays(7));
        when(mongoTemplate.find(any(Query.class), eq(Notification.class)))
                .thenReturn(List.of(
                        notification(NotificationType.TASK_DUE_SOON, false, "high"),
                        notification(NotificationType.TASK_DUE_SOON, true, null),
                        notification(NotificationType.SYSTEM, false, "low")));
        when(digestRepository.save(any(NotificationDigest.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        NotificationDigest digest = digestService.generate(USER, DigestType.WEEKLY, null, null);

        // Then
        assertThat(digest.getPeriodStart()).isEqualTo(start);
        assertThat(digest.getPeriodEnd()).isEqualTo(MIDNIGHT);
        assertThat(digest.getNotificationCount()).isEqualTo(3);
        assertThat(digest.getUnreadCount()).isEqualTo(2);
        assertThat(digest.getHighPriorityCount()).isEqualTo(1);
        assertThat(digest.getCountsByType()).containsEntry("task_due_soon", 2L).containsEntry("system", 1L);
        assertThat(digest.getSummaryText()).isEqualTo(
                "You received 3 notifications this week. 2 unread, 1 high priority. "
                        + "Most frequent: task_due_soon (2), system (1).");
        assertThat(digest.getCreatedAt()).isEqualTo(NOW);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(Notification.class));
        assertThat(query.getValue().getQueryObject())
                .isEqualTo(new Document("userId", USER)
                        .append("createdAt", new Document("$gte", start).append("$lt", MIDNIGHT)));
    }

    @Test
    @DisplayName("Should describe an empty period")
    void shouldSummarizeEmptyPeriod() {
        // Given
        when(mongoTemplate.find(any(Query.class), eq(Notification.class)))
                .thenReturn(List.of());
        when(digestRepository.save(any(NotificationDigest.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        NotificationDigest digest = digestService.generate(USER, DigestType.DAILY, null, null);

        // Then
        assertThat(digest.getSummaryText()).isEqualTo("No notifications this day.");
        assertThat(digest.getCountsByType()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a half-specified or inverted window")
    void shouldRejectInvalidWindow() {
        // When / Then
        assertThatThrownBy(() -> digestService.generate(USER, DigestType.DAILY, NOW, null))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> digestService.generate(USER, DigestType.DAILY, NOW, NOW))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    @DisplayName("Should regenerate only the digest types whose latest version is old enough")
    void shouldGeneratePending() {
        // Given
        NotificationDigest freshWeekly = new NotificationDigest();
        freshWeekly.setCreatedAt(NOW.minus(Duration.ofDays(2)));
        NotificationDigest oldMonthly = new NotificationDigest();
        oldMonthly.setCreatedAt(NOW.minus(Duration.ofDays(28)));
        when(digestRepository.findFirstByUserIdAndDigestTypeOrderByCreatedAtDesc(USER, DigestType.DAILY))
                .thenReturn(Optional.empty());
        when(digestRepository.findFirstByUserIdAndDigestTypeOrderByCreatedAtDesc(USER, DigestType.WEEKLY))
                .thenReturn(Optional.of(freshWeekly));
        when(digestRepository.findFirstByUserIdAndDigestTypeOrderByCreatedAtDesc(USER, DigestType.MONTHLY))
                .thenReturn(Optional.of(oldMonthly));
        when(mongoTemplate.find(any(Query.class), eq(Notification.class)))
                .thenReturn(List.of());
        when(digestRepository.save(any(NotificationDigest.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        PendingDigestResult result = digestService.generatePending(USER);

        // Then
        assertThat(result.generated()).extracting(NotificationDigest::getDigestType)
                .containsExactly(DigestType.DAILY, DigestType.MONTHLY);
        assertThat(result.skipped()).containsExactly(DigestType.WEEKLY);
    }

    @Test
    @DisplayName("Should bound the period with a single createdAt range")
    void shouldBuildPeriodQueryWithOneCreatedAtCriterion() {
        // Given
        Instant start = Instant.parse("2026-02-01T00:00:00Z");
        Instant end = Instant.parse("2026-03-01T00:00:00Z");

        // When
        Query query = DigestServiceImpl.periodQuery(USER, start, end);

        // Then
        Document createdAt = query.getQueryObject().get("createdAt", Document.class);
        assertThat(createdAt).containsEntry("$gte", start).containsEntry("$lt", end).hasSize(2);
        assertThat(query.getQueryObject().getString("userId")).isEqualTo(USER);
    }

    @Test
    @DisplayName("Should use singular wording for one notification")
    void shouldUseSingularWording() {
        // Given
        NotificationDigest digest = new NotificationDigest();
        digest.setNotificationCount(1);
        digest.setUnreadCount(1);
        digest.setCountsByType(Map.of("achievement", 1L));

        // When
        String summary = DigestServiceImpl.summarize(DigestType.MONTHLY, digest);

        // Then
        assertThat(summary).isEqualTo(
                "You received 1 notification this month. 1 unread, 0 high priority. Most frequent: achievement (1).");
    }
}
