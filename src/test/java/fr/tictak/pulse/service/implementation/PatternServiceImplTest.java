package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.dto.out.PatternInsights;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationPattern;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.repository.NotificationPatternRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PatternServiceImpl Unit Tests")
class PatternServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final String USER = "user-1";

    @Mock
    private NotificationPatternRepository patternRepository;

    private PatternServiceImpl patternService;

    @BeforeEach
    void setUp() {
        patternService = new PatternServiceImpl(patternRepository, new PulseProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Notification notification(Map<String, Object> metadata) {
        return new Notification(USER, NotificationType.TASK_DUE_SOON, "Due", "Due soon", metadata);
    }

    private static NotificationPattern pattern(String key, double confidence, long frequency, Instant lastOccurrence) {
        NotificationPattern pattern = new NotificationPattern();
        pattern.setId("p-" + key);
        pattern.setUserId(USER);
        pattern.setPatternKey(key);
        pattern.setConfidence(confidence);
        pattern.setFrequency(frequency);
        pattern.setLastOccurrence(lastOccurrence);
        return pattern;
    }

    @Test
    @DisplayName("Should derive the pattern key from explicit key, signature metadata or type")
    void shouldDerivePatternKey() {
        // When / Then
        assertThat(patternService.patternKeyOf(notification(Map.of("pattern_key", "weekly-report"))))
                .isEqualTo("weekly-report");
        assertThat(patternService.patternKeyOf(notification(Map.of("big_rock", "launch", "category", "work"))))
                .isEqualTo("task_due_soon:big_rock=launch");
        assertThat(patternService.patternKeyOf(notification(Map.of("unrelated", "x"))))
                .isEqualTo("task_due_soon");
        assertThat(patternService.patternKeyOf(notification(null))).isEqualTo("task_due_soon");
    }

    @Test
    @DisplayName("Should grow one pattern per big rock across repeated observations")
    void shouldAccumulateRepeatedObservations() {
        // Given
        Map<String, NotificationPattern> stored = new HashMap<>();
        when(patternRepository.findByUserIdAndPatternKey(eq(USER), anyString()))
                .thenAnswer(inv -> Optional.ofNullable(stored.get(inv.<String>getArgument(1)))
                        .map(List::of).orElse(List.of()));
        when(patternRepository.save(any(NotificationPattern.class))).thenAnswer(inv -> {
            NotificationPattern saved = inv.getArgument(0);
            stored.put(saved.getPatternKey(), saved);
            return saved;
        });
        Notification health = notification(Map.of("big_rock", "Health"));

        // When
        double afterFirst = patternService.observe(health).getConfidence();
        NotificationPattern last = null;
        for (int i = 1; i < 5; i++) {
            last = patternService.observe(health);
        }

        // Then
        assertThat(stored).containsOnlyKeys("task_due_soon:big_rock=Health");
        assertThat(last.getFrequency()).isEqualTo(5);
        assertThat(last.getConfidence()).isGreaterThan(afterFirst).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Should create a pattern at the initial confidence on first observation")
    void shouldCreatePattern() {
        // Given
        when(patternRepository.findByUserIdAndPatternKey(USER, "task_due_soon")).thenReturn(List.of());
        when(patternRepository.save(any(NotificationPattern.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        NotificationPattern pattern = patternService.observe(notification(Map.of()));

        // Then
        assertThat(pattern.getFrequency()).isEqualTo(1);
        assertThat(pattern.getConfidence()).isEqualTo(0.5);
        assertThat(pattern.getFirstSeen()).isEqualTo(NOW);
        assertThat(pattern.getPatternType()).isEqualTo("task_due_soon");
    }

    @Test
    @DisplayName("Should raise frequency and confidence on a repeat, capped at 1")
    void shouldReinforcePattern() {
        // Given
        NotificationPattern existing = pattern("task_due_soon", 0.95, 9, NOW.minusSeconds(60));
        when(patternRepository.findByUserIdAndPatternKey(USER, "task_due_soon")).thenReturn(List.of(existing));
        when(patternRepository.save(existing)).thenReturn(existing);

        // When
        NotificationPattern pattern = patternService.observe(notification(Map.of()));

        // Then
        assertThat(pattern.getFrequency()).isEqualTo(10);
        assertThat(pattern.getConfidence()).isEqualTo(1.0);
        assertThat(pattern.getLastOccurrence()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should fold a concurrent insert into an increment")
    void shouldRecoverFromDuplicateInsert() {
        // Given
        NotificationPattern concurrent = pattern("task_due_soon", 0.5, 1, NOW);
        when(patternRepository.findByUserIdAndPatternKey(USER, "task_due_soon"))
                .thenReturn(List.of())
                .thenReturn(List.of(concurrent));
        when(patternRepository.save(any(NotificationPattern.class)))
                .thenThrow(new DuplicateKeyException("dup"))
                .thenAnswer(inv -> inv.getArgument(0));

        // When
        NotificationPattern pattern = patternService.observe(notification(Map.of()));

        // Then
        assertThat(pattern.getFrequency()).isEqualTo(2);
        assertThat(pattern.getConfidence()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("Should decay stale patterns once per staleness window")
    void shouldDecayStalePatterns() {
        // Given
        Instant cutoff = NOW.minus(Duration.ofDays(7));
        NotificationPattern stale = pattern("a", 0.8, 3, cutoff.minusSeconds(3600));
        NotificationPattern alreadyDecayed = pattern("b", 0.8, 3, cutoff.minusSeconds(3600));
        alreadyDecayed.setLastDecayAt(NOW.minus(Duration.ofDays(1)));
        when(patternRepository.findByLastOccurrenceBefore(cutoff)).thenReturn(List.of(stale, alreadyDecayed));

        // When
        int decayed = patternService.decayStale(NOW);

        // Then
        assertThat(decayed).isEqualTo(1);
        assertThat(stale.getConfidence()).isCloseTo(0.72, within(1e-9));
        assertThat(stale.getLastDecayAt()).isEqualTo(NOW);
        assertThat(alreadyDecayed.getConfidence()).isEqualTo(0.8);
        verify(patternRepository, never()).save(alreadyDecayed);
    }

    @Test
    @DisplayName("Should summarize patterns with a rounded average and top lists")
    void shouldBuildInsights() {
        // Given
        NotificationPattern a = pattern("a", 0.9, 2, NOW);
        NotificationPattern b = pattern("b", 0.3, 12, NOW);
        NotificationPattern c = pattern("c", 0.4, 5, NOW);
        when(patternRepository.findByUserId(USER)).thenReturn(List.of(a, b, c));

        // When
        PatternInsights insights = patternService.insights(USER, 2);

        // Then
        assertThat(insights.totalPatterns()).isEqualTo(3);
        assertThat(insights.averageConfidence()).isEqualTo(0.533);
        assertThat(insights.mostConfidentPatterns()).containsExactly(a, c);
        assertThat(insights.mostFrequentPatterns()).containsExactly(b, c);
    }

    @Test
    @DisplayName("Should return empty insights for a user without patterns")
    void shouldReturnEmptyInsights() {
        // Given
        when(patternRepository.findByUserId(USER)).thenReturn(List.of());

        // When
        PatternInsights insights = patternService.insights(USER, 5);

        // Then
        assertThat(insights.totalPatterns()).isZero();
        assertThat(insights.averageConfidence()).isZero();
        assertThat(insights.mostConfidentPatterns()).isEmpty();
    }
}
