package fr.tictak.pulse.service.rules;

import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationRule;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.model.enums.RuleActionType;
import fr.tictak.pulse.model.rule.RuleAction;
import fr.tictak.pulse.model.rule.RuleCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleEngine")
class RuleEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final RuleEngine engine = new RuleEngine(new ConditionEvaluator());

    private static NotificationRule rule(String id, int priority, RuleCondition condition, RuleAction... actions) {
        NotificationRule rule = new NotificationRule();
        rule.setId(id);
        rule.setName("rule " + id);
        rule.setPriority(priority);
        rule.setCondition(condition);
        rule.setActions(List.of(actions));
        return rule;
    }

    private static Notification notification() {
        Notification notification = new Notification("user-1", NotificationType.CAPACITY_OVERLOAD, "Overloaded",
                "Week 12 is over capacity", Map.of("load", 130));
        notification.setId("n-1");
        return notification;
    }

    @Test
    @DisplayName("Should evaluate rules by priority descending, then by id")
    void shouldEvaluateInPriorityOrder() {
        // Given
        RuleCondition always = RuleCondition.field("type", "exists", true);
        List<NotificationRule> rules = List.of(
                rule("b", 1, always, RuleAction.annotate("from", "b")),
                rule("c", 5, always, RuleAction.annotate("from", "c")),
                rule("a", 1, always, RuleAction.annotate("from", "a")));

        // When
        RuleEvaluation evaluation = engine.evaluate(notification(), rules);

        // Then
        assertThat(evaluation.evaluatedRuleIds()).containsExactly("c", "a", "b");
        assertThat(evaluation.matchedRuleIds()).containsExactly("c", "a", "b");
        assertThat(evaluation.suppressed()).isFalse();
    }

    @Test
    @DisplayName("Should stop at the first suppressing rule")
    void shouldStopAtSuppress() {
        // Given
        RuleCondition overloaded = RuleCondition.field("load", ">", 100);
        List<NotificationRule> rules = List.of(
                rule("high", 10, overloaded, RuleAction.forceChannel(DeliveryChannel.EMAIL)),
                rule("mute", 5, overloaded, RuleAction.suppress()),
                rule("low", 1, overloaded, RuleAction.forceChannel(DeliveryChannel.PUSH)));

        // When
        RuleEvaluation evaluation = engine.evaluate(notification(), rules);

        // Then
        assertThat(evaluation.suppressedBy()).isEqualTo("mute");
        assertThat(evaluation.evaluatedRuleIds()).containsExactly("high", "mute");
        assertThat(evaluation.forcedChannels()).containsExactly(DeliveryChannel.EMAIL);
    }

    @Test
    @DisplayName("Should skip disabled rules and rules that fail to evaluate")
    void shouldSkipDisabledAndBrokenRules() {
        // Given
        NotificationRule disabled = rule("off", 9, RuleCondition.field("load", ">", 1), RuleAction.suppress());
        disabled.setEnabled(false);
        NotificationRule broken = rule("broken", 8, RuleCondition.field("load", "bogus", 1), RuleAction.suppress());
        NotificationRule working = rule("ok", 1, RuleCondition.field("load", ">", 1),
                RuleAction.disableChannel(DeliveryChannel.EMAIL));

        // When
        RuleEvaluation evaluation = engine.evaluate(notification(), List.of(disabled, broken, working));

        // Then
        assertThat(evaluation.evaluatedRuleIds()).containsExactly("broken", "ok");
        assertThat(evaluation.matchedRuleIds()).containsExactly("ok");
        assertThat(evaluation.disabledChannels()).containsExactly(DeliveryChannel.EMAIL);
    }

    @Test
    @DisplayName("Should apply annotate, set_priority and mark_read to the notification")
    void shouldApplyMutations() {
        // Given
        Notification notification = notification();
        RuleEvaluation evaluation = new RuleEvaluation(List.of(
                RuleAction.annotate("team", "ops"),
                RuleAction.setPriority("high"),
                RuleAction.of(RuleActionType.MARK_READ)), List.of("r"), List.of("r"), null);

        // When
        boolean changed = engine.applyMutations(notification, evaluation, NOW);

        // Then
        assertThat(changed).isTrue();
        assertThat(notification.getMetadata()).containsEntry("team", "ops").containsEntry("priority", "high");
        assertThat(notification.isRead()).isTrue();
        assertThat(notification.getReadAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should report no change when only channel actions matched")
    void shouldNotChangeOnChannelActions() {
        // Given
        RuleEvaluation evaluation = new RuleEvaluation(List.of(RuleAction.forceChannel(DeliveryChannel.PUSH)),
                List.of("r"), List.of("r"), null);

        // When / Then
        assertThat(engine.applyMutations(notification(), evaluation, NOW)).isFalse();
    }
}
