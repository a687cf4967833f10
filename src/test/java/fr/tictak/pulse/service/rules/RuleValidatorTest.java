package fr.tictak.pulse.service.rules;

import fr.tictak.pulse.exception.ValidationException;
import fr.tictak.pulse.model.NotificationRule;
import fr.tictak.pulse.model.enums.RuleActionType;
import fr.tictak.pulse.model.rule.RuleAction;
import fr.tictak.pulse.model.rule.RuleCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("RuleValidator")
class RuleValidatorTest {

    private final RuleValidator validator = new RuleValidator();

    private static NotificationRule rule(RuleCondition condition, List<RuleAction> actions) {
        NotificationRule rule = new NotificationRule();
        rule.setName("Escalate overloads");
        rule.setCondition(condition);
        rule.setActions(actions);
        return rule;
    }

    @Test
    @DisplayName("Should accept a well-formed rule")
    void shouldAcceptValidRule() {
        // Given
        NotificationRule rule = rule(
                RuleCondition.all(RuleCondition.field("type", "==", "capacity_overload"),
                        RuleCondition.field("load", ">=", 100)),
                List.of(RuleAction.setPriority("high")));

        // When / Then
        assertThatCode(() -> validator.validate(rule)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should collect every violation in one exception")
    void shouldCollectAllViolations() {
        // Given
        NotificationRule rule = rule(
                RuleCondition.any(RuleCondition.field("", "bogus", 1),
                        RuleCondition.field("load", ">", "lots"),
                        RuleCondition.field("team", "in", "ops"),
                        RuleCondition.field("title", "regex", "(")),
                List.of(new RuleAction(RuleActionType.FORCE_CHANNEL, Map.of("channel", "pigeon"))));
        rule.setName(" ");

        // When
        ValidationException error = catchThrowableOfType(() -> validator.validate(rule), ValidationException.class);

        // Then
        assertThat(error.getViolations()).hasSize(7)
                .contains("name is required",
                        "condition.conditions[0]: field is required",
                        "condition.conditions[0]: unknown operator 'bogus'",
                        "condition.conditions[1]: operator > requires a numeric value",
                        "condition.conditions[2]: operator in requires a list value",
                        "actions[0]: unknown channel 'pigeon'")
                .anyMatch(v -> v.startsWith("condition.conditions[3]: invalid regex"));
    }

    @Test
    @DisplayName("Should reject a rule without actions or condition")
    void shouldRequireConditionAndActions() {
        // Given
        NotificationRule rule = rule(null, List.of());

        // When / Then
        assertThatThrownBy(() -> validator.validate(rule))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("condition is required")
                .hasMessageContaining("at least one action is required");
    }

    @Test
    @DisplayName("Should reject conditions nested deeper than the limit")
    void shouldRejectDeepNesting() {
        // Given
        RuleCondition condition = RuleCondition.field("type", "exists", true);
        for (int i = 0; i < RuleValidator.MAX_DEPTH; i++) {
            condition = RuleCondition.not(condition);
        }
        NotificationRule rule = rule(condition, List.of(RuleAction.suppress()));

        // When / Then
        assertThatThrownBy(() -> validator.validate(rule))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("nesting exceeds " + RuleValidator.MAX_DEPTH);
    }

    @Test
    @DisplayName("Should require the parameters of annotate and set_priority")
    void shouldRequireActionParameters() {
        // Given
        NotificationRule rule = rule(RuleCondition.field("type", "exists", true), List.of(
                new RuleAction(RuleActionType.ANNOTATE, Map.of("key", "team")),
                new RuleAction(RuleActionType.SET_PRIORITY, Map.of())));

        // When
        ValidationException error = catchThrowableOfType(() -> validator.validate(rule), ValidationException.class);

        // Then
        assertThat(error.getViolations()).containsExactly(
                "actions[0]: annotate requires a value",
                "actions[1]: set_priority requires a priority");
    }
}
