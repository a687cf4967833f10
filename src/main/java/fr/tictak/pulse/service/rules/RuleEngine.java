package fr.tictak.pulse.service.rules;

import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationRule;
import fr.tictak.pulse.model.enums.RuleActionType;
import fr.tictak.pulse.model.rule.RuleAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates rules in priority order and accumulates the actions of every match. A {@code suppress} action ends
 * the evaluation: later rules are not evaluated at all.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final ConditionEvaluator conditionEvaluator;

    public RuleEngine(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public RuleEvaluation evaluate(Notification notification, List<NotificationRule> rules) {
        List<NotificationRule> ordered = rules.stream()
                .filter(NotificationRule::isEnabled)
                .sorted(NotificationRule.EVALUATION_ORDER)
                .toList();

        List<RuleAction> actions = new ArrayList<>();
        List<String> matched = new ArrayList<>();
        List<String> evaluated = new ArrayList<>();

        for (NotificationRule rule : ordered) {
            evaluated.add(rule.getId());
            boolean matches;
            try {
                matches = rule.getCondition() != null && conditionEvaluator.matches(rule.getCondition(), notification);
            } catch (RuntimeException e) {
                log.warn("Rule {} ({}) failed on notification {}, skipping: {}",
                        rule.getId(), rule.getName(), notification.getId(), e.getMessage());
                continue;
            }
            if (!matches) {
                continue;
            }
            matched.add(rule.getId());
            List<RuleAction> ruleActions = rule.getActions() != null ? rule.getActions() : List.of();
            actions.addAll(ruleActions);
            if (ruleActions.stream().anyMatch(a -> a.type() == RuleActionType.SUPPRESS)) {
                log.debug("Rule {} suppressed notification {}", rule.getId(), notification.getId());
                return new RuleEvaluation(List.copyOf(actions), List.copyOf(matched), List.copyOf(evaluated), rule.getId());
            }
        }
        return new RuleEvaluation(List.copyOf(actions), List.copyOf(matched), List.copyOf(evaluated), null);
    }

    /**
     * Applies the row-level actions ({@code annotate}, {@code set_priority}, {@code mark_read}) to the notification.
     *
     * @return true if the notification changed and needs saving
     */
    public boolean applyMutations(Notification notification, RuleEvaluation evaluation, Instant now) {
        boolean changed = false;
        for (RuleAction action : evaluation.actions()) {
            switch (action.type()) {
                case ANNOTATE -> {
                    notification.putMetadata(action.param("key"), action.params().get("value"));
                    changed = true;
                }
                case SET_PRIORITY -> {
                    notification.putMetadata(Notification.PRIORITY_KEY, action.param("priority"));
                    changed = true;
                }
                case MARK_READ -> changed |= notification.markRead(now);
                default -> {
                    // channel and suppress actions are resolved by the dispatcher
                }
            }
        }
        return changed;
    }
}
