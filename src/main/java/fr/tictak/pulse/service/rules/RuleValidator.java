package fr.tictak.pulse.service.rules;

import fr.tictak.pulse.exception.ValidationException;
import fr.tictak.pulse.model.NotificationRule;
import fr.tictak.pulse.model.enums.ConditionOperator;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.rule.RuleAction;
import fr.tictak.pulse.model.rule.RuleCondition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a rule before it is persisted. Collects every violation and throws a single {@link ValidationException}.
 */
@Component
public class RuleValidator {

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_DEPTH = 10;

    public void validate(NotificationRule rule) {
        List<String> violations = new ArrayList<>();
        if (rule.getName() == null || rule.getName().isBlank()) {
            violations.add("name is required");
        } else if (rule.getName().length() > MAX_NAME_LENGTH) {
            violations.add("name must not exceed " + MAX_NAME_LENGTH + " characters");
        }
        if (rule.getCondition() == null) {
            violations.add("condition is required");
        } else {
            validateCondition(rule.getCondition(), "condition", 1, violations);
        }
        if (rule.getActions() == null || rule.getActions().isEmpty()) {
            violations.add("at least one action is required");
        } else {
            for (int i = 0; i < rule.getActions().size(); i++) {
                validateAction(rule.getActions().get(i), "actions[" + i + "]", violations);
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void validateCondition(RuleCondition condition, String path, int depth, List<String> violations) {
        if (depth > MAX_DEPTH) {
            violations.add(path + ": condition nesting exceeds " + MAX_DEPTH + " levels");
            return;
        }
        if (condition instanceof RuleCondition.AllOf all) {
            validateChildren(all.conditions(), path, depth, violations);
        } else if (condition instanceof RuleCondition.AnyOf any) {
            validateChildren(any.conditions(), path, depth, violations);
        } else if (condition instanceof RuleCondition.Not not) {
            if (not.condition() == null) {
                violations.add(path + ": not requires a condition");
            } else {
                validateCondition(not.condition(), path + ".condition", depth + 1, violations);
            }
        } else if (condition instanceof RuleCondition.FieldCondition leaf) {
            validateLeaf(leaf, path, violations);
        }
    }

    private void validateChildren(List<RuleCondition> children, String path, int depth, List<String> violations) {
        if (children == null || children.isEmpty()) {
            violations.add(path + ": at least one nested condition is required");
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            RuleCondition child = children.get(i);
            String childPath = path + ".conditions[" + i + "]";
            if (child == null) {
                violations.add(childPath + ": condition must not be null");
            } else {
                validateCondition(child, childPath, depth + 1, violations);
            }
        }
    }

    private void validateLeaf(RuleCondition.FieldCondition leaf, String path, List<String> violations) {
        if (leaf.field() == null || leaf.field().isBlank()) {
            violations.add(path + ": field is required");
        }
        Optional<ConditionOperator> operator = ConditionOperator.lookup(leaf.operator());
        if (operator.isEmpty()) {
            violations.add(path + ": unknown operator '" + leaf.operator() + "'");
            return;
        }
        ConditionOperator op = operator.get();
        if (op == ConditionOperator.EXISTS) {
            return;
        }
        if (leaf.value() == null) {
            violations.add(path + ": value is required for operator " + op.getSymbol());
            return;
        }
        if (op.isNumeric() && ConditionEvaluator.toNumber(leaf.value()) == null) {
            violations.add(path + ": operator " + op.getSymbol() + " requires a numeric value");
        }
        if (op.isMembership() && !(leaf.value() instanceof Collection<?>)) {
            violations.add(path + ": operator " + op.getSymbol() + " requires a list value");
        }
        if (op == ConditionOperator.REGEX) {
            try {
                Pattern.compile(leaf.value().toString());
            } catch (PatternSyntaxException e) {
                violations.add(path + ": invalid regex: " + e.getDescription());
            }
        }
    }

    private void validateAction(RuleAction action, String path, List<String> violations) {
        if (action == null || action.type() == null) {
            violations.add(path + ": action type is required");
            return;
        }
        switch (action.type()) {
            case FORCE_CHANNEL, DISABLE_CHANNEL -> {
                String channel = action.param("channel");
                if (channel == null) {
                    violations.add(path + ": channel is required for " + action.type().getValue());
                } else {
                    try {
                        DeliveryChannel.fromValue(channel);
                    } catch (IllegalArgumentException e) {
                        violations.add(path + ": unknown channel '" + channel + "'");
                    }
                }
            }
            case ANNOTATE -> {
                if (action.param("key") == null || action.param("key").isBlank()) {
                    violations.add(path + ": annotate requires a key");
                }
                if (!action.params().containsKey("value")) {
                    violations.add(path + ": annotate requires a value");
                }
            }
            case SET_PRIORITY -> {
                if (action.param("priority") == null || action.param("priority").isBlank()) {
                    violations.add(path + ": set_priority requires a priority");
                }
            }
            case SUPPRESS, MARK_READ -> {
                // no parameters
            }
        }
    }
}
