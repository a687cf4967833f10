package fr.tictak.pulse.dto.out;

import fr.tictak.pulse.model.rule.RuleAction;

import java.util.List;

public record RuleTestResult(
        String ruleId,
        String ruleName,
        String notificationId,
        boolean matched,
        List<RuleAction> actionsTaken
) {
}
