package fr.tictak.pulse.dto.in;

import fr.tictak.pulse.model.rule.RuleAction;
import fr.tictak.pulse.model.rule.RuleCondition;

import java.util.List;

/**
 * Rule body for create (all required fields present) and update (null fields keep their stored value).
 * Checked by the rule validator rather than bean validation so every violation is reported at once.
 */
public record RuleRequest(
        String name,
        String description,
        Boolean enabled,
        Integer priority,
        RuleCondition condition,
        List<RuleAction> actions
) {
}
