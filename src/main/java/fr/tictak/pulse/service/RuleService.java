package fr.tictak.pulse.service;

import fr.tictak.pulse.dto.in.ApplyRulesRequest;
import fr.tictak.pulse.dto.in.RuleRequest;
import fr.tictak.pulse.dto.out.RuleBatchResult;
import fr.tictak.pulse.dto.out.RuleTestResult;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationRule;
import fr.tictak.pulse.service.rules.RuleEvaluation;

import java.util.List;

public interface RuleService {

    List<NotificationRule> list(String userId);

    NotificationRule get(String userId, String ruleId);

    NotificationRule create(String userId, RuleRequest request);

    NotificationRule update(String userId, String ruleId, RuleRequest request);

    void delete(String userId, String ruleId);

    /**
     * Runs the owner's enabled rules over a notification and records which rules triggered.
     */
    RuleEvaluation applyRules(Notification notification);

    /**
     * Dry run of one rule against a persisted notification. No side effects.
     */
    RuleTestResult test(String userId, String ruleId, String notificationId);

    RuleBatchResult applyToExisting(String userId, ApplyRulesRequest request);
}
