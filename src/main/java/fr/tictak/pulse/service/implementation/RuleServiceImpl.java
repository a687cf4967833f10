package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.concurrent.BoundedWorkerPool;
import fr.tictak.pulse.dto.in.ApplyRulesRequest;
import fr.tictak.pulse.dto.in.RuleRequest;
import fr.tictak.pulse.dto.out.RuleBatchResult;
import fr.tictak.pulse.dto.out.RuleTestResult;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationRule;
import fr.tictak.pulse.repository.NotificationRepository;
import fr.tictak.pulse.repository.NotificationRuleRepository;
import fr.tictak.pulse.service.RuleService;
import fr.tictak.pulse.service.rules.ConditionEvaluator;
import fr.tictak.pulse.service.rules.RuleEngine;
import fr.tictak.pulse.service.rules.RuleEvaluation;
import fr.tictak.pulse.service.rules.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class RuleServiceImpl implements RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleServiceImpl.class);

    private final NotificationRuleRepository ruleRepository;
    private final NotificationRepository notificationRepository;
    private final MongoTemplate mongoTemplate;
    private final RuleEngine ruleEngine;
    private final ConditionEvaluator conditionEvaluator;
    private final RuleValidator ruleValidator;
    private final BoundedWorkerPool workerPool;
    private final Clock clock;

    public RuleServiceImpl(NotificationRuleRepository ruleRepository, NotificationRepository notificationRepository,
                           MongoTemplate mongoTemplate, RuleEngine ruleEngine, ConditionEvaluator conditionEvaluator,
                           RuleValidator ruleValidator, BoundedWorkerPool workerPool, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.notificationRepository = notificationRepository;
        this.mongoTemplate = mongoTemplate;
        this.ruleEngine = ruleEngine;
        this.conditionEvaluator = conditionEvaluator;
        this.ruleValidator = ruleValidator;
        this.workerPool = workerPool;
        this.clock = clock;
    }

    @Override
    public List<NotificationRule> list(String userId) {
        return ruleRepository.findByUserIdOrderByPriorityDesc(userId);
    }

    @Override
    public NotificationRule get(String userId, String ruleId) {
        return ruleRepository.findByIdAndUserId(ruleId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Rule", ruleId));
    }

    @Override
    public NotificationRule create(String userId, RuleRequest request) {
        NotificationRule rule = new NotificationRule();
        rule.setUserId(userId);
        apply(rule, request);
        ruleValidator.validate(rule);
        Instant now = clock.instant();
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        NotificationRule saved = ruleRepository.save(rule);
        log.info("Rule {} '{}' created for user {} with priority {}", saved.getId(), saved.getName(), userId, saved.getPriority());
        return saved;
    }

    @Override
    public NotificationRule update(String userId, String ruleId, RuleRequest request) {
        NotificationRule rule = get(userId, ruleId);
        apply(rule, request);
        ruleValidator.validate(rule);
        rule.setUpdatedAt(clock.instant());
        return ruleRepository.save(rule);
    }

    @Override
    public void delete(String userId, String ruleId) {
        NotificationRule rule = get(userId, ruleId);
        ruleRepository.delete(rule);
        log.info("Rule {} deleted for user {}", ruleId, userId);
    }

    @Override
    public RuleEvaluation applyRules(Notification notification) {
        List<NotificationRule> rules = ruleRepository.findByUserIdAndEnabledIsTrue(notification.getUserId());
        if (rules.isEmpty()) {
            return RuleEvaluation.none();
        }
        RuleEvaluation evaluation = ruleEngine.evaluate(notification, rules);
        recordTriggers(evaluation.matchedRuleIds());
        return evaluation;
    }

    @Override
    public RuleTestResult test(String userId, String ruleId, String notificationId) {
        NotificationRule rule = get(userId, ruleId);
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Notification", notificationId));
        boolean matched = rule.getCondition() != null && conditionEvaluator.matches(rule.getCondition(), notification);
        return new RuleTestResult(rule.getId(), rule.getName(), notification.getId(), matched,
                matched ? List.copyOf(rule.getActions()) : List.of());
    }

    @Override
    public RuleBatchResult applyToExisting(String userId, ApplyRulesRequest request) {
        List<NotificationRule> rules = ruleRepository.findByUserIdAndEnabledIsTrue(userId);
        List<Notification> notifications = request == null || request.notificationIds() == null || request.notificationIds().isEmpty()
                ? notificationRepository.findByUserIdAndRead(userId, false)
                : notificationRepository.findByUserIdAndIdIn(userId, request.notificationIds());

        List<BoundedWorkerPool.ItemResult<Integer>> results = workerPool.runAll(notifications, notification -> {
            RuleEvaluation evaluation = ruleEngine.evaluate(notification, rules);
            recordTriggers(evaluation.matchedRuleIds());
            if (ruleEngine.applyMutations(notification, evaluation, clock.instant())) {
                notificationRepository.save(notification);
            }
            return evaluation.actions().size();
        });

        int actions = 0;
        int errors = 0;
        for (BoundedWorkerPool.ItemResult<Integer> result : results) {
            if (result.isSuccess()) {
                actions += result.value();
            } else {
                errors++;
            }
        }
        log.info("Applied {} rule(s) to {} notification(s) of user {}: {} action(s), {} error(s)",
                rules.size(), notifications.size(), userId, actions, errors);
        return new RuleBatchResult(notifications.size() - errors, actions, errors);
    }

    private void recordTriggers(List<String> ruleIds) {
        if (ruleIds.isEmpty()) {
            return;
        }
        Query query = new Query(Criteria.where("_id").in(ruleIds));
        Update update = new Update().inc("timesTriggered", 1).set("lastTriggered", clock.instant());
        mongoTemplate.updateMulti(query, update, NotificationRule.class);
    }

    private static void apply(NotificationRule rule, RuleRequest request) {
        if (request.name() != null) {
            rule.setName(request.name().trim());
        }
        if (request.description() != null) {
            rule.setDescription(request.description());
        }
        if (request.enabled() != null) {
            rule.setEnabled(request.enabled());
        }
        if (request.priority() != null) {
            rule.setPriority(request.priority());
        }
        if (request.condition() != null) {
            rule.setCondition(request.condition());
        }
        if (request.actions() != null) {
            rule.setActions(new ArrayList<>(request.actions()));
        }
    }
}
