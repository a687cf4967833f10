package fr.tictak.pulse.service.dispatch;

import fr.tictak.pulse.dto.in.DispatchRequest;
import fr.tictak.pulse.dto.out.DispatchResult;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationPreference;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.SuppressionReason;
import fr.tictak.pulse.repository.NotificationRepository;
import fr.tictak.pulse.service.PreferenceService;
import fr.tictak.pulse.service.RuleService;
import fr.tictak.pulse.service.channel.ChannelSender;
import fr.tictak.pulse.service.rules.RuleEngine;
import fr.tictak.pulse.service.rules.RuleEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persists a candidate notification, then routes it through preferences and rules to the delivery channels.
 * The row is always kept for history, even when delivery is suppressed.
 */
@Service
public class DeliveryDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DeliveryDispatcher.class);

    private final NotificationRepository notificationRepository;
    private final PreferenceService preferenceService;
    private final RuleService ruleService;
    private final RuleEngine ruleEngine;
    private final Map<DeliveryChannel, ChannelSender> senders;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public DeliveryDispatcher(NotificationRepository notificationRepository, PreferenceService preferenceService,
                              RuleService ruleService, RuleEngine ruleEngine, List<ChannelSender> channelSenders,
                              ApplicationEventPublisher eventPublisher, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.preferenceService = preferenceService;
        this.ruleService = ruleService;
        this.ruleEngine = ruleEngine;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        Map<DeliveryChannel, ChannelSender> byChannel = new EnumMap<>(DeliveryChannel.class);
        for (ChannelSender sender : channelSenders) {
            byChannel.put(sender.channel(), sender);
        }
        this.senders = Collections.unmodifiableMap(byChannel);
    }

    public DispatchResult dispatch(String userId, DispatchRequest request) {
        Notification notification = new Notification(userId, request.type(), request.title(), request.message(),
                request.metadata());
        notification.setSourceId(request.sourceId());
        return dispatch(notification);
    }

    public DispatchResult dispatch(Notification candidate) {
        if (candidate.getCreatedAt() == null) {
            candidate.setCreatedAt(clock.instant());
        }
        Notification notification = notificationRepository.save(candidate);

        NotificationPreference preference = preferenceService.resolve(notification.getUserId(), notification.getType());
        if (!preference.isEnabled()) {
            log.info("Notification {} of type {} suppressed by preference for user {}",
                    notification.getId(), notification.getType().getValue(), notification.getUserId());
            return finish(DispatchResult.suppressed(notification, SuppressionReason.PREFERENCE, List.of()));
        }

        RuleEvaluation evaluation = ruleService.applyRules(notification);
        if (evaluation.suppressed()) {
            log.info("Notification {} suppressed by rule {} for user {}",
                    notification.getId(), evaluation.suppressedBy(), notification.getUserId());
            return finish(DispatchResult.suppressed(notification, SuppressionReason.RULE, evaluation.actions()));
        }

        if (ruleEngine.applyMutations(notification, evaluation, clock.instant())) {
            notification = notificationRepository.save(notification);
        }

        Set<DeliveryChannel> channels = EnumSet.noneOf(DeliveryChannel.class);
        channels.addAll(preference.enabledChannels());
        channels.addAll(evaluation.forcedChannels());
        channels.removeAll(evaluation.disabledChannels());

        Set<DeliveryChannel> delivered = EnumSet.noneOf(DeliveryChannel.class);
        for (DeliveryChannel channel : channels) {
            if (deliver(channel, notification)) {
                delivered.add(channel);
            }
        }
        log.info("Notification {} dispatched to user {} on {}", notification.getId(), notification.getUserId(), delivered);
        return finish(new DispatchResult(notification, Collections.unmodifiableSet(delivered), null, evaluation.actions()));
    }

    private boolean deliver(DeliveryChannel channel, Notification notification) {
        ChannelSender sender = senders.get(channel);
        if (sender == null || !sender.isEnabled()) {
            log.debug("Channel {} not available, skipping notification {}", channel.getValue(), notification.getId());
            return false;
        }
        try {
            sender.deliver(notification);
            return true;
        } catch (RuntimeException e) {
            log.error("Delivery of notification {} on channel {} failed", notification.getId(), channel.getValue(), e);
            return false;
        }
    }

    private DispatchResult finish(DispatchResult result) {
        eventPublisher.publishEvent(new NotificationDispatchedEvent(
                result.notification(), result.deliveredChannels(), result.suppressedBy()));
        return result;
    }
}
