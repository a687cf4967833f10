package fr.tictak.pulse.service.dispatch;

import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.SuppressionReason;

import java.util.Set;

/**
 * Published after every dispatch, whether delivered or suppressed.
 */
public record NotificationDispatchedEvent(
        Notification notification,
        Set<DeliveryChannel> deliveredChannels,
        SuppressionReason suppressedBy
) {
}
