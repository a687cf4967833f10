package fr.tictak.pulse.dto.out;

import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.SuppressionReason;
import fr.tictak.pulse.model.rule.RuleAction;

import java.util.List;
import java.util.Set;

public record DispatchResult(
        Notification notification,
        Set<DeliveryChannel> deliveredChannels,
        SuppressionReason suppressedBy,
        List<RuleAction> appliedActions
) {

    public static DispatchResult suppressed(Notification notification, SuppressionReason reason, List<RuleAction> actions) {
        return new DispatchResult(notification, Set.of(), reason, actions);
    }

    public boolean isDelivered() {
        return suppressedBy == null && !deliveredChannels.isEmpty();
    }
}
