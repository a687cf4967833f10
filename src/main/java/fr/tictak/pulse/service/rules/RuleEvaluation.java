package fr.tictak.pulse.service.rules;

import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.RuleActionType;
import fr.tictak.pulse.model.rule.RuleAction;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of running a user's rules over one notification.
 *
 * @param actions          accumulated actions of every matching rule, in evaluation order
 * @param matchedRuleIds   rules whose condition matched
 * @param evaluatedRuleIds rules actually evaluated; rules after a suppressing rule are absent
 * @param suppressedBy     id of the rule whose suppress action stopped evaluation, or null
 */
public record RuleEvaluation(
        List<RuleAction> actions,
        List<String> matchedRuleIds,
        List<String> evaluatedRuleIds,
        String suppressedBy
) {

    public static RuleEvaluation none() {
        return new RuleEvaluation(List.of(), List.of(), List.of(), null);
    }

    public boolean suppressed() {
        return suppressedBy != null;
    }

    public Set<DeliveryChannel> forcedChannels() {
        return channelsOf(RuleActionType.FORCE_CHANNEL);
    }

    public Set<DeliveryChannel> disabledChannels() {
        return channelsOf(RuleActionType.DISABLE_CHANNEL);
    }

    private Set<DeliveryChannel> channelsOf(RuleActionType type) {
        Set<DeliveryChannel> channels = EnumSet.noneOf(DeliveryChannel.class);
        for (RuleAction action : actions) {
            if (action.type() == type) {
                channels.add(action.channel());
            }
        }
        return channels;
    }
}
