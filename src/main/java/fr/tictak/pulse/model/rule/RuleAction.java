package fr.tictak.pulse.model.rule;

import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.RuleActionType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action a matching rule contributes. Parameters depend on the type:
 * {@code channel} for channel actions, {@code key}/{@code value} for annotate, {@code priority} for set_priority.
 */
public record RuleAction(RuleActionType type, Map<String, Object> params) {

    public RuleAction {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    public static RuleAction of(RuleActionType type) {
        return new RuleAction(type, Map.of());
    }

    public static RuleAction suppress() {
        return of(RuleActionType.SUPPRESS);
    }

    public static RuleAction forceChannel(DeliveryChannel channel) {
        return new RuleAction(RuleActionType.FORCE_CHANNEL, Map.of("channel", channel.getValue()));
    }

    public static RuleAction disableChannel(DeliveryChannel channel) {
        return new RuleAction(RuleActionType.DISABLE_CHANNEL, Map.of("channel", channel.getValue()));
    }

    public static RuleAction annotate(String key, Object value) {
        return new RuleAction(RuleActionType.ANNOTATE, Map.of("key", key, "value", value));
    }

    public static RuleAction setPriority(String priority) {
        return new RuleAction(RuleActionType.SET_PRIORITY, Map.of("priority", priority));
    }

    public String param(String name) {
        Object value = params.get(name);
        return value != null ? value.toString() : null;
    }

    public DeliveryChannel channel() {
        return DeliveryChannel.fromValue(param("channel"));
    }
}
