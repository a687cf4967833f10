package fr.tictak.pulse.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

@Getter
public enum RuleActionType {
    SUPPRESS(false),
    FORCE_CHANNEL(true),
    DISABLE_CHANNEL(true),
    ANNOTATE(false),
    SET_PRIORITY(false),
    MARK_READ(false);

    private final boolean channelAction;

    RuleActionType(boolean channelAction) {
        this.channelAction = channelAction;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleActionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RuleActionType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown rule action: " + value);
    }
}
