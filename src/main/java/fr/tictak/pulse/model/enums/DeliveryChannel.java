package fr.tictak.pulse.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeliveryChannel {
    IN_APP,
    EMAIL,
    PUSH;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DeliveryChannel fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('-', '_');
        for (DeliveryChannel channel : values()) {
            if (channel.name().equalsIgnoreCase(normalized)) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown delivery channel: " + value);
    }
}
