package fr.tictak.pulse.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {
    EMAIL,
    SLACK,
    LINKEDIN,
    GITHUB,
    WHATSAPP,
    TELEGRAM,
    DISCORD,
    TRELLO,
    NOTION;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SourceType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SourceType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
