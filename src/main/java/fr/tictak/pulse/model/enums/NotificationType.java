package fr.tictak.pulse.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

@Getter
public enum NotificationType {
    TASK_DUE_SOON("Task due soon"),
    CAPACITY_OVERLOAD("Capacity overload"),
    CYCLE_PHASE_CHANGE("Cycle phase change"),
    SOURCE_ITEM_READY("New item from a connected source"),
    SYSTEM("System"),
    ACHIEVEMENT("Achievement");

    private final String label;

    NotificationType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (NotificationType type : values()) {
            if (type.getValue().equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + value);
    }
}
