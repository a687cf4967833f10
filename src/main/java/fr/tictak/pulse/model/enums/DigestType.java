package fr.tictak.pulse.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.time.Duration;
import java.util.Locale;

/**
 * Digest periods. {@code windowDays} is the default length of the aggregated interval,
 * {@code regenerateAfter} the age at which a pending run produces a new version.
 */
@Getter
public enum DigestType {
    DAILY(1, Duration.ofHours(20), "day"),
    WEEKLY(7, Duration.ofDays(6), "week"),
    MONTHLY(30, Duration.ofDays(28), "month");

    private final int windowDays;
    private final Duration regenerateAfter;
    private final String periodLabel;

    DigestType(int windowDays, Duration regenerateAfter, String periodLabel) {
        this.windowDays = windowDays;
        this.regenerateAfter = regenerateAfter;
        this.periodLabel = periodLabel;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DigestType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DigestType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid digest type: " + value + ". Must be daily, weekly or monthly");
    }
}
