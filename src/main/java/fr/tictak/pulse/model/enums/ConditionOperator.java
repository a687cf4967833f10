package fr.tictak.pulse.model.enums;

import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Leaf comparison operators. Lookup accepts the symbol, any alias or the constant name, case-insensitively.
 */
@Getter
public enum ConditionOperator {
    EQUALS("equals", "=="),
    NOT_EQUALS("not_equals", "!="),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    REGEX("regex"),
    GREATER_THAN(">", "gt"),
    LESS_THAN("<", "lt"),
    GREATER_OR_EQUAL(">=", "gte"),
    LESS_OR_EQUAL("<=", "lte"),
    IN("in"),
    NOT_IN("not_in"),
    EXISTS("exists");

    private final String symbol;
    private final List<String> aliases;

    ConditionOperator(String symbol, String... aliases) {
        this.symbol = symbol;
        this.aliases = List.of(aliases);
    }

    public boolean isNumeric() {
        return this == GREATER_THAN || this == LESS_THAN || this == GREATER_OR_EQUAL || this == LESS_OR_EQUAL;
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    public static Optional<ConditionOperator> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConditionOperator operator : values()) {
            if (operator.symbol.equals(normalized) || operator.aliases.contains(normalized)
                    || operator.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
