package fr.tictak.pulse.service.rules;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.enums.ConditionOperator;
import fr.tictak.pulse.model.rule.RuleCondition;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Interprets a {@link RuleCondition} tree against a notification.
 * <p>
 * Field resolution order: a direct notification field, then a {@code metadata.} dotted path, then a bare
 * metadata key. A field that resolves to nothing makes its leaf false, except for {@code exists} which tests
 * presence. String comparisons ignore case.
 */
@Component
public class ConditionEvaluator {

    static final int MAX_CACHED_PATTERNS = 512;

    // Regexes come from user rules; least recently used ones are compiled again on demand
    private final Cache<String, Pattern> patternCache = Caffeine.newBuilder()
            .maximumSize(MAX_CACHED_PATTERNS)
            .executor(Runnable::run)
            .build();

    public boolean matches(RuleCondition condition, Notification notification) {
        if (condition instanceof RuleCondition.AllOf all) {
            return all.conditions().stream().allMatch(c -> matches(c, notification));
        }
        if (condition instanceof RuleCondition.AnyOf any) {
            return any.conditions().stream().anyMatch(c -> matches(c, notification));
        }
        if (condition instanceof RuleCondition.Not not) {
            return !matches(not.condition(), notification);
        }
        if (condition instanceof RuleCondition.FieldCondition field) {
            return matchesField(field, notification);
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition);
    }

    private boolean matchesField(RuleCondition.FieldCondition leaf, Notification notification) {
        ConditionOperator operator = ConditionOperator.lookup(leaf.operator())
                .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + leaf.operator()));
        Optional<Object> resolved = resolve(leaf.field(), notification);

        if (operator == ConditionOperator.EXISTS) {
            boolean expected = leaf.value() == null || Boolean.parseBoolean(leaf.value().toString());
            return resolved.isPresent() == expected;
        }
        if (resolved.isEmpty()) {
            return false;
        }
        Object actual = resolved.get();
        Object expected = leaf.value();

        return switch (operator) {
            case EQUALS -> looselyEquals(actual, expected);
            case NOT_EQUALS -> !looselyEquals(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case STARTS_WITH -> lower(actual).startsWith(lower(expected));
            case ENDS_WITH -> lower(actual).endsWith(lower(expected));
            case REGEX -> pattern(String.valueOf(expected)).matcher(String.valueOf(actual)).find();
            case GREATER_THAN -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case LESS_THAN -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case GREATER_OR_EQUAL -> compare(actual, expected).map(c -> c >= 0).orElse(false);
            case LESS_OR_EQUAL -> compare(actual, expected).map(c -> c <= 0).orElse(false);
            case IN -> asCollection(expected).stream().anyMatch(e -> looselyEquals(actual, e));
            case NOT_IN -> asCollection(expected).stream().noneMatch(e -> looselyEquals(actual, e));
            case EXISTS -> true;
        };
    }

    /**
     * Resolves a field path against the notification.
     */
    public Optional<Object> resolve(String field, Notification notification) {
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }
        switch (field) {
            case "id":
                return Optional.ofNullable(notification.getId());
            case "type":
                return notification.getType() == null ? Optional.empty() : Optional.of(notification.getType().getValue());
            case "title":
                return Optional.ofNullable(notification.getTitle());
            case "message":
                return Optional.ofNullable(notification.getMessage());
            case "read":
                return Optional.of(notification.isRead());
            case "sourceId":
            case "source_id":
                if (notification.getSourceId() != null) {
                    return Optional.of(notification.getSourceId());
                }
                break;
            default:
                break;
        }
        Map<String, Object> metadata = notification.getMetadata();
        if (metadata == null) {
            return Optional.empty();
        }
        String path = field.startsWith("metadata.") ? field.substring("metadata.".length()) : field;
        if (metadata.containsKey(path)) {
            return Optional.ofNullable(metadata.get(path));
        }
        return walk(metadata, path.split("\\."));
    }

    private static Optional<Object> walk(Map<String, Object> root, String[] segments) {
        Object current = root;
        for (String segment : segments) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    private static boolean looselyEquals(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return lower(actual).equals(lower(expected));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(e -> looselyEquals(e, expected));
        }
        return lower(actual).contains(lower(expected));
    }

    /**
     * Empty when either side is not numeric.
     */
    private static Optional<Integer> compare(Object actual, Object expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left == null || right == null) {
            return Optional.empty();
        }
        return Optional.of(left.compareTo(right));
    }

    static BigDecimal toNumber(Object value) {
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Collection<?> asCollection(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        return value == null ? List.of() : List.of(value);
    }

    private static String lower(Object value) {
        return String.valueOf(value).toLowerCase(Locale.ROOT);
    }

    private Pattern pattern(String regex) {
        return patternCache.get(regex, r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE));
    }

    long cachedPatterns() {
        patternCache.cleanUp();
        return patternCache.estimatedSize();
    }
}
