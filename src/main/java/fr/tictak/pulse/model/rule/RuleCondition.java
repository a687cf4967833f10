package fr.tictak.pulse.model.rule;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Condition tree of a notification rule. Serialized with a {@code kind} discriminator:
 * <pre>
 * {"kind": "all", "conditions": [
 *     {"kind": "field", "field": "type", "operator": "equals", "value": "task_due_soon"},
 *     {"kind": "not", "condition": {"kind": "field", "field": "metadata.priority", "operator": "==", "value": "low"}}
 * ]}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RuleCondition.AllOf.class, name = "all"),
        @JsonSubTypes.Type(value = RuleCondition.AnyOf.class, name = "any"),
        @JsonSubTypes.Type(value = RuleCondition.Not.class, name = "not"),
        @JsonSubTypes.Type(value = RuleCondition.FieldCondition.class, name = "field")
})
public sealed interface RuleCondition
        permits RuleCondition.AllOf, RuleCondition.AnyOf, RuleCondition.Not, RuleCondition.FieldCondition {

    record AllOf(List<RuleCondition> conditions) implements RuleCondition {
    }

    record AnyOf(List<RuleCondition> conditions) implements RuleCondition {
    }

    record Not(RuleCondition condition) implements RuleCondition {
    }

    /**
     * Leaf predicate. {@code operator} is kept as written so unknown operators can be reported by validation.
     */
    record FieldCondition(String field, String operator, Object value) implements RuleCondition {
    }

    static RuleCondition field(String field, String operator, Object value) {
        return new FieldCondition(field, operator, value);
    }

    static RuleCondition all(RuleCondition... conditions) {
        return new AllOf(List.of(conditions));
    }

    static RuleCondition any(RuleCondition... conditions) {
        return new AnyOf(List.of(conditions));
    }

    static RuleCondition not(RuleCondition condition) {
        return new Not(condition);
    }
}
