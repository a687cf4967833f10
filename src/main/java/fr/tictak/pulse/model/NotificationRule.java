package fr.tictak.pulse.model;

import fr.tictak.pulse.model.rule.RuleAction;
import fr.tictak.pulse.model.rule.RuleCondition;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Data
@NoArgsConstructor
@Document(collection = "notification_rules")
public class NotificationRule {

    /**
     * Evaluation order: priority descending, then id ascending so equal priorities stay deterministic.
     */
    public static final Comparator<NotificationRule> EVALUATION_ORDER = Comparator
            .comparingInt(NotificationRule::getPriority).reversed()
            .thenComparing(NotificationRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Id
    private String id;
    @Indexed
    private String userId;
    private String name;
    private String description;
    private boolean enabled = true;
    private int priority;
    private RuleCondition condition;
    private List<RuleAction> actions = new ArrayList<>();
    private long timesTriggered;
    private Instant lastTriggered;
    private Instant createdAt;
    private Instant updatedAt;
}
