package fr.tictak.pulse.dto.out;

public record RuleBatchResult(int processed, int actionsExecuted, int errors) {
}
