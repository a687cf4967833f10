package fr.tictak.pulse.dto.out;

public record MarkAllReadResponse(String message, long updatedCount) {
}
