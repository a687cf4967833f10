package fr.tictak.pulse.dto.out;

import fr.tictak.pulse.model.NotificationPattern;

import java.util.List;

public record PatternInsights(
        int totalPatterns,
        double averageConfidence,
        List<NotificationPattern> mostConfidentPatterns,
        List<NotificationPattern> mostFrequentPatterns
) {
}
