package fr.tictak.pulse.service.source;

import java.util.Map;

/**
 * One item pulled from an external source, turned into a {@code source_item_ready} notification.
 */
public record CollectedItem(String title, String message, Map<String, Object> metadata) {

    public CollectedItem {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
