package fr.tictak.pulse.dto.in;

import java.util.List;

/**
 * Notifications to re-run the rules over. When {@code notificationIds} is empty, every unread notification of
 * the caller is processed.
 */
public record ApplyRulesRequest(List<String> notificationIds) {
}
