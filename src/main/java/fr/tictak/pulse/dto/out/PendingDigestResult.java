package fr.tictak.pulse.dto.out;

import fr.tictak.pulse.model.NotificationDigest;
import fr.tictak.pulse.model.enums.DigestType;

import java.util.List;

public record PendingDigestResult(List<NotificationDigest> generated, List<DigestType> skipped) {
}
