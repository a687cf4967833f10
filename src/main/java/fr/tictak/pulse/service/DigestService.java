package fr.tictak.pulse.service;

import fr.tictak.pulse.dto.out.PendingDigestResult;
import fr.tictak.pulse.model.NotificationDigest;
import fr.tictak.pulse.model.enums.DigestType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DigestService {

    /**
     * Aggregates [start, end) into a new digest version. Null bounds select the default window of the type.
     */
    NotificationDigest generate(String userId, DigestType type, Instant start, Instant end);

    Optional<NotificationDigest> getLatest(String userId, DigestType type);

    List<NotificationDigest> list(String userId, DigestType type);

    NotificationDigest get(String userId, String digestId);

    PendingDigestResult generatePending(String userId);
}
