package fr.tictak.pulse.service;

import fr.tictak.pulse.dto.in.SourceRequest;
import fr.tictak.pulse.dto.out.AuthTestResult;
import fr.tictak.pulse.dto.out.SyncResult;
import fr.tictak.pulse.model.NotificationSource;

import java.time.Instant;
import java.util.List;

public interface SourceService {

    List<NotificationSource> list(String userId);

    NotificationSource get(String userId, String sourceId);

    NotificationSource create(String userId, SourceRequest request);

    NotificationSource update(String userId, String sourceId, SourceRequest request);

    void delete(String userId, String sourceId);

    AuthTestResult testAuth(String userId, String sourceId);

    SyncResult triggerCollection(String userId, String sourceId);

    List<SyncResult> syncAll(String userId);

    int collectDueSources(Instant now);
}
