package fr.tictak.pulse.service;

import fr.tictak.pulse.dto.out.PatternInsights;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationPattern;

import java.time.Instant;
import java.util.List;

public interface PatternService {

    NotificationPattern observe(Notification notification);

    String patternKeyOf(Notification notification);

    int decayStale(Instant now);

    List<NotificationPattern> list(String userId, String patternKey);

    NotificationPattern get(String userId, String patternId);

    void delete(String userId, String patternId);

    PatternInsights insights(String userId, int topN);
}
