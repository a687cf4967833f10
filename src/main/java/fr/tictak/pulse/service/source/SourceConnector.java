package fr.tictak.pulse.service.source;

import fr.tictak.pulse.model.NotificationSource;
import fr.tictak.pulse.model.enums.SourceType;

import java.time.Instant;
import java.util.List;

/**
 * Adapter to an external platform. Register an implementation as a Spring bean to enable a {@link SourceType}.
 */
public interface SourceConnector {

    SourceType type();

    /**
     * @return a human readable confirmation, e.g. the account the credentials belong to
     * @throws SourceConnectorException when the platform cannot be reached or refuses the credentials
     */
    String testAuthentication(NotificationSource source) throws SourceConnectorException;

    /**
     * @param since last successful sync, or null on the first run
     */
    List<CollectedItem> collect(NotificationSource source, Instant since) throws SourceConnectorException;
}
