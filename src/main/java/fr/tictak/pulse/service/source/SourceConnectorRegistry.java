package fr.tictak.pulse.service.source;

import fr.tictak.pulse.model.enums.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class SourceConnectorRegistry {

    private final Map<SourceType, SourceConnector> connectors;

    public SourceConnectorRegistry(ObjectProvider<SourceConnector> connectorProvider) {
        Map<SourceType, SourceConnector> byType = new EnumMap<>(SourceType.class);
        connectorProvider.orderedStream().forEach(connector -> {
            SourceConnector previous = byType.putIfAbsent(connector.type(), connector);
            if (previous != null) {
                log.warn("Ignoring second connector {} for source type {}", connector.getClass().getSimpleName(),
                        connector.type().getValue());
            }
        });
        this.connectors = Collections.unmodifiableMap(byType);
        log.info("Source connectors registered for {}", connectors.keySet());
    }

    public Optional<SourceConnector> find(SourceType type) {
        return Optional.ofNullable(connectors.get(type));
    }
}
