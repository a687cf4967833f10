package fr.tictak.pulse.service.source;

public class SourceConnectorException extends Exception {

    public SourceConnectorException(String message) {
        super(message);
    }

    public SourceConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
