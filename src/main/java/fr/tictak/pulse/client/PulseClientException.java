package fr.tictak.pulse.client;

public class PulseClientException extends RuntimeException {

    private final ErrorKind kind;

    public PulseClientException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PulseClientException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
