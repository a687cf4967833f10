package fr.tictak.pulse.client;

public enum ErrorKind {
    /** Connection refused, timeouts, 408, 429 and 5xx. Retried with backoff. */
    TRANSIENT,
    /** Expired or invalid token. Needs re-authentication, never retried as is. */
    AUTH,
    VALIDATION,
    NOT_FOUND,
    FATAL;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
