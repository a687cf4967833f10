package fr.tictak.pulse.client.connection;

public enum ConnectionState {
    CONNECTING,
    OPEN,
    RECONNECTING,
    CLOSED
}
