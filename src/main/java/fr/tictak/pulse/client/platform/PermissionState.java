package fr.tictak.pulse.client.platform;

public enum PermissionState {
    /** Not asked yet. */
    DEFAULT,
    GRANTED,
    DENIED
}
