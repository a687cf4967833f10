package fr.tictak.pulse.model.enums;

/**
 * Why a persisted notification was not delivered on any channel.
 */
public enum SuppressionReason {
    PREFERENCE,
    RULE
}
