package fr.tictak.pulse.client.connection;

import java.util.Optional;

/**
 * Source of the bearer token. Issuing tokens is the authentication service's job; this only hands them over.
 */
public interface TokenProvider {

    Optional<String> currentToken();

    /**
     * Called after the server rejected the current token.
     *
     * @return a fresh token, or empty when the user has to sign in again
     */
    Optional<String> reauthenticate();
}
