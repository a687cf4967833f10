package fr.tictak.pulse.client.connection;

/**
 * The live connection as seen by the connection manager. Callbacks may arrive on any thread.
 */
public interface StompTransport {

    interface Listener {

        void onOpen();

        void onFrame(String payload);

        /**
         * Transport or protocol failure. A rejected token arrives as a {@code PulseClientException} of kind AUTH.
         */
        void onError(Throwable error);

        void onClose();
    }

    void connect(String token, Listener listener);

    /**
     * @return false when there is no open session to send on
     */
    boolean send(String destination, Object payload);

    void disconnect();
}
