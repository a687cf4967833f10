package fr.tictak.pulse.client.connection;

import fr.tictak.pulse.client.ClientEventLoop;
import fr.tictak.pulse.client.ErrorKind;
import fr.tictak.pulse.client.platform.PermissionState;
import fr.tictak.pulse.client.platform.PlatformNotifications;
import fr.tictak.pulse.client.resilience.ConnectivityMonitor;
import fr.tictak.pulse.client.resilience.ErrorClassifier;
import fr.tictak.pulse.client.resilience.RetryPolicy;
import fr.tictak.pulse.client.store.NotificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the live connection: connects with the current token, feeds pushed frames into the store and reconnects
 * with backoff after a drop.
 *
 * <p>All state lives on the event loop. Transport callbacks carry the generation of the connection that raised
 * them, so late callbacks from a torn-down connection are ignored. At most one reconnect is scheduled at a time.
 */
public class NotificationConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationConnectionManager.class);

    static final String PONG_DESTINATION = "/app/pong";

    private final ClientEventLoop loop;
    private final StompTransport transport;
    private final TokenProvider tokenProvider;
    private final NotificationStore store;
    private final PlatformNotifications platform;
    private final ConnectivityMonitor connectivity;
    private final ErrorClassifier classifier;
    private final RetryPolicy reconnectPolicy;
    private final PushMessageDecoder decoder;
    private final Clock clock;
    private final Runnable onlineListener = this::onConnectivityRestored;

    // Written on the loop only; volatile where the accessors read them
    private volatile ConnectionState state = ConnectionState.CLOSED;
    private long generation;
    private volatile int failedAttempts;
    private volatile boolean gaveUp;
    private boolean permissionRequested;
    // One token renewal per successful open
    private boolean reauthenticated;
    private ScheduledFuture<?> pendingReconnect;

    public NotificationConnectionManager(ClientEventLoop loop, StompTransport transport, TokenProvider tokenProvider,
                                         NotificationStore store, PlatformNotifications platform,
                                         ConnectivityMonitor connectivity, ErrorClassifier classifier,
                                         RetryPolicy reconnectPolicy, Clock clock) {
        this.loop = loop;
        this.transport = transport;
        this.tokenProvider = tokenProvider;
        this.store = store;
        this.platform = platform;
        this.connectivity = connectivity;
        this.classifier = classifier;
        this.reconnectPolicy = reconnectPolicy;
        this.decoder = new PushMessageDecoder();
        this.clock = clock;
        connectivity.addOnlineListener(onlineListener);
    }

    /**
     * Opens the connection with the current token.
     *
     * @return false when there is no token, in which case the manager stays closed
     */
    public boolean start() {
        boolean[] started = new boolean[1];
        loop.runAndWait(() -> {
            gaveUp = false;
            failedAttempts = 0;
            reauthenticated = false;
            started[0] = connect(tokenProvider.currentToken());
        });
        return started[0];
    }

    public void stop() {
        loop.runAndWait(() -> {
            cancelPendingReconnect();
            generation++;
            gaveUp = false;
            state = ConnectionState.CLOSED;
            safeDisconnect();
            store.setConnected(false);
            log.info("Notification connection stopped");
        });
    }

    public ConnectionState state() {
        return state;
    }

    public boolean hasGivenUp() {
        return gaveUp;
    }

    public int failedAttempts() {
        return failedAttempts;
    }

    @Override
    public void close() {
        connectivity.removeOnlineListener(onlineListener);
        stop();
    }

    // Everything below runs on the loop

    private boolean connect(Optional<String> token) {
        if (token.isEmpty()) {
            log.info("No token available, notification connection not opened");
            state = ConnectionState.CLOSED;
            return false;
        }
        long current = ++generation;
        state = failedAttempts == 0 ? ConnectionState.CONNECTING : ConnectionState.RECONNECTING;
        try {
            transport.connect(token.get(), new GenerationListener(current));
        } catch (RuntimeException e) {
            handleFailure(current, e);
        }
        return true;
    }

    private void handleOpen(long current) {
        if (current != generation) {
            return;
        }
        log.info("Notification connection open");
        state = ConnectionState.OPEN;
        failedAttempts = 0;
        gaveUp = false;
        reauthenticated = false;
        store.setConnected(true);
        connectivity.setOnline(true);
        store.fetchNotifications(false);
        if (!permissionRequested) {
            permissionRequested = true;
            if (platform.permission() == PermissionState.DEFAULT) {
                log.debug("Platform notification permission is {}", platform.requestPermission());
            }
        }
    }

    private void handleFrame(long current, String payload) {
        if (current != generation) {
            return;
        }
        Optional<PushMessage> decoded = decoder.decode(payload);
        if (decoded.isEmpty()) {
            return;
        }
        PushMessage message = decoded.get();
        if (message instanceof PushMessage.NotificationPushed pushed) {
            store.addNotification(pushed.notification());
            showOnPlatform(pushed);
        } else if (message instanceof PushMessage.UnreadCount unread) {
            store.updateUnreadCount(unread.count());
        } else if (message instanceof PushMessage.Heartbeat) {
            if (!transport.send(PONG_DESTINATION, Map.of("type", "pong", "timestamp", clock.instant().toString()))) {
                log.debug("Pong not sent, no open session");
            }
        } else if (message instanceof PushMessage.Connected connected) {
            log.debug("Server greeted user {}", connected.userId());
        } else if (message instanceof PushMessage.NotificationRead read) {
            log.debug("Server acknowledged read of {}: {}", read.notificationId(), read.success());
        } else if (message instanceof PushMessage.ServerError error) {
            log.warn("Server reported an error: {}", error.message());
        }
    }

    private void showOnPlatform(PushMessage.NotificationPushed pushed) {
        if (platform.permission() != PermissionState.GRANTED) {
            return;
        }
        try {
            platform.show(pushed.notification());
        } catch (RuntimeException e) {
            log.warn("Platform notification failed: {}", e.getMessage());
        }
    }

    private void handleFailure(long current, Throwable error) {
        if (current != generation || !isLive()) {
            return;
        }
        store.setConnected(false);
        if (classifier.classify(error) == ErrorKind.AUTH) {
            handleAuthFailure(error);
            return;
        }
        log.warn("Notification connection lost: {}", ErrorClassifier.unwrap(error).getMessage());
        connectivity.setOnline(false);
        scheduleReconnect();
    }

    private void handleAuthFailure(Throwable error) {
        log.warn("Notification connection rejected: {}", ErrorClassifier.unwrap(error).getMessage());
        generation++;
        safeDisconnect();
        cancelPendingReconnect();
        if (reauthenticated) {
            log.warn("Renewed token rejected as well, notification connection closed");
            state = ConnectionState.CLOSED;
            return;
        }
        reauthenticated = true;
        Optional<String> fresh;
        try {
            fresh = tokenProvider.reauthenticate();
        } catch (RuntimeException e) {
            log.warn("Re-authentication failed: {}", e.getMessage());
            fresh = Optional.empty();
        }
        if (fresh.isEmpty()) {
            log.info("No fresh token, notification connection closed");
            state = ConnectionState.CLOSED;
            return;
        }
        failedAttempts = 0;
        connect(fresh);
    }

    private void scheduleReconnect() {
        if (pendingReconnect != null && !pendingReconnect.isDone()) {
            return;
        }
        failedAttempts++;
        if (failedAttempts > reconnectPolicy.maxAttempts()) {
            log.warn("Giving up on the notification connection after {} attempts", reconnectPolicy.maxAttempts());
            generation++;
            state = ConnectionState.CLOSED;
            gaveUp = true;
            safeDisconnect();
            return;
        }
        state = ConnectionState.RECONNECTING;
        Duration delay = reconnectPolicy.delayFor(failedAttempts);
        log.info("Reconnecting in {} ms (attempt {}/{})", delay.toMillis(), failedAttempts, reconnectPolicy.maxAttempts());
        long scheduledFor = generation;
        try {
            pendingReconnect = loop.schedule(() -> {
                pendingReconnect = null;
                if (scheduledFor == generation && state == ConnectionState.RECONNECTING) {
                    safeDisconnect();
                    connect(tokenProvider.currentToken());
                }
            }, delay);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop closed, reconnect not scheduled");
        }
    }

    private void onConnectivityRestored() {
        loop.execute(() -> {
            if (gaveUp && state == ConnectionState.CLOSED) {
                log.info("Connectivity restored, reopening the notification connection");
                gaveUp = false;
                failedAttempts = 0;
                reauthenticated = false;
                connect(tokenProvider.currentToken());
            }
        });
    }

    private boolean isLive() {
        return state == ConnectionState.OPEN || state == ConnectionState.CONNECTING
                || state == ConnectionState.RECONNECTING;
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private void safeDisconnect() {
        try {
            transport.disconnect();
        } catch (RuntimeException e) {
            log.debug("Transport disconnect failed: {}", e.getMessage());
        }
    }

    /**
     * Marshals transport callbacks onto the loop, tagged with the connection they belong to.
     */
    private final class GenerationListener implements StompTransport.Listener {

        private final long owner;

        GenerationListener(long owner) {
            this.owner = owner;
        }

        @Override
        public void onOpen() {
            loop.execute(() -> handleOpen(owner));
        }

        @Override
        public void onFrame(String payload) {
            loop.execute(() -> handleFrame(owner, payload));
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> handleFailure(owner, error));
        }

        @Override
        public void onClose() {
            loop.execute(() -> handleFailure(owner, new ConnectException("Connection closed")));
        }
    }
}
