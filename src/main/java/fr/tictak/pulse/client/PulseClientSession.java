package fr.tictak.pulse.client;

import fr.tictak.pulse.client.api.NotificationApiClient;
import fr.tictak.pulse.client.connection.NotificationConnectionManager;
import fr.tictak.pulse.client.connection.StompTransport;
import fr.tictak.pulse.client.connection.TokenProvider;
import fr.tictak.pulse.client.connection.WebSocketStompTransport;
import fr.tictak.pulse.client.platform.PlatformNotifications;
import fr.tictak.pulse.client.resilience.ConnectivityMonitor;
import fr.tictak.pulse.client.resilience.ErrorClassifier;
import fr.tictak.pulse.client.resilience.OfflineQueue;
import fr.tictak.pulse.client.resilience.ResilientExecutor;
import fr.tictak.pulse.client.resilience.SessionScope;
import fr.tictak.pulse.client.store.NotificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One signed-in user's notification client: store, live connection and offline replay wired together.
 *
 * <p>{@link #close()} tears everything down in reverse order: in-flight calls are cancelled and their late
 * results never reach the store.
 */
public class PulseClientSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PulseClientSession.class);

    private final ClientEventLoop loop;
    private final ScheduledExecutorService retryScheduler;
    private final ExecutorService ioExecutor;
    private final SessionScope scope;
    private final ConnectivityMonitor connectivity;
    private final OfflineQueue offlineQueue;
    private final NotificationApiClient api;
    private final NotificationStore store;
    private final NotificationConnectionManager connection;
    private final Runnable replayOnReconnect = this::replayOfflineQueue;

    public PulseClientSession(PulseClientProperties properties, TokenProvider tokenProvider,
                              PlatformNotifications platform) {
        this(properties, tokenProvider, platform, new WebSocketStompTransport(properties.getWebSocketUrl()),
                new NotificationApiClient(properties.getServerUrl(), tokenProvider), Clock.systemUTC());
    }

    PulseClientSession(PulseClientProperties properties, TokenProvider tokenProvider, PlatformNotifications platform,
                       StompTransport transport, NotificationApiClient api, Clock clock) {
        ErrorClassifier classifier = new ErrorClassifier();
        this.loop = new ClientEventLoop("pulse-client-loop");
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(daemon("pulse-client-retry"));
        this.ioExecutor = Executors.newFixedThreadPool(properties.getIoThreads(), daemon("pulse-client-io"));
        this.scope = new SessionScope("pulse-client");
        this.connectivity = new ConnectivityMonitor(true);
        this.offlineQueue = new OfflineQueue(properties.getOfflineQueueFile(), properties.getOfflineQueueMaxAttempts(),
                classifier, clock);
        this.api = api;
        ResilientExecutor executor = new ResilientExecutor(classifier, retryScheduler, ioExecutor);
        this.store = new NotificationStore(loop, api, executor, properties.getRequestRetry(), classifier, connectivity,
                offlineQueue, scope, clock);
        this.connection = new NotificationConnectionManager(loop, transport, tokenProvider, store, platform,
                connectivity, classifier, properties.getReconnect(), clock);
        store.setReplayTrigger(this::replayOfflineQueue);
        offlineQueue.addPermanentFailureListener(failure -> log.warn("Queued {} {} was dropped: {}",
                failure.entry().method(), failure.entry().endpoint(), failure.error().getMessage()));
    }

    /**
     * Opens the live connection and replays whatever was queued by a previous run.
     *
     * @return false when there is no token to connect with
     */
    public boolean open() {
        connectivity.addOnlineListener(replayOnReconnect);
        boolean started = connection.start();
        if (started && offlineQueue.size() > 0) {
            replayOfflineQueue();
        }
        return started;
    }

    public CompletableFuture<OfflineQueue.ReplayReport> replayOfflineQueue() {
        if (scope.isDisposed()) {
            return CompletableFuture.completedFuture(new OfflineQueue.ReplayReport(0, 0, false, offlineQueue.size()));
        }
        try {
            return scope.track(CompletableFuture.supplyAsync(() -> offlineQueue.replay(api::replay), ioExecutor));
        } catch (RejectedExecutionException e) {
            log.debug("Session closing, replay skipped");
            return CompletableFuture.completedFuture(new OfflineQueue.ReplayReport(0, 0, false, offlineQueue.size()));
        }
    }

    public NotificationStore store() {
        return store;
    }

    public NotificationConnectionManager connection() {
        return connection;
    }

    public ConnectivityMonitor connectivity() {
        return connectivity;
    }

    public OfflineQueue offlineQueue() {
        return offlineQueue;
    }

    @Override
    public void close() {
        connectivity.removeOnlineListener(replayOnReconnect);
        connection.close();
        store.dispose();
        scope.dispose();
        retryScheduler.shutdownNow();
        ioExecutor.shutdownNow();
        loop.close();
        log.info("Notification client session closed");
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
