package fr.tictak.pulse.client.store;

import fr.tictak.pulse.client.ClientEventLoop;
import fr.tictak.pulse.client.ErrorKind;
import fr.tictak.pulse.client.api.NotificationApiClient;
import fr.tictak.pulse.client.api.NotificationItem;
import fr.tictak.pulse.client.api.NotificationPage;
import fr.tictak.pulse.client.api.PreferenceItem;
import fr.tictak.pulse.client.resilience.ConnectivityMonitor;
import fr.tictak.pulse.client.resilience.ErrorClassifier;
import fr.tictak.pulse.client.resilience.OfflineQueue;
import fr.tictak.pulse.client.resilience.ResilientExecutor;
import fr.tictak.pulse.client.resilience.RetryPolicy;
import fr.tictak.pulse.client.resilience.SessionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Client cache of the user's notifications and preferences.
 *
 * <p>Every mutation runs on the {@link ClientEventLoop}; readers get the latest immutable {@link StoreState}.
 * Writes are applied locally first, then sent through the resilience layer, or queued while offline. A failed
 * remote write sets the error field and is not rolled back: the next snapshot fetch reconciles.
 */
public class NotificationStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationStore.class);

    private final ClientEventLoop loop;
    private final NotificationApiClient api;
    private final ResilientExecutor executor;
    private final RetryPolicy retryPolicy;
    private final ErrorClassifier classifier;
    private final ConnectivityMonitor connectivity;
    private final OfflineQueue offlineQueue;
    private final SessionScope scope;
    private final Clock clock;
    private final List<Consumer<StoreState>> listeners = new CopyOnWriteArrayList<>();

    private volatile StoreState state = StoreState.initial();
    private volatile boolean disposed;
    private volatile Runnable replayTrigger = () -> {
    };

    public NotificationStore(ClientEventLoop loop, NotificationApiClient api, ResilientExecutor executor,
                             RetryPolicy retryPolicy, ErrorClassifier classifier, ConnectivityMonitor connectivity,
                             OfflineQueue offlineQueue, SessionScope scope, Clock clock) {
        this.loop = loop;
        this.api = api;
        this.executor = executor;
        this.retryPolicy = retryPolicy;
        this.classifier = classifier;
        this.connectivity = connectivity;
        this.offlineQueue = offlineQueue;
        this.scope = scope;
        this.clock = clock;
    }

    /**
     * Called when a write was queued behind pending offline entries while online, so the backlog drains.
     */
    public void setReplayTrigger(Runnable replayTrigger) {
        this.replayTrigger = replayTrigger;
    }

    public StoreState snapshot() {
        return state;
    }

    public void addListener(Consumer<StoreState> listener) {
        listeners.add(listener);
    }

    // Reads

    public List<NotificationItem> getNotifications() {
        return state.notifications();
    }

    public long getUnreadCount() {
        return state.unreadCount();
    }

    public List<NotificationItem> getUnreadNotifications() {
        return state.notifications().stream().filter(n -> !n.read()).toList();
    }

    public List<NotificationItem> getNotificationsByType(String type) {
        return state.notifications().stream().filter(n -> type.equals(n.type())).toList();
    }

    /**
     * A type without a stored preference is enabled.
     */
    public boolean isPreferenceEnabled(String type) {
        PreferenceItem preference = state.preferences().get(type);
        if (preference == null) {
            return true;
        }
        return !Boolean.FALSE.equals(preference.enabled()) && !Boolean.FALSE.equals(preference.inAppEnabled());
    }

    public boolean isConnected() {
        return state.connected();
    }

    public boolean isLoading() {
        return state.loading();
    }

    public String getError() {
        return state.error();
    }

    // Mutations

    public CompletableFuture<Void> fetchNotifications(boolean unreadOnly) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        loop.execute(() -> {
            if (disposed || !connectivity.isOnline()) {
                log.debug("Skipping notification fetch (disposed={}, online={})", disposed, connectivity.isOnline());
                done.complete(null);
                return;
            }
            update(s -> s.withLoading(true));
            executor.retryWithBackoff("fetchNotifications", () -> api.fetchNotifications(unreadOnly), retryPolicy, scope)
                    .whenComplete((page, error) -> onLoop(done, () -> {
                        if (error != null) {
                            update(s -> s.withLoading(false));
                            fail("Loading notifications", error);
                        } else {
                            applySnapshot(page);
                        }
                    }));
        });
        return done;
    }

    /**
     * Prepends a pushed notification, or replaces the copy with the same id in place. A replaced copy moves the
     * unread count only when its read state changed.
     */
    public void addNotification(NotificationItem notification) {
        loop.execute(() -> {
            if (disposed || notification == null || notification.id() == null) {
                return;
            }
            List<NotificationItem> items = new ArrayList<>(state.notifications());
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).id().equals(notification.id())) {
                    NotificationItem previous = items.set(i, notification);
                    long delta = (notification.read() ? 0 : 1) - (previous.read() ? 0 : 1);
                    update(s -> s.withNotifications(items, Math.max(0, s.unreadCount() + delta)));
                    return;
                }
            }
            items.add(0, notification);
            update(s -> s.withNotifications(items, s.unreadCount() + (notification.read() ? 0 : 1)));
        });
    }

    /**
     * Authoritative count from the server.
     */
    public void updateUnreadCount(long count) {
        loop.execute(() -> {
            if (!disposed) {
                update(s -> s.withUnreadCount(count));
            }
        });
    }

    public CompletableFuture<Void> markAsRead(String notificationId) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        loop.execute(() -> {
            if (disposed) {
                done.complete(null);
                return;
            }
            List<NotificationItem> items = new ArrayList<>(state.notifications());
            int transitioned = 0;
            for (int i = 0; i < items.size(); i++) {
                NotificationItem item = items.get(i);
                if (item.id().equals(notificationId) && !item.read()) {
                    items.set(i, item.markedRead(clock.instant()));
                    transitioned = 1;
                }
            }
            int delta = transitioned;
            update(s -> s.withNotifications(items, s.unreadCount() - delta));
            remoteWrite("Marking notification as read", "PATCH", NotificationApiClient.readEndpoint(notificationId), null,
                    () -> {
                        api.markAsRead(notificationId);
                        return null;
                    }, done, ignored -> {
                    });
        });
        return done;
    }

    public CompletableFuture<Void> markAllAsRead() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        loop.execute(() -> {
            if (disposed) {
                done.complete(null);
                return;
            }
            List<NotificationItem> items = new ArrayList<>(state.notifications().size());
            for (NotificationItem item : state.notifications()) {
                items.add(item.markedRead(clock.instant()));
            }
            update(s -> s.withNotifications(items, 0));
            remoteWrite("Marking all notifications as read", "POST", NotificationApiClient.NOTIFICATIONS + "/read-all", null,
                    () -> {
                        api.markAllAsRead();
                        return null;
                    }, done, ignored -> {
                    });
        });
        return done;
    }

    public CompletableFuture<Void> deleteNotification(String notificationId) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        loop.execute(() -> {
            if (disposed) {
                done.complete(null);
                return;
            }
            List<NotificationItem> items = new ArrayList<>(state.notifications());
            boolean wasUnread = false;
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).id().equals(notificationId)) {
                    wasUnread = !items.remove(i).read();
                    break;
                }
            }
            long delta = wasUnread ? 1 : 0;
            update(s -> s.withNotifications(items, s.unreadCount() - delta));
            remoteWrite("Deleting notification", "DELETE", NotificationApiClient.deleteEndpoint(notificationId), null,
                    () -> {
                        api.deleteNotification(notificationId);
                        return null;
                    }, done, ignored -> {
                    });
        });
        return done;
    }

    public CompletableFuture<Void> fetchPreferences() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        loop.execute(() -> {
            if (disposed || !connectivity.isOnline()) {
                done.complete(null);
                return;
            }
            executor.retryWithBackoff("fetchPreferences", api::fetchPreferences, retryPolicy, scope)
                    .whenComplete((preferences, error) -> onLoop(done, () -> {
                        if (error != null) {
                            fail("Loading preferences", error);
                            return;
                        }
                        Map<String, PreferenceItem> byType = new LinkedHashMap<>();
                        for (PreferenceItem preference : preferences) {
                            byType.put(preference.notificationType(), preference);
                        }
                        update(s -> s.withPreferences(byType));
                    }));
        });
        return done;
    }

    public CompletableFuture<Void> updatePreference(String type, PreferenceItem patch) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        loop.execute(() -> {
            if (disposed) {
                done.complete(null);
                return;
            }
            PreferenceItem current = state.preferences().getOrDefault(type, PreferenceItem.defaults(type));
            putPreference(current.merge(patch));
            remoteWrite("Updating preference " + type, "PATCH", NotificationApiClient.preferenceEndpoint(type), patch,
                    () -> api.updatePreference(type, patch), done, saved -> {
                        if (saved != null) {
                            putPreference(saved);
                        }
                    });
        });
        return done;
    }

    public void setConnected(boolean connected) {
        loop.execute(() -> {
            if (!disposed && state.connected() != connected) {
                update(s -> s.withConnected(connected));
            }
        });
    }

    public void clearError() {
        loop.execute(() -> update(s -> s.withError(null)));
    }

    public boolean isDisposed() {
        return disposed;
    }

    public void dispose() {
        disposed = true;
        listeners.clear();
    }

    @Override
    public void close() {
        dispose();
    }

    // Internals, all on the loop

    private void applySnapshot(NotificationPage page) {
        long unread = page.notifications().stream().filter(n -> !n.read()).count();
        if (page.unreadCount() != unread) {
            log.debug("Server unread count {} differs from the {} unread item(s) in the snapshot", page.unreadCount(), unread);
        }
        update(s -> s.withNotifications(page.notifications(), unread).withLoading(false).withError(null));
    }

    private void putPreference(PreferenceItem preference) {
        Map<String, PreferenceItem> preferences = new LinkedHashMap<>(state.preferences());
        preferences.put(preference.notificationType(), preference);
        update(s -> s.withPreferences(preferences));
    }

    private <T> void remoteWrite(String operation, String method, String endpoint, Object payload, Callable<T> call,
                                 CompletableFuture<Void> done, Consumer<T> onSuccess) {
        if (!connectivity.isOnline()) {
            offlineQueue.enqueue(method, endpoint, payload);
            done.complete(null);
            return;
        }
        if (offlineQueue.size() > 0 || offlineQueue.isReplaying()) {
            // Older queued writes go first
            offlineQueue.enqueue(method, endpoint, payload);
            done.complete(null);
            replayTrigger.run();
            return;
        }
        executor.retryWithBackoff(operation, call, retryPolicy, scope)
                .whenComplete((value, error) -> onLoop(done, () -> {
                    if (error == null) {
                        onSuccess.accept(value);
                        return;
                    }
                    if (classifier.classify(error) == ErrorKind.TRANSIENT) {
                        offlineQueue.enqueue(method, endpoint, payload);
                        fail(operation + " (queued for retry)", error);
                    } else {
                        fail(operation, error);
                    }
                }));
    }

    /**
     * Applies a remote outcome on the loop, unless the store was disposed in the meantime.
     */
    private void onLoop(CompletableFuture<Void> done, Runnable task) {
        if (disposed || loop.isClosed()) {
            done.complete(null);
            return;
        }
        loop.execute(() -> {
            try {
                if (!disposed) {
                    task.run();
                }
            } finally {
                done.complete(null);
            }
        });
    }

    private void fail(String operation, Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        if (cause instanceof CancellationException) {
            return;
        }
        log.warn("{} failed: {}", operation, cause.getMessage());
        update(s -> s.withError(operation + " failed: " + cause.getMessage()));
    }

    private void update(UnaryOperator<StoreState> change) {
        StoreState next = change.apply(state);
        state = next;
        for (Consumer<StoreState> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                log.warn("Store listener failed: {}", e.getMessage());
            }
        }
    }
}
