package fr.tictak.pulse.client.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner of the calls issued for one client session. Disposing the scope cancels every tracked future at once;
 * a result that arrives afterwards finds its future already completed and is dropped.
 */
public class SessionScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionScope.class);

    private final String name;
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final List<Runnable> disposeHooks = new ArrayList<>();

    public SessionScope(String name) {
        this.name = name;
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        if (isDisposed()) {
            future.cancel(false);
            return future;
        }
        inFlight.add(future);
        future.whenComplete((value, error) -> inFlight.remove(future));
        if (isDisposed()) {
            future.cancel(false);
        }
        return future;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public synchronized void onDispose(Runnable hook) {
        disposeHooks.add(hook);
    }

    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        int cancelled = 0;
        for (CompletableFuture<?> future : List.copyOf(inFlight)) {
            if (future.cancel(false)) {
                cancelled++;
            }
        }
        inFlight.clear();
        List<Runnable> hooks;
        synchronized (this) {
            hooks = List.copyOf(disposeHooks);
        }
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Dispose hook of scope {} failed: {}", name, e.getMessage());
            }
        }
        log.debug("Scope {} disposed, {} call(s) cancelled", name, cancelled);
    }

    @Override
    public void close() {
        dispose();
    }
}
