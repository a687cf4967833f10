package fr.tictak.pulse.client.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Online/offline gate checked before remote calls. Listeners fire only on the offline to online edge.
 */
public class ConnectivityMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

    private final AtomicBoolean online;
    private final List<Runnable> onlineListeners = new CopyOnWriteArrayList<>();

    public ConnectivityMonitor(boolean initiallyOnline) {
        this.online = new AtomicBoolean(initiallyOnline);
    }

    public boolean isOnline() {
        return online.get();
    }

    public void addOnlineListener(Runnable listener) {
        onlineListeners.add(listener);
    }

    public void removeOnlineListener(Runnable listener) {
        onlineListeners.remove(listener);
    }

    public void setOnline(boolean value) {
        boolean previous = online.getAndSet(value);
        if (previous == value) {
            return;
        }
        log.info("Connectivity is now {}", value ? "online" : "offline");
        if (value) {
            for (Runnable listener : onlineListeners) {
                try {
                    listener.run();
                } catch (RuntimeException e) {
                    log.warn("Online listener failed: {}", e.getMessage());
                }
            }
        }
    }
}
