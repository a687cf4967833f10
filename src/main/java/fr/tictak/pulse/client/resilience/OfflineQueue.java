package fr.tictak.pulse.client.resilience;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.tictak.pulse.client.ErrorKind;
import fr.tictak.pulse.client.PulseClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Durable FIFO of deferred requests, stored as a JSON array. Every change rewrites the file through a temporary
 * file and an atomic move, so a crash leaves either the old or the new content.
 *
 * <p>Replay is sequential in enqueue order. A transient failure stops the pass and the entry keeps its place.
 * An entry that reaches the attempt ceiling, or fails for any other reason, is dropped and reported to the
 * permanent failure listeners.
 */
public class OfflineQueue {

    private static final Logger log = LoggerFactory.getLogger(OfflineQueue.class);
    private static final TypeReference<List<OfflineQueueEntry>> ENTRIES = new TypeReference<>() {
    };

    @FunctionalInterface
    public interface ReplayHandler {
        void send(OfflineQueueEntry entry) throws Exception;
    }

    public record PermanentFailure(OfflineQueueEntry entry, Throwable error) {
    }

    public record ReplayReport(int replayed, int dropped, boolean stoppedOnTransient, int remaining) {

        static ReplayReport skipped(int remaining) {
            return new ReplayReport(0, 0, false, remaining);
        }
    }

    private final Path file;
    private final int maxAttempts;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final List<OfflineQueueEntry> entries;
    private final List<Consumer<PermanentFailure>> failureListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean replaying = new AtomicBoolean();

    public OfflineQueue(Path file, int maxAttempts, ErrorClassifier classifier, Clock clock) {
        this.file = file;
        this.maxAttempts = maxAttempts;
        this.classifier = classifier;
        this.clock = clock;
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        this.entries = load();
    }

    public void addPermanentFailureListener(Consumer<PermanentFailure> listener) {
        failureListeners.add(listener);
    }

    public synchronized OfflineQueueEntry enqueue(String method, String endpoint, Object payload) {
        JsonNode body = payload == null ? null : mapper.valueToTree(payload);
        OfflineQueueEntry entry = new OfflineQueueEntry(UUID.randomUUID().toString(), method, endpoint, body,
                clock.instant(), 0);
        List<OfflineQueueEntry> next = new ArrayList<>(entries);
        next.add(entry);
        commit(next);
        log.info("Queued {} {} for replay ({} pending)", method, endpoint, entries.size());
        return entry;
    }

    public synchronized List<OfflineQueueEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public boolean isReplaying() {
        return replaying.get();
    }

    /**
     * Replays pending entries one by one. Only one pass runs at a time; a concurrent call returns immediately.
     */
    public ReplayReport replay(ReplayHandler handler) {
        if (!replaying.compareAndSet(false, true)) {
            return ReplayReport.skipped(size());
        }
        int replayed = 0;
        int dropped = 0;
        boolean stopped = false;
        try {
            while (true) {
                OfflineQueueEntry head;
                synchronized (this) {
                    if (entries.isEmpty()) {
                        break;
                    }
                    head = entries.get(0);
                }
                try {
                    handler.send(head);
                    remove(head);
                    replayed++;
                    continue;
                } catch (Exception e) {
                    if (classifier.isTransient(e)) {
                        OfflineQueueEntry retried = head.withAttempts(head.attempts() + 1);
                        if (retried.attempts() >= maxAttempts) {
                            remove(head);
                            dropped++;
                            surface(retried, e);
                        } else {
                            replace(head, retried);
                            log.info("Replay of {} {} failed ({} attempt(s)), pausing replay: {}",
                                    head.method(), head.endpoint(), retried.attempts(), e.getMessage());
                        }
                        stopped = true;
                        break;
                    }
                    remove(head);
                    dropped++;
                    surface(head, e);
                }
            }
        } finally {
            replaying.set(false);
        }
        ReplayReport report = new ReplayReport(replayed, dropped, stopped, size());
        if (replayed > 0 || dropped > 0) {
            log.info("Replay pass: {} replayed, {} dropped, {} remaining", replayed, dropped, report.remaining());
        }
        return report;
    }

    private synchronized void remove(OfflineQueueEntry entry) {
        List<OfflineQueueEntry> next = new ArrayList<>(entries);
        next.removeIf(e -> e.id().equals(entry.id()));
        commit(next);
    }

    private synchronized void replace(OfflineQueueEntry current, OfflineQueueEntry updated) {
        List<OfflineQueueEntry> next = new ArrayList<>(entries);
        next.replaceAll(e -> e.id().equals(current.id()) ? updated : e);
        commit(next);
    }

    /**
     * Writes {@code next} to disk, then makes it the in-memory queue. A failed write leaves both untouched.
     */
    private void commit(List<OfflineQueueEntry> next) {
        persist(next);
        entries.clear();
        entries.addAll(next);
    }

    private void surface(OfflineQueueEntry entry, Throwable error) {
        log.warn("Dropping queued {} {} after {} attempt(s): {}", entry.method(), entry.endpoint(), entry.attempts(),
                error.getMessage());
        PermanentFailure failure = new PermanentFailure(entry, error);
        for (Consumer<PermanentFailure> listener : failureListeners) {
            try {
                listener.accept(failure);
            } catch (RuntimeException e) {
                log.warn("Permanent failure listener failed: {}", e.getMessage());
            }
        }
    }

    private List<OfflineQueueEntry> load() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<OfflineQueueEntry> loaded = mapper.readValue(file.toFile(), ENTRIES);
            log.info("Loaded {} queued request(s) from {}", loaded.size(), file);
            return new ArrayList<>(loaded);
        } catch (IOException e) {
            throw new PulseClientException(ErrorKind.FATAL, "Cannot read offline queue " + file, e);
        }
    }

    private void persist(List<OfflineQueueEntry> snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PulseClientException(ErrorKind.FATAL, "Cannot write offline queue " + file, e);
        }
    }
}
