package io.uvlanalyzer.core.engine;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded cache of {@link ModelSession}s keyed by model text. A session is created at most once
 * per text while it stays cached; a text that fails to parse is never cached. When the cache is
 * full the oldest entry is evicted. Evicted sessions remain valid for callers that still hold
 * them.
 *
 * <p>
 * Thread-safe. A capacity of {@code 0} disables caching.
 */
public final class ModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ModelRegistry.class);

    private final int capacity;
    private final Map<String, ModelSession> sessions = new ConcurrentHashMap<>();
    private final Queue<String> insertionOrder = new ConcurrentLinkedQueue<>();

    public ModelRegistry(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Returns the cached session for the text, creating it with {@code factory} on a miss.
     * Exceptions from the factory propagate and leave the cache unchanged.
     */
    public ModelSession getOrCreate(String text, Function<String, ModelSession> factory) {
        if (capacity == 0) {
            return factory.apply(text);
        }
        ModelSession session = sessions.computeIfAbsent(text, key -> {
            ModelSession created = factory.apply(key);
            insertionOrder.add(key);
            return created;
        });
        evictOverflow();
        return session;
    }

    private void evictOverflow() {
        while (sessions.size() > capacity) {
            String oldest = insertionOrder.poll();
            if (oldest == null) {
                return;
            }
            if (sessions.remove(oldest) != null) {
                LOG.debug("Evicted cached model session (cache capacity {})", capacity);
            }
        }
    }

    /** Number of cached sessions. */
    public int size() {
        return sessions.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Drops every cached session. */
    public void clear() {
        sessions.clear();
        insertionOrder.clear();
    }
}
