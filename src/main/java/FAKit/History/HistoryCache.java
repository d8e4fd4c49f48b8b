package FAKit.History;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import FAKit.Model.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-user cache of history listings in front of a {@link HistoryStore}.
 * <p>
 * A user's list is loaded on first use and kept until that user saves, or until {@link #invalidate(long)}
 * or {@link #invalidateAll()} is called by the owner, e.g. from a periodic task.
 */
public class HistoryCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryCache.class);

    private final HistoryStore store;
    private final Map<Long, List<HistoryEntry>> cache = new HashMap<>();

    public HistoryCache(HistoryStore delegate) {
        this.store = delegate;
    }

    public synchronized List<HistoryEntry> entries(long userId) {
        return cache.computeIfAbsent(userId, id -> {
            LOGGER.debug("Loading history of user {}", id);
            return List.copyOf(store.findByUser(id));
        });
    }

    /**
     * Looks the entry up in the user's cached list, and asks the store when the list does not have it.
     */
    public synchronized Optional<HistoryEntry> find(long id, long userId) {
        for (HistoryEntry entry : entries(userId)) {
            if (entry.id() == id) {
                return Optional.of(entry);
            }
        }
        LOGGER.debug("Entry {} of user {} not cached", id, userId);
        return store.find(id, userId);
    }

    /**
     * Writes through to the store and drops the user's cached list.
     */
    public synchronized HistoryEntry save(long userId, Automaton automaton, LocalDateTime time) {
        HistoryEntry saved = store.save(userId, automaton, time);
        invalidate(userId);
        return saved;
    }

    public synchronized void invalidate(long userId) {
        cache.remove(userId);
    }

    public synchronized void invalidateAll() {
        LOGGER.debug("Clearing history cache ({} users)", cache.size());
        cache.clear();
    }
}
