package FAKit.History;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import FAKit.Model.Automaton;

/**
 * Persistence of saved automata, implemented by the storage collaborator. Failures are the implementation's
 * own unchecked exceptions.
 */
public interface HistoryStore {

    /**
     * All entries of a user, most recently updated first.
     */
    List<HistoryEntry> findByUser(long userId);

    Optional<HistoryEntry> find(long id, long userId);

    /**
     * Saves an automaton under {@link HistoryEntry#describe(Automaton)} and returns the stored entry.
     */
    HistoryEntry save(long userId, Automaton automaton, LocalDateTime time);
}
