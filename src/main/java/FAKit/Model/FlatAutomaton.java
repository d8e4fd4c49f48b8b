package FAKit.Model;

import java.util.List;
import java.util.Objects;

/**
 * The persisted textual form of an automaton: five plain strings, as stored by the history collaborator.
 *
 * @param states space separated states
 * @param alphabet space separated symbols
 * @param initial the initial state
 * @param finals space separated final states
 * @param transitions {@code state,symbol=destination} entries joined by {@code |}; an empty symbol is epsilon
 */
public record FlatAutomaton(String states, String alphabet, String initial, String finals, String transitions) {

    public FlatAutomaton {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(alphabet, "alphabet");
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(finals, "finals");
        Objects.requireNonNull(transitions, "transitions");
    }

    /**
     * The five fields in order, one per line of the file form.
     */
    public List<String> lines() {
        return List.of(states, alphabet, initial, finals, transitions);
    }
}
