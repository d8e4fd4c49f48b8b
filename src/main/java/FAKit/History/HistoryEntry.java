package FAKit.History;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

import FAKit.FlatFormat;
import FAKit.Model.Automaton;
import FAKit.Model.FlatAutomaton;
import FAKit.Model.InvalidAutomatonException;

/**
 * A saved automaton as kept by the storage collaborator.
 *
 * @param id storage id
 * @param userId owner
 * @param name display name, see {@link #describe(Automaton)}
 * @param automaton the stored flat form
 * @param updatedAt time of the last save
 */
public record HistoryEntry(long id, long userId, String name, FlatAutomaton automaton, LocalDateTime updatedAt) {

    public HistoryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(automaton, "automaton");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /**
     * Display name of an automaton, e.g. {@code An NFA with 3 states, 2 inputs. Starts at q0.}
     */
    public static String describe(Automaton automaton) {
        return (automaton.isDeterministic() ? "A DFA" : "An NFA")
            + " with " + plural(automaton.size(), "state")
            + ", " + plural(automaton.numInputs(), "input")
            + ". Starts at " + automaton.getInitialState() + ".";
    }

    /**
     * How long ago {@code then} was, in whole seconds, minutes, hours or days, e.g. {@code 3 minutes ago}.
     * Times in the future count as {@code 0 seconds ago}.
     */
    public static String timeSince(LocalDateTime then, LocalDateTime now) {
        long seconds = Math.max(0, Duration.between(then, now).getSeconds());
        if (seconds < 60) {
            return plural(seconds, "second") + " ago";
        } else if (seconds < 3600) {
            return plural(seconds / 60, "minute") + " ago";
        } else if (seconds < 86400) {
            return plural(seconds / 3600, "hour") + " ago";
        }
        return plural(seconds / 86400, "day") + " ago";
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s");
    }

    public Automaton toAutomaton() throws InvalidAutomatonException {
        return FlatFormat.toAutomaton(automaton);
    }

    /**
     * Name and age, as offered when picking from the history.
     */
    public String label(LocalDateTime now) {
        return name + " ~ " + timeSince(updatedAt, now);
    }
}
