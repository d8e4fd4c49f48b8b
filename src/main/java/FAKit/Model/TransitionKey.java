package FAKit.Model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Key of the transition relation: a source state and a symbol. The empty symbol stands for epsilon.
 */
public record TransitionKey(String state, String symbol) implements Comparable<TransitionKey> {

    private static final Comparator<TransitionKey> ORDER =
        Comparator.comparing(TransitionKey::state).thenComparing(TransitionKey::symbol);

    public TransitionKey {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(symbol, "symbol");
    }

    public static TransitionKey epsilon(String state) {
        return new TransitionKey(state, Automaton.EPSILON);
    }

    public boolean isEpsilon() {
        return symbol.isEmpty();
    }

    @Override
    public int compareTo(TransitionKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + (isEpsilon() ? "ε" : symbol) + ")";
    }
}
