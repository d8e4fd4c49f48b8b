package FAKit.Model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mutable staging area for an {@link Automaton}, in the spirit of AutomataLib's mutable automata.
 * Nothing is checked until {@link #build()}.
 */
public class AutomatonBuilder {
    private final Set<String> states = new LinkedHashSet<>();
    private final Set<String> alphabet = new TreeSet<>();
    private final Set<String> finals = new TreeSet<>();
    private final Map<TransitionKey, Set<String>> transitions = new TreeMap<>();
    private String initial;

    public AutomatonBuilder() {}

    public AutomatonBuilder(Collection<String> alphabet) {
        this.alphabet.addAll(alphabet);
    }

    public AutomatonBuilder addSymbol(String symbol) {
        alphabet.add(symbol);
        return this;
    }

    public AutomatonBuilder addState(String state) {
        states.add(state);
        return this;
    }

    public AutomatonBuilder addState(String state, boolean accepting) {
        states.add(state);
        setAccepting(state, accepting);
        return this;
    }

    public AutomatonBuilder setAccepting(String state, boolean accepting) {
        if (accepting) {
            finals.add(state);
        } else {
            finals.remove(state);
        }
        return this;
    }

    public AutomatonBuilder setInitial(String state) {
        this.initial = state;
        return this;
    }

    public AutomatonBuilder addTransition(String from, String symbol, String to) {
        transitions.computeIfAbsent(new TransitionKey(from, symbol), k -> new TreeSet<>()).add(to);
        return this;
    }

    public AutomatonBuilder addEpsilonTransition(String from, String to) {
        return addTransition(from, Automaton.EPSILON, to);
    }

    public int size() {
        return states.size();
    }

    public Automaton build() throws InvalidAutomatonException {
        return Automaton.of(states, alphabet, initial, finals, transitions);
    }
}
