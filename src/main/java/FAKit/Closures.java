package FAKit;

import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;

import FAKit.Model.Automaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Epsilon-closure and symbol-move primitives over one automaton.
 * <p>
 * The name-based methods are thin wrappers around the {@link BitSet} ones, which work on state ids
 * ({@link Automaton#getStateId(String)}).
 */
public class Closures {
    private final Automaton automaton;

    public Closures(Automaton automaton) {
        this.automaton = automaton;
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    /**
     * States reachable from the given state with zero or more epsilon moves, the state itself included.
     */
    public Set<String> epsilonClosure(String state) {
        return epsilonClosure(Collections.singleton(state));
    }

    /**
     * Union of the epsilon closures of the given states.
     */
    public Set<String> epsilonClosure(Collection<String> states) {
        return BitSetUtils.toStateNames(automaton, epsilonClosure(BitSetUtils.toStateIds(automaton, states)));
    }

    /**
     * Union of the destinations of the given states under a (non-epsilon) symbol.
     */
    public Set<String> move(Collection<String> states, String symbol) {
        return BitSetUtils.toStateNames(automaton, move(BitSetUtils.toStateIds(automaton, states), symbol));
    }

    /**
     * Epsilon closure of a set of state ids. Each state is expanded once, so epsilon cycles terminate.
     *
     * @param states state ids; not modified
     * @return a new set containing the closure
     */
    public BitSet epsilonClosure(BitSet states) {
        final BitSet closure = (BitSet) states.clone();
        final IntArrayList stack = new IntArrayList();
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            stack.push(s);
        }
        while (!stack.isEmpty()) {
            int s = stack.popInt();
            for (int t : automaton.getIntEpsilonSuccessors(s)) {
                if (!closure.get(t)) {
                    closure.set(t);
                    stack.push(t);
                }
            }
        }
        return closure;
    }

    /**
     * Destinations of a set of state ids under a symbol. Symbols outside the alphabet lead nowhere.
     */
    public BitSet move(BitSet states, String symbol) {
        int symbolIndex = automaton.getSymbolIndex(symbol);
        if (symbolIndex < 0) {
            return new BitSet(automaton.size());
        }
        return move(states, symbolIndex);
    }

    public BitSet move(BitSet states, int symbolIndex) {
        final BitSet result = new BitSet(automaton.size());
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            for (int t : automaton.getIntSuccessors(s, symbolIndex)) {
                result.set(t);
            }
        }
        return result;
    }

    /**
     * Closure of the move: the states a set of states can be in after reading one symbol.
     */
    public BitSet successor(BitSet states, int symbolIndex) {
        return epsilonClosure(move(states, symbolIndex));
    }
}
