package FAKit;

import java.util.BitSet;
import java.util.Map;
import java.util.SortedSet;

import FAKit.Model.Automaton;
import FAKit.Model.AutomatonBuilder;
import FAKit.Model.InvalidAutomatonException;
import FAKit.Model.TransitionKey;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Reachability analysis and pruning.
 */
public class DFATrim {

    /**
     * Ids of the states reachable from the initial state, following all symbol and epsilon moves.
     */
    public static BitSet accessibleStates(Automaton automaton) {
        final BitSet reached = new BitSet(automaton.size());
        final IntArrayList stack = new IntArrayList();
        int init = automaton.getIntInitialState();
        reached.set(init);
        stack.push(init);

        while (!stack.isEmpty()) {
            int s = stack.popInt();
            for (int t : automaton.getIntEpsilonSuccessors(s)) {
                if (!reached.get(t)) {
                    reached.set(t);
                    stack.push(t);
                }
            }
            for (int sym = 0; sym < automaton.numInputs(); sym++) {
                for (int t : automaton.getIntSuccessors(s, sym)) {
                    if (!reached.get(t)) {
                        reached.set(t);
                        stack.push(t);
                    }
                }
            }
        }
        return reached;
    }

    public static SortedSet<String> unreachableStates(Automaton automaton) {
        BitSet unreachable = accessibleStates(automaton);
        unreachable.flip(0, automaton.size());
        return BitSetUtils.toStateNames(automaton, unreachable);
    }

    /**
     * Drops every state not reachable from the initial state, along with its transitions. Returns the
     * automaton itself if nothing is dropped.
     */
    public static Automaton trim(Automaton automaton) {
        BitSet reached = accessibleStates(automaton);
        if (reached.cardinality() == automaton.size()) {
            return automaton;
        }
        return restrict(automaton, reached);
    }

    /**
     * Sub-automaton induced by the given state ids, which must include the initial state.
     */
    public static Automaton restrict(Automaton automaton, BitSet keep) {
        final AutomatonBuilder out = new AutomatonBuilder(automaton.getAlphabet());
        for (int s = keep.nextSetBit(0); s >= 0; s = keep.nextSetBit(s + 1)) {
            out.addState(automaton.getState(s), automaton.isAccepting(s));
        }
        out.setInitial(automaton.getInitialState());

        for (Map.Entry<TransitionKey, SortedSet<String>> e : automaton.getTransitions().entrySet()) {
            TransitionKey key = e.getKey();
            if (!keep.get(automaton.getStateId(key.state()))) {
                continue;
            }
            for (String t : e.getValue()) {
                if (keep.get(automaton.getStateId(t))) {
                    out.addTransition(key.state(), key.symbol(), t);
                }
            }
        }

        try {
            return out.build();
        } catch (InvalidAutomatonException e) {
            throw new IllegalArgumentException("State selection must contain the initial state", e);
        }
    }
}
