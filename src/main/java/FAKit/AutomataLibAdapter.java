package FAKit;

import java.util.BitSet;

import FAKit.Model.Automaton;
import FAKit.Model.NotADFAException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion to AutomataLib's compact automata. State ids and symbol indices are kept, so state {@code i}
 * of the result is {@code automaton.getState(i)} and input index {@code a} is {@code automaton.getSymbol(a)}.
 */
public class AutomataLibAdapter {

    public static Alphabet<String> alphabetOf(Automaton automaton) {
        return Alphabets.fromCollection(automaton.getAlphabet());
    }

    /**
     * AutomataLib has no epsilon moves, so they are folded in: the initial states are the epsilon closure
     * of the initial state and every successor set is closed under epsilon. Accepting states are kept as
     * they are, the language is the same.
     */
    public static CompactNFA<String> toCompactNFA(Automaton automaton) {
        final Alphabet<String> alphabet = alphabetOf(automaton);
        final int states = automaton.size();
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, states);
        final Closures closures = new Closures(automaton);

        for (int i = 0; i < states; i++) {
            nfa.addState(automaton.isAccepting(i));
        }

        BitSet init = new BitSet(states);
        init.set(automaton.getIntInitialState());
        init = closures.epsilonClosure(init);
        for (int i = init.nextSetBit(0); i >= 0; i = init.nextSetBit(i + 1)) {
            nfa.setInitial(i, true);
        }

        for (int i = 0; i < states; i++) {
            BitSet single = new BitSet(states);
            single.set(i);
            for (int a = 0; a < alphabet.size(); a++) {
                BitSet succ = closures.successor(single, a);
                for (int t = succ.nextSetBit(0); t >= 0; t = succ.nextSetBit(t + 1)) {
                    nfa.addTransition(i, a, t);
                }
            }
        }
        return nfa;
    }

    /**
     * @throws NotADFAException if the automaton is not deterministic
     */
    public static CompactDFA<String> toCompactDFA(Automaton dfa) throws NotADFAException {
        if (!dfa.isDeterministic()) {
            throw new NotADFAException();
        }
        final Alphabet<String> alphabet = alphabetOf(dfa);
        final int states = dfa.size();
        final CompactDFA<String> result = new CompactDFA<>(alphabet, states);

        for (int i = 0; i < states; i++) {
            result.addState(dfa.isAccepting(i));
        }
        result.setInitialState(dfa.getIntInitialState());
        for (int i = 0; i < states; i++) {
            for (int a = 0; a < alphabet.size(); a++) {
                result.setTransition(i, a, dfa.getIntSuccessors(i, a)[0]);
            }
        }
        return result;
    }
}
