package FAKit;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;

import FAKit.Model.AlreadyDeterministicException;
import FAKit.Model.Automaton;
import FAKit.Model.AutomatonBuilder;
import FAKit.Model.ConversionReport;
import FAKit.Model.DeterminizeRecord;
import FAKit.Model.Determinization;
import FAKit.Model.InvalidAutomatonException;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction. Converts an NFA (epsilon moves allowed) into an equivalent, total DFA.
 * <p>
 * Subsets are discovered from the epsilon closure of the initial state and processed first-in first-out,
 * each one trying the symbols in alphabet order. Every newly discovered subset gets the next sequential name
 * {@code prefix + n}, so names follow discovery order and are reproducible. The empty subset, if reached,
 * becomes an explicit trap state looping on every symbol.
 */
public class PowersetDeterminizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PowersetDeterminizer.class);

    public static final String DEFAULT_PREFIX = "q'";

    private final String prefix;

    public PowersetDeterminizer() {
        this(DEFAULT_PREFIX);
    }

    /**
     * @param prefix prefix of the generated state names, e.g. {@code q'} for {@code q'0, q'1, ...}
     */
    public PowersetDeterminizer(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Name prefix must not be empty");
        }
        this.prefix = prefix;
    }

    public static Determinization determinize(Automaton nfa) throws AlreadyDeterministicException {
        return new PowersetDeterminizer().convert(nfa);
    }

    /**
     * @param nfa a non-deterministic automaton
     * @return the DFA and the subset naming
     * @throws AlreadyDeterministicException if the automaton already classifies as deterministic
     */
    public Determinization convert(Automaton nfa) throws AlreadyDeterministicException {
        if (nfa.isDeterministic()) {
            throw new AlreadyDeterministicException();
        }

        final Closures closures = new Closures(nfa);
        final BitSet finals = nfa.getFinalStateIds();
        final String namePrefix = freshPrefix(nfa);

        final Map<BitSet, String> outStateMap = new Object2ObjectOpenHashMap<>();
        final Map<SortedSet<String>, String> subsetNames = new LinkedHashMap<>();
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();
        final AutomatonBuilder out = new AutomatonBuilder(nfa.getAlphabet());

        BitSet initSingleton = new BitSet(nfa.size());
        initSingleton.set(nfa.getIntInitialState());
        BitSet init = closures.epsilonClosure(initSingleton);
        String initOut = addState(init, namePrefix, finals, nfa, outStateMap, subsetNames, out);
        out.setInitial(initOut);
        queue.add(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            DeterminizeRecord curr = queue.poll();

            for (int sym = 0; sym < nfa.numInputs(); sym++) {
                BitSet succ = closures.successor(curr.subset(), sym);

                String outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA and to queue
                    outSucc = addState(succ, namePrefix, finals, nfa, outStateMap, subsetNames, out);
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(curr.name(), nfa.getSymbol(sym), outSucc);
            }
        }

        LOGGER.debug("Subset construction: {} NFA states -> {} DFA states", nfa.size(), out.size());

        try {
            return new Determinization(out.build(), new ConversionReport(subsetNames));
        } catch (InvalidAutomatonException e) {
            throw new IllegalStateException("Subset construction produced an invalid automaton", e);
        }
    }

    private static String addState(BitSet subset,
                                   String namePrefix,
                                   BitSet finals,
                                   Automaton nfa,
                                   Map<BitSet, String> outStateMap,
                                   Map<SortedSet<String>, String> subsetNames,
                                   AutomatonBuilder out) {
        String name = namePrefix + outStateMap.size();
        outStateMap.put(subset, name);
        subsetNames.put(BitSetUtils.toStateNames(nfa, subset), name);
        out.addState(name, subset.intersects(finals));
        return name;
    }

    /**
     * Extends the prefix with apostrophes until no original state name starts with it, so generated names
     * can never be mistaken for original ones.
     */
    String freshPrefix(Automaton nfa) {
        String p = prefix;
        while (startsAny(nfa, p)) {
            p = p + "'";
        }
        return p;
    }

    private static boolean startsAny(Automaton nfa, String p) {
        for (String s : nfa.getStates()) {
            if (s.startsWith(p)) {
                return true;
            }
        }
        return false;
    }
}
