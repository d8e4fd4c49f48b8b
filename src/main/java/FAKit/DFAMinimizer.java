package FAKit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.IntFunction;

import FAKit.Model.Automaton;
import FAKit.Model.AutomatonBuilder;
import FAKit.Model.InvalidAutomatonException;
import FAKit.Model.Minimization;
import FAKit.Model.MinimizationReport;
import FAKit.Model.NotADFAException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.partitionrefinement.Block;
import net.automatalib.util.partitionrefinement.Hopcroft;
import net.automatalib.util.partitionrefinement.HopcroftInitializers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization: unreachable states are pruned, then indistinguishable states are merged by
 * AutomataLib's Hopcroft partition refinement, starting from the blocks {final, non-final}.
 * <p>
 * Each block becomes one state named after its smallest member (natural string order).
 */
public class DFAMinimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DFAMinimizer.class);

    /**
     * @param dfa a deterministic automaton
     * @return the minimal DFA and the report
     * @throws NotADFAException if the automaton is not deterministic
     */
    public static Minimization minimize(Automaton dfa) throws NotADFAException {
        if (!dfa.isDeterministic()) {
            throw new NotADFAException();
        }

        final SortedSet<String> unreachable = DFATrim.unreachableStates(dfa);
        final Automaton reach = DFATrim.trim(dfa);
        if (!unreachable.isEmpty()) {
            LOGGER.debug("Pruned {} unreachable states: {}", unreachable.size(), unreachable);
        }

        final int[][] blocks = refine(reach);

        // state id -> index of its block
        final int[] blockOf = new int[reach.size()];
        final String[] blockNames = new String[blocks.length];
        for (int b = 0; b < blocks.length; b++) {
            for (int s : blocks[b]) {
                blockOf[s] = b;
            }
            blockNames[b] = reach.getState(blocks[b][0]);
        }

        final AutomatonBuilder out = new AutomatonBuilder(reach.getAlphabet());
        final Map<String, SortedSet<String>> classes = new LinkedHashMap<>();
        for (int b = 0; b < blockNames.length; b++) {
            int rep = blocks[b][0];
            out.addState(blockNames[b], reach.isAccepting(rep));
            SortedSet<String> members = new TreeSet<>();
            for (int s : blocks[b]) {
                members.add(reach.getState(s));
            }
            classes.put(blockNames[b], members);

            for (int sym = 0; sym < reach.numInputs(); sym++) {
                int target = reach.getIntSuccessors(rep, sym)[0];
                out.addTransition(blockNames[b], reach.getSymbol(sym), blockNames[blockOf[target]]);
            }
        }
        out.setInitial(blockNames[blockOf[reach.getIntInitialState()]]);

        final Automaton minimal;
        try {
            minimal = out.build();
        } catch (InvalidAutomatonException e) {
            throw new IllegalStateException("Minimization produced an invalid automaton", e);
        }

        SortedSet<String> deleted = new TreeSet<>(dfa.getStates());
        deleted.removeAll(minimal.getStates());

        LOGGER.debug("Minimized {} states to {}", dfa.size(), minimal.size());
        return new Minimization(minimal, new MinimizationReport(unreachable, deleted, classes));
    }

    /**
     * Whether minimization removes at least one state. Runs the full pipeline.
     */
    public static boolean isMinimizable(Automaton dfa) throws NotADFAException {
        return minimize(dfa).dfa().size() < dfa.size();
    }

    /**
     * Coarsest partition of the (complete, deterministic) automaton compatible with acceptance.
     *
     * @return the blocks, each sorted by state id, ordered by their smallest member
     */
    static int[][] refine(Automaton dfa) {
        final CompactDFA<String> compact;
        try {
            compact = AutomataLibAdapter.toCompactDFA(dfa);
        } catch (NotADFAException e) {
            throw new IllegalArgumentException("Refinement needs a deterministic automaton", e);
        }
        final Alphabet<String> alphabet = compact.getInputAlphabet();
        final IntFunction<Boolean> byAcceptance = dfa::isAccepting;

        final Hopcroft pt = new Hopcroft();
        // unreachable states are already gone
        HopcroftInitializers.initCompleteDeterministic(pt, compact.fullIntAbstraction(alphabet), byAcceptance, false);
        pt.initWorklist(false);
        pt.computeCoarsestStablePartition();

        final List<int[]> blocks = new ArrayList<>(pt.getNumBlocks());
        for (Block block : pt.blockList()) {
            IntArrayList members = new IntArrayList(block.high - block.low);
            for (int i = block.low; i < block.high; i++) {
                members.add(pt.blockData[i]);
            }
            int[] sorted = members.toIntArray();
            Arrays.sort(sorted);
            blocks.add(sorted);
        }
        blocks.sort(Comparator.comparingInt(b -> b[0]));
        LOGGER.debug("Partition refinement: {} blocks", blocks.size());
        return blocks.toArray(new int[0][]);
    }
}
