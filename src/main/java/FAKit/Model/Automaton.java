package FAKit.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Immutable finite automaton over string states and string symbols. The same type represents NFAs and
 * DFAs; {@link #getDeterminism()} tells them apart.
 * <p>
 * Besides the name-based view, states and symbols are numbered in their natural order, which gives
 * an int-based view ({@link #getStateId(String)}, {@link #getIntSuccessors(int, int)}, ...) for the
 * algorithms.
 * <p>
 * {@link #equals(Object)} compares automata up to a consistent renaming of states.
 */
public final class Automaton {
    /**
     * The reserved epsilon pseudo-symbol.
     */
    public static final String EPSILON = "";

    private static final int[] NO_SUCCESSORS = new int[0];

    private final List<String> states;
    private final List<String> alphabet;
    private final String initial;
    private final SortedSet<String> finals;
    private final SortedMap<TransitionKey, SortedSet<String>> transitions;

    private final Object2IntMap<String> stateIds;
    private final Object2IntMap<String> symbolIds;
    private final BitSet finalIds;
    // successors[0] holds epsilon moves, successors[i + 1] moves under symbol i
    private final int[][][] successors;
    private final int initialId;
    private final Determinism determinism;

    private int hash;

    private Automaton(SortedSet<String> states,
                      SortedSet<String> alphabet,
                      String initial,
                      SortedSet<String> finals,
                      SortedMap<TransitionKey, SortedSet<String>> transitions) {
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.alphabet = Collections.unmodifiableList(new ArrayList<>(alphabet));
        this.initial = initial;
        this.finals = Collections.unmodifiableSortedSet(finals);
        this.transitions = Collections.unmodifiableSortedMap(transitions);

        this.stateIds = index(this.states);
        this.symbolIds = index(this.alphabet);
        this.initialId = stateIds.getInt(initial);

        this.finalIds = new BitSet(this.states.size());
        for (String f : finals) {
            finalIds.set(stateIds.getInt(f));
        }

        this.successors = new int[this.alphabet.size() + 1][this.states.size()][];
        for (int[][] row : successors) {
            Arrays.fill(row, NO_SUCCESSORS);
        }
        for (Map.Entry<TransitionKey, SortedSet<String>> e : transitions.entrySet()) {
            TransitionKey key = e.getKey();
            int slot = key.isEpsilon() ? 0 : symbolIds.getInt(key.symbol()) + 1;
            int[] targets = new int[e.getValue().size()];
            int i = 0;
            for (String target : e.getValue()) {
                targets[i++] = stateIds.getInt(target);
            }
            successors[slot][stateIds.getInt(key.state())] = targets;
        }

        this.determinism = classify(states, alphabet, transitions);
    }

    private static Object2IntMap<String> index(List<String> names) {
        Object2IntOpenHashMap<String> ids = new Object2IntOpenHashMap<>(names.size());
        ids.defaultReturnValue(-1);
        for (int i = 0; i < names.size(); i++) {
            ids.put(names.get(i), i);
        }
        return ids;
    }

    /**
     * Creates an automaton, checking all invariants.
     *
     * @param states all states, non-empty
     * @param alphabet input symbols, none of them empty
     * @param initial the initial state
     * @param finals the final (accepting) states
     * @param transitions (state, symbol) to destination states; the empty symbol denotes epsilon
     * @return the automaton
     * @throws InvalidAutomatonException if {@link #validate} rejects the data
     */
    public static Automaton of(Set<String> states,
                               Set<String> alphabet,
                               String initial,
                               Set<String> finals,
                               Map<TransitionKey, ? extends Set<String>> transitions)
        throws InvalidAutomatonException {
        if (!validate(states, alphabet, initial, finals, transitions)) {
            throw new InvalidAutomatonException("Invalid FA data provided.");
        }
        SortedMap<TransitionKey, SortedSet<String>> normalized = new TreeMap<>();
        for (Map.Entry<TransitionKey, ? extends Set<String>> e : transitions.entrySet()) {
            if (!e.getValue().isEmpty()) {
                normalized.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
            }
        }
        return new Automaton(new TreeSet<>(states), new TreeSet<>(alphabet), initial, new TreeSet<>(finals),
                             normalized);
    }

    /**
     * Checks the model invariants. Never throws.
     *
     * @return true if the data describes a valid automaton
     */
    public static boolean validate(Set<String> states,
                                   Set<String> alphabet,
                                   String initial,
                                   Set<String> finals,
                                   Map<TransitionKey, ? extends Set<String>> transitions) {
        if (states == null || alphabet == null || initial == null || finals == null || transitions == null) {
            return false;
        }
        if (states.isEmpty() || containsNull(states) || containsNull(alphabet)) {
            return false;
        }
        if (alphabet.contains(EPSILON)) {
            return false;
        }
        if (!states.contains(initial)) {
            return false;
        }
        if (containsNull(finals) || !states.containsAll(finals)) {
            return false;
        }
        for (Map.Entry<TransitionKey, ? extends Set<String>> e : transitions.entrySet()) {
            TransitionKey key = e.getKey();
            Set<String> targets = e.getValue();
            if (key == null || key.state() == null || key.symbol() == null || targets == null) {
                return false;
            }
            if (!states.contains(key.state())) {
                return false;
            }
            if (!key.isEpsilon() && !alphabet.contains(key.symbol())) {
                return false;
            }
            if (containsNull(targets) || !states.containsAll(targets)) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsNull(Collection<String> values) {
        for (String v : values) {
            if (v == null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Classifies automaton data. Deterministic means: for every state and every alphabet symbol
     * exactly one destination, and no epsilon transition at all. Data that fails {@link #validate}
     * is never deterministic. Never throws.
     */
    public static Determinism classify(Set<String> states,
                                       Set<String> alphabet,
                                       String initial,
                                       Set<String> finals,
                                       Map<TransitionKey, ? extends Set<String>> transitions) {
        if (!validate(states, alphabet, initial, finals, transitions)) {
            return Determinism.NON_DETERMINISTIC;
        }
        return classify(states, alphabet, transitions);
    }

    private static Determinism classify(Set<String> states,
                                        Set<String> alphabet,
                                        Map<TransitionKey, ? extends Set<String>> transitions) {
        for (Map.Entry<TransitionKey, ? extends Set<String>> e : transitions.entrySet()) {
            if (e.getKey().isEpsilon() && !e.getValue().isEmpty()) {
                return Determinism.NON_DETERMINISTIC;
            }
        }
        for (String state : states) {
            for (String symbol : alphabet) {
                Set<String> targets = transitions.get(new TransitionKey(state, symbol));
                if (targets == null || targets.size() != 1) {
                    return Determinism.NON_DETERMINISTIC;
                }
            }
        }
        return Determinism.DETERMINISTIC;
    }

    public static Determinism classify(Automaton automaton) {
        return automaton.determinism;
    }

    /** States in natural order. */
    public List<String> getStates() {
        return states;
    }

    /** Symbols in natural order. */
    public List<String> getAlphabet() {
        return alphabet;
    }

    public String getInitialState() {
        return initial;
    }

    public SortedSet<String> getFinalStates() {
        return finals;
    }

    public SortedMap<TransitionKey, SortedSet<String>> getTransitions() {
        return transitions;
    }

    public boolean isAccepting(String state) {
        return finals.contains(state);
    }

    public boolean hasState(String state) {
        return stateIds.containsKey(state);
    }

    /**
     * @return the destinations of (state, symbol), empty if there is no such transition
     */
    public SortedSet<String> getSuccessors(String state, String symbol) {
        SortedSet<String> targets = transitions.get(new TransitionKey(state, symbol));
        return targets == null ? Collections.emptySortedSet() : targets;
    }

    public SortedSet<String> getEpsilonSuccessors(String state) {
        return getSuccessors(state, EPSILON);
    }

    /**
     * The single destination of (state, symbol), or null if there is none or more than one.
     */
    public String getSuccessor(String state, String symbol) {
        SortedSet<String> targets = getSuccessors(state, symbol);
        return targets.size() == 1 ? targets.first() : null;
    }

    public boolean hasEpsilonTransitions() {
        for (TransitionKey key : transitions.keySet()) {
            if (key.isEpsilon()) {
                return true;
            }
        }
        return false;
    }

    public Determinism getDeterminism() {
        return determinism;
    }

    public boolean isDeterministic() {
        return determinism == Determinism.DETERMINISTIC;
    }

    public int size() {
        return states.size();
    }

    public int numInputs() {
        return alphabet.size();
    }

    // int view

    public int getStateId(String state) {
        return stateIds.getInt(state);
    }

    public String getState(int stateId) {
        return states.get(stateId);
    }

    /**
     * @return the index of the symbol, or -1 if it is not part of the alphabet
     */
    public int getSymbolIndex(String symbol) {
        return symbolIds.getInt(symbol);
    }

    public String getSymbol(int symbolIndex) {
        return alphabet.get(symbolIndex);
    }

    public int getIntInitialState() {
        return initialId;
    }

    public boolean isAccepting(int stateId) {
        return finalIds.get(stateId);
    }

    /**
     * @return a copy of the final state ids
     */
    public BitSet getFinalStateIds() {
        return (BitSet) finalIds.clone();
    }

    /**
     * Successor ids under the symbol with the given index, ascending. The array must not be modified.
     */
    public int[] getIntSuccessors(int stateId, int symbolIndex) {
        return successors[symbolIndex + 1][stateId];
    }

    /**
     * Epsilon successor ids, ascending. The array must not be modified.
     */
    public int[] getIntEpsilonSuccessors(int stateId) {
        return successors[0][stateId];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton other = (Automaton) o;
        return hashCode() == other.hashCode() && AutomatonIsomorphism.isomorphic(this, other);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = AutomatonIsomorphism.invariantHash(this);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return "FA(" + states + ", " + alphabet + ", " + initial + ", " + finals + ", " + transitions + ")";
    }
}
