package FAKit.Model;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Set;

/**
 * Structural comparison of automata up to a consistent renaming of states.
 * <p>
 * Two automata are isomorphic iff they have the same alphabet and there is a bijection between their
 * states that maps initial state to initial state, preserves final-state membership and maps every
 * transition (epsilon included) onto a transition and vice versa.
 */
public final class AutomatonIsomorphism {

    private AutomatonIsomorphism() {}

    public static boolean isomorphic(Automaton a, Automaton b) {
        if (a.size() != b.size()
            || !a.getAlphabet().equals(b.getAlphabet())
            || a.getFinalStates().size() != b.getFinalStates().size()
            || edgeCount(a) != edgeCount(b)) {
            return false;
        }

        final long[] sigA = signatures(a);
        final long[] sigB = signatures(b);
        long[] sortedA = sigA.clone();
        long[] sortedB = sigB.clone();
        Arrays.sort(sortedA);
        Arrays.sort(sortedB);
        if (!Arrays.equals(sortedA, sortedB)) {
            return false;
        }

        int[] order = searchOrder(a);
        int[] mapping = new int[a.size()];
        Arrays.fill(mapping, -1);
        boolean[] used = new boolean[b.size()];

        int initA = a.getIntInitialState();
        int initB = b.getIntInitialState();
        if (sigA[initA] != sigB[initB]) {
            return false;
        }
        mapping[initA] = initB;
        used[initB] = true;
        if (!consistent(a, b, mapping, initA)) {
            return false;
        }
        return extend(a, b, sigA, sigB, order, 1, mapping, used);
    }

    private static boolean extend(Automaton a, Automaton b, long[] sigA, long[] sigB, int[] order, int depth,
                                  int[] mapping, boolean[] used) {
        if (depth == order.length) {
            return true;
        }
        int s = order[depth];
        for (int t = 0; t < b.size(); t++) {
            if (used[t] || sigA[s] != sigB[t]) {
                continue;
            }
            mapping[s] = t;
            used[t] = true;
            if (consistent(a, b, mapping, s) && extend(a, b, sigA, sigB, order, depth + 1, mapping, used)) {
                return true;
            }
            mapping[s] = -1;
            used[t] = false;
        }
        return false;
    }

    /**
     * Checks all edges between the freshly mapped state and every state mapped so far, both directions.
     */
    private static boolean consistent(Automaton a, Automaton b, int[] mapping, int s) {
        int t = mapping[s];
        if (a.isAccepting(s) != b.isAccepting(t)) {
            return false;
        }
        for (int slot = -1; slot < a.numInputs(); slot++) {
            int[] outA = successors(a, s, slot);
            int[] outB = successors(b, t, slot);
            for (int u = 0; u < mapping.length; u++) {
                int v = mapping[u];
                if (v < 0) {
                    continue;
                }
                if (contains(outA, u) != contains(outB, v)) {
                    return false;
                }
                if (contains(successors(a, u, slot), s) != contains(successors(b, v, slot), t)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static int[] successors(Automaton automaton, int state, int slot) {
        return slot < 0 ? automaton.getIntEpsilonSuccessors(state) : automaton.getIntSuccessors(state, slot);
    }

    private static boolean contains(int[] sorted, int value) {
        return Arrays.binarySearch(sorted, value) >= 0;
    }

    // initial state first, then breadth-first over all moves, then whatever is left
    private static int[] searchOrder(Automaton a) {
        int[] order = new int[a.size()];
        boolean[] seen = new boolean[a.size()];
        int n = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(a.getIntInitialState());
        seen[a.getIntInitialState()] = true;
        while (n < order.length) {
            if (queue.isEmpty()) {
                for (int s = 0; s < seen.length; s++) {
                    if (!seen[s]) {
                        seen[s] = true;
                        queue.add(s);
                        break;
                    }
                }
            }
            int s = queue.poll();
            order[n++] = s;
            for (int slot = -1; slot < a.numInputs(); slot++) {
                for (int t : successors(a, s, slot)) {
                    if (!seen[t]) {
                        seen[t] = true;
                        queue.add(t);
                    }
                }
            }
        }
        return order;
    }

    private static long[] signatures(Automaton a) {
        long[] in = new long[a.size()];
        long[] out = new long[a.size()];
        for (int s = 0; s < a.size(); s++) {
            for (int slot = -1; slot < a.numInputs(); slot++) {
                int[] targets = successors(a, s, slot);
                out[s] = out[s] * 31 + targets.length;
                for (int t : targets) {
                    in[t] += (slot + 2L) * 1_000_003L;
                }
            }
        }
        long[] sig = new long[a.size()];
        for (int s = 0; s < a.size(); s++) {
            sig[s] = (out[s] * 1_000_033L + in[s]) * 2 + (a.isAccepting(s) ? 1 : 0);
        }
        return sig;
    }

    private static int edgeCount(Automaton a) {
        int count = 0;
        for (Set<String> targets : a.getTransitions().values()) {
            count += targets.size();
        }
        return count;
    }

    /**
     * Hash code that does not depend on state names.
     */
    public static int invariantHash(Automaton a) {
        long[] sig = signatures(a);
        long initSig = sig[a.getIntInitialState()];
        Arrays.sort(sig);
        int h = a.getAlphabet().hashCode();
        h = 31 * h + Arrays.hashCode(sig);
        h = 31 * h + Long.hashCode(initSig);
        return h == 0 ? 1 : h;
    }
}
