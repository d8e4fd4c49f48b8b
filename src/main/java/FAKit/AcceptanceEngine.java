package FAKit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import FAKit.Model.AcceptanceResult;
import FAKit.Model.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tests words against an automaton by exhaustive nondeterministic search.
 * <p>
 * A configuration is a state together with the number of symbols read so far. The search is depth-first
 * over an explicit stack: epsilon successors are explored before symbol successors, and lower state ids
 * before higher ones. The answer of a configuration does not depend on how it was reached, so each one is
 * expanded at most once; this bounds the work by |states| * (|word| + 1) and makes epsilon cycles harmless.
 */
public final class AcceptanceEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AcceptanceEngine.class);

    private AcceptanceEngine() {}

    /**
     * Tests a string, reading one character per step.
     */
    public static AcceptanceResult checkString(Automaton automaton, String input) {
        return check(automaton, tokenize(input));
    }

    /**
     * Tests a word given as a list of symbols, which allows multi-character symbols.
     */
    public static AcceptanceResult check(Automaton automaton, List<String> word) {
        final int length = word.size();
        final int[] symbols = new int[length];
        for (int i = 0; i < length; i++) {
            symbols[i] = automaton.getSymbolIndex(word.get(i));
        }

        // seen[position]: states already expanded at that position, allocated on first visit
        final BitSet[] seen = new BitSet[length + 1];
        final Deque<Configuration> stack = new ArrayDeque<>();

        Configuration init = new Configuration(automaton.getIntInitialState(), 0);
        push(stack, seen, init);

        Configuration furthest = init;
        long explored = 0;

        while (!stack.isEmpty()) {
            Configuration curr = stack.pop();
            explored++;
            if (curr.position > furthest.position) {
                furthest = curr;
            }

            if (curr.position == length && automaton.isAccepting(curr.state)) {
                LOGGER.debug("Accepted {} after {} configurations", word, explored);
                return new AcceptanceResult(automaton, word, true, automaton.getState(curr.state));
            }

            // pushed in reverse so that epsilon moves, then symbol moves, pop in ascending state order
            if (curr.position < length && symbols[curr.position] >= 0) {
                int[] next = automaton.getIntSuccessors(curr.state, symbols[curr.position]);
                for (int i = next.length - 1; i >= 0; i--) {
                    push(stack, seen, new Configuration(next[i], curr.position + 1));
                }
            }
            int[] eps = automaton.getIntEpsilonSuccessors(curr.state);
            for (int i = eps.length - 1; i >= 0; i--) {
                push(stack, seen, new Configuration(eps[i], curr.position));
            }
        }

        LOGGER.debug("Rejected {} after {} configurations", word, explored);
        return new AcceptanceResult(automaton, word, false, automaton.getState(furthest.state));
    }

    private static void push(Deque<Configuration> stack, BitSet[] seen, Configuration c) {
        BitSet atPosition = seen[c.position];
        if (atPosition == null) {
            atPosition = new BitSet();
            seen[c.position] = atPosition;
        }
        if (!atPosition.get(c.state)) {
            atPosition.set(c.state);
            stack.push(c);
        }
    }

    /**
     * Splits a string into one symbol per character (code point).
     */
    public static List<String> tokenize(String input) {
        List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return symbols;
    }

    private record Configuration(int state, int position) {}
}
