package FAKit;

import java.util.BitSet;
import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

import FAKit.Model.Automaton;

public class BitSetUtils {
    /**
     * State ids of the named states. Names unknown to the automaton are ignored.
     */
    public static BitSet toStateIds(Automaton automaton, Collection<String> states) {
        BitSet ids = new BitSet(automaton.size());
        for (String s : states) {
            int id = automaton.getStateId(s);
            if (id >= 0) {
                ids.set(id);
            }
        }
        return ids;
    }

    /**
     * State names of the ids, in natural order.
     */
    public static SortedSet<String> toStateNames(Automaton automaton, BitSet ids) {
        SortedSet<String> names = new TreeSet<>();
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            names.add(automaton.getState(i));
        }
        return names;
    }
}
