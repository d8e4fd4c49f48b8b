package FAKit.Model;

/**
 * Result of subset construction: the DFA and the names given to the subsets.
 */
public record Determinization(Automaton dfa, ConversionReport report) { }
