package FAKit.Model;

/**
 * Result of minimization: the minimal DFA and what was removed on the way.
 */
public record Minimization(Automaton dfa, MinimizationReport report) { }
