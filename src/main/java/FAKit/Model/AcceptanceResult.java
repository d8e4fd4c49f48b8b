package FAKit.Model;

import java.util.List;

/**
 * Outcome of testing a word against an automaton.
 *
 * @param automaton the automaton tested
 * @param input the word, one symbol per element
 * @param accepted whether some run accepts the word
 * @param terminalState the accepting state reached, or for a rejected word the state where the run that read
 *                      the most input stopped
 */
public record AcceptanceResult(Automaton automaton, List<String> input, boolean accepted, String terminalState) {

    public AcceptanceResult {
        input = List.copyOf(input);
    }

    /**
     * The input joined back into a single string.
     */
    public String inputString() {
        return String.join("", input);
    }

    public boolean isAccepted() {
        return accepted;
    }
}
