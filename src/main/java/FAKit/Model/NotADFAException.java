package FAKit.Model;

public class NotADFAException extends AutomatonException {

    public NotADFAException() {
        super("The automaton is not a DFA.");
    }
}
