package FAKit.Model;

public class AlreadyDeterministicException extends AutomatonException {

    public AlreadyDeterministicException() {
        super("The automaton is already a DFA.");
    }
}
