package FAKit.Model;

/**
 * Raised when automaton data violates the model invariants, either at construction or when
 * reading the flat textual form.
 */
public class InvalidAutomatonException extends AutomatonException {

    public InvalidAutomatonException(String message) {
        super(message);
    }

    public InvalidAutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
