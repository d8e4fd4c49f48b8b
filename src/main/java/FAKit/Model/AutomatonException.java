package FAKit.Model;

/**
 * Base class of the recoverable error kinds raised by automaton operations.
 */
public class AutomatonException extends Exception {

    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
