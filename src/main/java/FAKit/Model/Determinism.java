package FAKit.Model;

public enum Determinism {
    DETERMINISTIC,
    NON_DETERMINISTIC
}
