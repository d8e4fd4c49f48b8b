package FAKit.Model;

import java.util.BitSet;

/**
 * A subset of NFA state ids paired with the name of the DFA state it becomes.
 */
public record DeterminizeRecord(BitSet subset, String name) {

  @Override
  public String toString() {
    return name + ": " + subset;
  }
}
