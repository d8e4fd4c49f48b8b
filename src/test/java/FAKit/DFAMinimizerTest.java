package FAKit;

import FAKit.Model.AlreadyDeterministicException;
import FAKit.Model.Automaton;
import FAKit.Model.AutomatonBuilder;
import FAKit.Model.Minimization;
import FAKit.Model.MinimizationReport;
import FAKit.Model.NotADFAException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class DFAMinimizerTest {
  // counts a's modulo 4, accepting on even counts; minimal form counts modulo 2
  private static Automaton mod4() {
    AutomatonBuilder b = new AutomatonBuilder(List.of("a", "b"));
    for (int i = 0; i < 4; i++) {
      b.addState("m" + i, i % 2 == 0)
       .addTransition("m" + i, "a", "m" + ((i + 1) % 4))
       .addTransition("m" + i, "b", "m" + i);
    }
    return SampleAutomata.build(b.setInitial("m0"));
  }

  @Test
  void testNotADFA() {
    Assertions.assertThrows(NotADFAException.class, () -> DFAMinimizer.minimize(SampleAutomata.ab()));
    Assertions.assertThrows(NotADFAException.class, () -> DFAMinimizer.isMinimizable(SampleAutomata.epsilon()));
  }

  @Test
  void testUnreachableAndMerged() throws NotADFAException {
    Automaton dfa = SampleAutomata.redundant();
    Minimization min = DFAMinimizer.minimize(dfa);
    MinimizationReport report = min.report();

    Assertions.assertEquals(Set.of("q3"), report.getUnreachable());
    Assertions.assertEquals(Set.of("q2", "q3"), report.getDeleted());
    Assertions.assertEquals(Map.of("q0", Set.of("q0"), "q1", Set.of("q1", "q2")), report.getEquivalenceClasses());
    Assertions.assertEquals("Unreachable: {q3}\nDeleted: {q2, q3}\nq1 = {q1, q2}\n", report.toString());

    Automaton minimal = min.dfa();
    Assertions.assertEquals(List.of("q0", "q1"), minimal.getStates());
    Assertions.assertFalse(minimal.hasState("q3"));
    Assertions.assertEquals("q0", minimal.getInitialState());
    Assertions.assertEquals("q1", minimal.getSuccessor("q0", "b"));
    Assertions.assertEquals("q1", minimal.getSuccessor("q1", "a"));
    Assertions.assertTrue(minimal.isDeterministic());
    PowersetDeterminizerTest.assertSameLanguage(dfa, minimal, 5);
  }

  @Test
  void testMergeCycle() throws NotADFAException {
    Automaton dfa = mod4();
    Assertions.assertTrue(DFAMinimizer.isMinimizable(dfa));
    Minimization min = DFAMinimizer.minimize(dfa);
    Assertions.assertEquals(2, min.dfa().size());
    Assertions.assertEquals(Set.of("m0", "m2"), min.report().getEquivalenceClasses().get("m0"));
    Assertions.assertEquals(Set.of("m1", "m3"), min.report().getEquivalenceClasses().get("m1"));
    Assertions.assertTrue(min.report().getUnreachable().isEmpty());
    PowersetDeterminizerTest.assertSameLanguage(dfa, min.dfa(), 6);
  }

  @Test
  void testIdempotent() throws NotADFAException {
    for (Automaton dfa : List.of(SampleAutomata.redundant(), mod4(), SampleAutomata.abTotal())) {
      Automaton once = DFAMinimizer.minimize(dfa).dfa();
      Minimization twice = DFAMinimizer.minimize(once);
      Assertions.assertEquals(once.size(), twice.dfa().size());
      Assertions.assertEquals(once, twice.dfa());
      Assertions.assertTrue(twice.report().getDeleted().isEmpty());
      Assertions.assertFalse(DFAMinimizer.isMinimizable(once));
    }
  }

  @Test
  void testAlreadyMinimal() throws NotADFAException, AlreadyDeterministicException {
    Assertions.assertFalse(DFAMinimizer.isMinimizable(SampleAutomata.abTotal()));
    Automaton det = PowersetDeterminizer.determinize(SampleAutomata.secondLastA()).dfa();
    Assertions.assertFalse(DFAMinimizer.isMinimizable(det));
    Automaton ab = PowersetDeterminizer.determinize(SampleAutomata.ab()).dfa();
    Assertions.assertEquals(3, DFAMinimizer.minimize(ab).dfa().size());
  }

  @Test
  void testRefine() {
    // ids follow the sorted names m0..m3
    int[][] blocks = DFAMinimizer.refine(mod4());
    Assertions.assertEquals(2, blocks.length);
    Assertions.assertArrayEquals(new int[]{0, 2}, blocks[0]);
    Assertions.assertArrayEquals(new int[]{1, 3}, blocks[1]);

    Assertions.assertThrows(IllegalArgumentException.class, () -> DFAMinimizer.refine(SampleAutomata.ab()));
  }

  @Test
  void testDegenerate() throws NotADFAException {
    // no final states: everything collapses into the initial block
    Automaton dead = SampleAutomata.build(new AutomatonBuilder(List.of("a"))
        .addState("x").addState("y").setInitial("y")
        .addTransition("x", "a", "y")
        .addTransition("y", "a", "x"));
    Minimization min = DFAMinimizer.minimize(dead);
    Assertions.assertEquals(List.of("x"), min.dfa().getStates());
    Assertions.assertEquals("x", min.dfa().getInitialState());
    Assertions.assertEquals(Set.of("y"), min.report().getDeleted());

    // empty alphabet, only the initial state is reachable
    Automaton noInputs = SampleAutomata.build(new AutomatonBuilder()
        .addState("a0", true).addState("a1").addState("a2", true).setInitial("a1"));
    min = DFAMinimizer.minimize(noInputs);
    Assertions.assertEquals(List.of("a1"), min.dfa().getStates());
    Assertions.assertEquals(Set.of("a0", "a2"), min.report().getUnreachable());
    Assertions.assertTrue(DFAMinimizer.isMinimizable(noInputs));
  }
}
