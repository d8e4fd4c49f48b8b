package FAKit;

import FAKit.Model.AlreadyDeterministicException;
import FAKit.Model.Automaton;
import FAKit.Model.AutomatonBuilder;
import FAKit.Model.ConversionReport;
import FAKit.Model.Determinization;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

public class PowersetDeterminizerTest {

  /**
   * All words over the alphabet up to the given length.
   */
  static List<List<String>> words(List<String> alphabet, int maxLength) {
    List<List<String>> result = new ArrayList<>();
    List<List<String>> layer = List.of(List.of());
    result.addAll(layer);
    for (int len = 1; len <= maxLength; len++) {
      List<List<String>> next = new ArrayList<>();
      for (List<String> w : layer) {
        for (String a : alphabet) {
          List<String> longer = new ArrayList<>(w);
          longer.add(a);
          next.add(longer);
        }
      }
      result.addAll(next);
      layer = next;
    }
    return result;
  }

  static void assertSameLanguage(Automaton expected, Automaton actual, int maxLength) {
    for (List<String> w : words(expected.getAlphabet(), maxLength)) {
      Assertions.assertEquals(AcceptanceEngine.check(expected, w).accepted(),
                              AcceptanceEngine.check(actual, w).accepted(),
                              "word " + w);
    }
  }

  static void assertTotal(Automaton dfa) {
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertFalse(dfa.hasEpsilonTransitions());
    for (String s : dfa.getStates()) {
      for (String a : dfa.getAlphabet()) {
        Assertions.assertEquals(1, dfa.getSuccessors(s, a).size());
      }
    }
  }

  @Test
  void testAlreadyDeterministic() {
    Assertions.assertThrows(AlreadyDeterministicException.class,
        () -> PowersetDeterminizer.determinize(SampleAutomata.abTotal()));
  }

  @Test
  void testEpsilonAndTrap() throws AlreadyDeterministicException {
    Determinization det = PowersetDeterminizer.determinize(SampleAutomata.epsilon());
    Automaton dfa = det.dfa();
    ConversionReport report = det.report();

    Assertions.assertEquals(List.of("q'0", "q'1", "q'2"), dfa.getStates());
    Assertions.assertEquals("q'0", dfa.getInitialState());
    Assertions.assertEquals(Set.of("q'1"), dfa.getFinalStates());
    Assertions.assertEquals("q'1", dfa.getSuccessor("q'0", "a"));
    Assertions.assertEquals("q'2", dfa.getSuccessor("q'1", "a"));
    Assertions.assertEquals("q'2", dfa.getSuccessor("q'2", "a"));

    Assertions.assertEquals("q'0", report.getName(new TreeSet<>(Set.of("q0", "q1"))));
    Assertions.assertEquals("q'1", report.getName(new TreeSet<>(Set.of("q2"))));
    Assertions.assertEquals(Optional.of("q'2"), report.getTrapState());
    Assertions.assertEquals("q'0 = {q0, q1}\nq'1 = {q2}\nq'2 = {}\n", report.toString());
    assertTotal(dfa);
  }

  @Test
  void testNamingOrder() throws AlreadyDeterministicException {
    Determinization det = PowersetDeterminizer.determinize(SampleAutomata.ab());
    Automaton dfa = det.dfa();
    Assertions.assertEquals("q'1", dfa.getSuccessor("q'0", "a"));
    Assertions.assertEquals("q'2", dfa.getSuccessor("q'0", "b"));
    Assertions.assertEquals("q'2", dfa.getSuccessor("q'1", "a"));
    Assertions.assertEquals("q'0", dfa.getSuccessor("q'1", "b"));
    Assertions.assertEquals(List.of(Set.of("q0"), Set.of("q1"), Set.of()),
                            new ArrayList<>(det.report().getSubsetNames().keySet()));
    assertTotal(dfa);
    assertSameLanguage(SampleAutomata.ab(), dfa, 6);
  }

  @Test
  void testNoTrapNeeded() throws AlreadyDeterministicException {
    Automaton nfa = SampleAutomata.secondLastA();
    Determinization det = PowersetDeterminizer.determinize(nfa);
    Assertions.assertEquals(4, det.dfa().size());
    Assertions.assertEquals(Optional.empty(), det.report().getTrapState());
    Assertions.assertEquals("q'3", det.report().getName(new TreeSet<>(Set.of("p", "s"))));
    assertTotal(det.dfa());
    assertSameLanguage(nfa, det.dfa(), 7);
  }

  @Test
  void testPrefix() throws AlreadyDeterministicException {
    Automaton nfa = SampleAutomata.build(new AutomatonBuilder(List.of("a"))
        .addState("q'start").addState("q''x", true).setInitial("q'start")
        .addTransition("q'start", "a", "q''x"));

    PowersetDeterminizer determinizer = new PowersetDeterminizer();
    Assertions.assertEquals("q'''", determinizer.freshPrefix(nfa));
    Automaton dfa = determinizer.convert(nfa).dfa();
    Assertions.assertEquals(List.of("q'''0", "q'''1", "q'''2"), dfa.getStates());

    dfa = new PowersetDeterminizer("D").convert(nfa).dfa();
    Assertions.assertEquals("D0", dfa.getInitialState());
    assertSameLanguage(nfa, dfa, 4);

    Assertions.assertThrows(IllegalArgumentException.class, () -> new PowersetDeterminizer(""));
  }
}
