package FAKit;

import FAKit.Model.Automaton;
import FAKit.Model.AutomatonBuilder;
import FAKit.Model.FlatAutomaton;
import FAKit.Model.InvalidAutomatonException;
import FAKit.Model.TransitionKey;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class FlatFormatTest {
  @Test
  void testToFlat() {
    FlatAutomaton flat = FlatFormat.toFlat(SampleAutomata.redundant());
    Assertions.assertEquals("q0 q1 q2 q3", flat.states());
    Assertions.assertEquals("a b", flat.alphabet());
    Assertions.assertEquals("q0", flat.initial());
    Assertions.assertEquals("q1 q2", flat.finals());
    Assertions.assertEquals("q0,a=q1|q0,b=q2|q1,a=q1|q1,b=q1|q2,a=q2|q2,b=q2|q3,a=q0|q3,b=q3", flat.transitions());

    flat = FlatFormat.toFlat(SampleAutomata.epsilon());
    Assertions.assertEquals("q0,=q1|q1,a=q2", flat.transitions());

    // one entry per destination
    flat = FlatFormat.toFlat(SampleAutomata.secondLastA());
    Assertions.assertEquals("p,a=p|p,a=r|p,b=p|r,a=s|r,b=s", flat.transitions());
  }

  @Test
  void testUnwritableNames() {
    Automaton fa = SampleAutomata.build(new AutomatonBuilder().addState("a|b").setInitial("a|b"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> FlatFormat.toFlat(fa));

    // an empty state name would read back as a malformed transition
    Automaton unnamed = SampleAutomata.build(new AutomatonBuilder(List.of("a"))
        .addState("").addState("q1").setInitial("")
        .addTransition("", "a", "q1"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> FlatFormat.toFlat(unnamed));
  }

  @Test
  void testToAutomaton() throws InvalidAutomatonException {
    for (Automaton fa : List.of(SampleAutomata.ab(), SampleAutomata.epsilon(), SampleAutomata.redundant(),
                                SampleAutomata.secondLastA())) {
      FlatAutomaton flat = FlatFormat.toFlat(fa);
      Automaton back = FlatFormat.toAutomaton(flat);
      Assertions.assertEquals(fa.getStates(), back.getStates());
      Assertions.assertEquals(fa.getTransitions(), back.getTransitions());
      Assertions.assertEquals(flat, FlatFormat.toFlat(back));
    }

    // empty finals and transitions
    Automaton single = FlatFormat.toAutomaton(new FlatAutomaton("q0", "", "q0", "", ""));
    Assertions.assertEquals(1, single.size());
    Assertions.assertTrue(single.getFinalStates().isEmpty());
  }

  @Test
  void testMalformed() {
    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> FlatFormat.toAutomaton(new FlatAutomaton("q0 q1", "a", "q0", "", "q0,a->q1")));
    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> FlatFormat.toAutomaton(new FlatAutomaton("q0 q1", "a", "q0", "", "q0,a=q2")));
    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> FlatFormat.toAutomaton(new FlatAutomaton("q0 q1", "a", "", "", "")));
    Assertions.assertThrows(NullPointerException.class, () -> new FlatAutomaton("q0", "a", "q0", null, ""));
  }

  @Test
  void testParseList() {
    Assertions.assertEquals(List.of("q0", "q1", "q2"), List.copyOf(FlatFormat.parseList(" q0, q1  q2,q1 ")));
    Assertions.assertTrue(FlatFormat.parseList("  ").isEmpty());
  }

  @Test
  void testParseTransitionLines() {
    Map<TransitionKey, Set<String>> tf = FlatFormat.parseTransitionLines(
        "q0,a=q1\n  q0 b -> q0\r\nq1, a > q1|q1,=q0\nnot a transition\n\nq0 -> q1");
    Assertions.assertEquals(Set.of("q1"), tf.get(new TransitionKey("q0", "a")));
    Assertions.assertEquals(Set.of("q0"), tf.get(new TransitionKey("q0", "b")));
    Assertions.assertEquals(Set.of("q1"), tf.get(new TransitionKey("q1", "a")));
    Assertions.assertEquals(Set.of("q0"), tf.get(TransitionKey.epsilon("q1")));
    Assertions.assertEquals(4, tf.size());
  }

  @Test
  void testFromEntered() throws InvalidAutomatonException {
    Automaton fa = FlatFormat.fromEntered("q0, q1", "a b", " q0 ", "q1", "q0 a -> q1\nq1 b -> q0");
    Assertions.assertEquals(SampleAutomata.ab(), fa);
    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> FlatFormat.fromEntered("q0", "a", "q0", "q1", ""));
  }

  @Test
  void testFiles(@TempDir Path dir) throws IOException, InvalidAutomatonException {
    Automaton fromResource = FlatFormat.read(SampleAutomata.resource("ab.fa"));
    Assertions.assertEquals(SampleAutomata.ab(), fromResource);

    Path out = dir.resolve("out.fa");
    FlatFormat.write(out, SampleAutomata.epsilon());
    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    Assertions.assertEquals(List.of("q0 q1 q2", "a", "q0", "q2", "q0,=q1|q1,a=q2"), lines);
    Assertions.assertEquals(SampleAutomata.epsilon(), FlatFormat.read(out));

    // missing trailing lines are empty
    Path shortFile = dir.resolve("short.fa");
    Files.write(shortFile, List.of("q0", "a", "q0"), StandardCharsets.UTF_8);
    FlatAutomaton flat = FlatFormat.readFlat(shortFile);
    Assertions.assertEquals("", flat.finals());
    Assertions.assertEquals("", flat.transitions());

    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> FlatFormat.read(SampleAutomata.resource("invalid.fa")));
  }
}
