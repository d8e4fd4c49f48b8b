package FAKit;

import FAKit.History.HistoryEntry;
import FAKit.Model.AcceptanceResult;
import FAKit.Model.Automaton;
import FAKit.Model.AutomatonException;
import FAKit.Model.Determinization;
import FAKit.Model.Minimization;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class FAKitCommandLine {
  // read by slf4j-simple when the first logger is created
  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  /**
   * Text printed for an operation, and the automaton it produced, if any.
   */
  record Outcome(String text, Automaton automaton) {}

  public static void main(String[] args) {
    String outFile = null;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        System.setProperty(LOG_LEVEL_PROPERTY, "debug");
      } else if ("--out".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --out");
          printUsageAndExit(1); // exits
        }
        outFile = args[++i]; // consume the value
      } else if ("--help".equalsIgnoreCase(arg)) {
        printUsageAndExit(0);
      } else if (arg.startsWith("-") && arg.length() > 1) {
        // Unknown flag
        printUsageAndExit(1);
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2 || positional.size() > 3) {
      printUsageAndExit(1);
    }

    String operation = positional.get(0);
    String filePath = positional.get(1);
    String input = positional.size() == 3 ? positional.get(2) : null;

    try {
      final Automaton automaton = FlatFormat.read(Path.of(filePath));
      final Outcome outcome = runOperation(operation, automaton, input);
      System.out.print(outcome.text());

      if (outFile != null && outcome.automaton() != null) {
        System.out.println("Writing to file: " + outFile);
        FlatFormat.write(Path.of(outFile), outcome.automaton());
      }
    } catch (AutomatonException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsageAndExit(1);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void printUsageAndExit(int status) {
    System.out.println(
        "FAKit [--debug] [--out <output file>] <operation> <automaton file> [input]");
    System.out.println("[--debug] : Debug output of the algorithms");
    System.out.println("[--out <output file>] : Write the resulting automaton to the specified file");
    System.out.println();
    System.out.println("<operation> : one of the choices below:");
    System.out.println("  classify: Tell whether the automaton is a DFA or an NFA.");
    System.out.println("  test: Test whether the automaton accepts [input], one symbol per character.");
    System.out.println("  convert: Subset construction, NFA to DFA.");
    System.out.println("  minimize: Minimize a DFA.");
    System.out.println("  minimizable: Tell whether minimizing the DFA would remove states.");
    System.out.println();
    System.out.println("<automaton file> : five lines: states, alphabet, initial state, final states, transitions.");
    System.out.println("  Transitions are written state,symbol=destination and separated by '|'.");
    System.out.println("  An empty symbol is an epsilon move.");
    System.exit(status);
  }

  /**
   * Run one operation.
   * @param operation - operation passed in from command-line
   * @param automaton - automaton read from the input file
   * @param input - the word to test; only used by {@code test}
   * @return - printed text, and the resulting automaton for {@code convert} and {@code minimize}
   * @throws AutomatonException - if the operation does not apply to the automaton
   * @throws IllegalArgumentException - for an unknown operation, or {@code test} without input
   */
  static Outcome runOperation(String operation, Automaton automaton, String input) throws AutomatonException {
    return switch (operation.toLowerCase()) {
      case "classify" -> new Outcome(HistoryEntry.describe(automaton) + System.lineSeparator(), null);
      case "test" -> test(automaton, input);
      case "convert" -> convert(automaton);
      case "minimize" -> minimize(automaton);
      case "minimizable" -> new Outcome(
          (DFAMinimizer.isMinimizable(automaton) ? "Minimizable" : "Already minimal") + System.lineSeparator(),
          null);
      default -> throw new IllegalArgumentException("Unexpected operation: " + operation);
    };
  }

  private static Outcome test(Automaton automaton, String input) {
    if (input == null) {
      throw new IllegalArgumentException("Operation test needs an input string");
    }
    AcceptanceResult result = AcceptanceEngine.checkString(automaton, input);
    String text = "'" + result.inputString() + "' is " + (result.accepted() ? "accepted" : "rejected")
        + ", ends at " + result.terminalState() + System.lineSeparator();
    return new Outcome(text, null);
  }

  private static Outcome convert(Automaton automaton) throws AutomatonException {
    Determinization det = PowersetDeterminizer.determinize(automaton);
    StringBuilder sb = new StringBuilder();
    sb.append("Original NFA size: ").append(automaton.size()).append(System.lineSeparator());
    sb.append("DFA size: ").append(det.dfa().size()).append(System.lineSeparator());
    appendLines(sb, det.report().toString());
    appendFlat(sb, det.dfa());
    return new Outcome(sb.toString(), det.dfa());
  }

  private static Outcome minimize(Automaton automaton) throws AutomatonException {
    Minimization min = DFAMinimizer.minimize(automaton);
    StringBuilder sb = new StringBuilder();
    sb.append("Original DFA size: ").append(automaton.size()).append(System.lineSeparator());
    sb.append("Minimized DFA size: ").append(min.dfa().size()).append(System.lineSeparator());
    appendLines(sb, min.report().toString());
    appendFlat(sb, min.dfa());
    return new Outcome(sb.toString(), min.dfa());
  }

  private static void appendFlat(StringBuilder sb, Automaton automaton) {
    for (String line : FlatFormat.toFlat(automaton).lines()) {
      sb.append(line).append(System.lineSeparator());
    }
  }

  private static void appendLines(StringBuilder sb, String text) {
    for (String line : text.split("\n")) {
      if (!line.isEmpty()) {
        sb.append(line).append(System.lineSeparator());
      }
    }
  }
}
