package FAKit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import FAKit.Model.Automaton;
import FAKit.Model.FlatAutomaton;
import FAKit.Model.InvalidAutomatonException;
import FAKit.Model.TransitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the flat textual form shared with the storage collaborator.
 * <p>
 * States, alphabet and final states are written sorted and space separated. Transitions are written as
 * {@code state,symbol=destination}, one entry per destination, sorted, and joined by {@code |}. An empty
 * symbol stands for epsilon, e.g. {@code q0,=q1}.
 */
public class FlatFormat {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlatFormat.class);

    public static final String TRANSITION_DELIMITER = "|";

    private static final Pattern LIST_SEPARATOR = Pattern.compile("[\\s,]+");
    private static final Pattern RESERVED = Pattern.compile("[\\s,=|]");
    private static final Pattern STORED_TRANSITION = Pattern.compile("([^\\s,=|]+),([^\\s,=|]*)=([^\\s,=|]+)");
    private static final Pattern ENTERED_TRANSITION =
        Pattern.compile("(\\w+)\\s*(?:,\\s*(\\w*)|\\s+(\\w+))\\s*(?:=|->|>)\\s*(\\w+)");

    public static FlatAutomaton toFlat(Automaton automaton) {
        for (String s : automaton.getStates()) {
            checkWritable(s);
        }
        for (String a : automaton.getAlphabet()) {
            checkWritable(a);
        }

        List<String> entries = new ArrayList<>();
        for (Map.Entry<TransitionKey, SortedSet<String>> e : automaton.getTransitions().entrySet()) {
            for (String target : e.getValue()) {
                entries.add(e.getKey().state() + "," + e.getKey().symbol() + "=" + target);
            }
        }

        return new FlatAutomaton(String.join(" ", automaton.getStates()),
                                 String.join(" ", automaton.getAlphabet()),
                                 automaton.getInitialState(),
                                 String.join(" ", automaton.getFinalStates()),
                                 String.join(TRANSITION_DELIMITER, entries));
    }

    private static void checkWritable(String name) {
        if (name.isEmpty() || RESERVED.matcher(name).find()) {
            throw new IllegalArgumentException("Name cannot be written in the flat form: '" + name + "'");
        }
    }

    /**
     * Rebuilds an automaton from its stored form. Stored transitions must be well formed.
     *
     * @throws InvalidAutomatonException if an entry is malformed or the data violates the model invariants
     */
    public static Automaton toAutomaton(FlatAutomaton flat) throws InvalidAutomatonException {
        Map<TransitionKey, Set<String>> transitions = new TreeMap<>();
        for (String entry : flat.transitions().split(Pattern.quote(TRANSITION_DELIMITER))) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher m = STORED_TRANSITION.matcher(trimmed);
            if (!m.matches()) {
                throw new InvalidAutomatonException("Malformed transition: '" + trimmed + "'");
            }
            addTransition(transitions, m.group(1), m.group(2), m.group(3));
        }
        return Automaton.of(parseList(flat.states()),
                            parseList(flat.alphabet()),
                            flat.initial().trim(),
                            parseList(flat.finals()),
                            transitions);
    }

    /**
     * Splits a list of names separated by whitespace and/or commas. Order is kept, duplicates dropped.
     */
    public static Set<String> parseList(String text) {
        Set<String> result = new LinkedHashSet<>();
        for (String token : LIST_SEPARATOR.split(text.trim())) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Parses transitions as typed by a user: one per line (or separated by {@code |}), written
     * {@code state,symbol=destination}, {@code state symbol -> destination} or {@code state,symbol>destination}.
     * An empty symbol after a comma ({@code q0,=q1}) is epsilon. Lines that do not match are skipped.
     */
    public static Map<TransitionKey, Set<String>> parseTransitionLines(String text) {
        Map<TransitionKey, Set<String>> transitions = new TreeMap<>();
        for (String line : text.split("[\\r\\n|]+")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher m = ENTERED_TRANSITION.matcher(trimmed);
            if (m.matches()) {
                String symbol = m.group(2) != null ? m.group(2) : m.group(3);
                addTransition(transitions, m.group(1), symbol, m.group(4));
            } else {
                LOGGER.warn("Skipping unparsable transition '{}'", trimmed);
            }
        }
        return transitions;
    }

    private static void addTransition(Map<TransitionKey, Set<String>> transitions, String from, String symbol,
                                      String to) {
        transitions.computeIfAbsent(new TransitionKey(from, symbol), k -> new TreeSet<>()).add(to);
    }

    /**
     * Reads the five-line file form: states, alphabet, initial state, final states, transitions. Missing
     * trailing lines count as empty.
     */
    public static FlatAutomaton readFlat(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        String[] fields = new String[5];
        for (int i = 0; i < fields.length; i++) {
            fields[i] = i < lines.size() ? lines.get(i).trim() : "";
        }
        return new FlatAutomaton(fields[0], fields[1], fields[2], fields[3], fields[4]);
    }

    public static Automaton read(Path path) throws IOException, InvalidAutomatonException {
        return toAutomaton(readFlat(path));
    }

    public static void write(Path path, Automaton automaton) throws IOException {
        Files.write(path, toFlat(automaton).lines(), StandardCharsets.UTF_8);
    }

    /**
     * Convenience for callers holding plain collections, e.g. a data entry form.
     */
    public static Automaton fromEntered(String states, String alphabet, String initial, String finals,
                                        String transitions) throws InvalidAutomatonException {
        return Automaton.of(parseList(states),
                            parseList(alphabet),
                            initial.trim(),
                            parseList(finals),
                            parseTransitionLines(transitions));
    }
}
