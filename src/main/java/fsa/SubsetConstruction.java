package fsa;

import fsa.util.IntSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Stack;

/**
 * Conversion of an NFA into an equivalent DFA via subset construction.
 *
 * <p>The states of the DFA are the configurations of the NFA which can be
 * reached from the epsilon-closure of its entry point. Configurations are
 * keyed on their sorted state indices, so discovering the same set of states
 * in a different order lands on the same row.
 *
 * <p>An example, over the alphabet {@code {0,1}} with states {@code a} (start)
 * and {@code b} (accepting): {@code a} goes to {@code a} or {@code b} on
 * {@code 0} and to {@code b} on {@code 1}; {@code b} goes to {@code a} on
 * {@code 0} and nowhere on {@code 1}. The table is:
 *
 * <pre>
 *            |  0     |  1
 *   → {a}    | {a,b}  | {b}
 *   F {a,b}  | {a,b}  | {b}
 *   F {b}    | {a}    | ∅
 *     ∅      | ∅      | ∅
 * </pre>
 *
 * Each row becomes one state of the DFA, named after the row. The empty set
 * becomes a rejecting sink state of its own.
 *
 * <p>Row names are only distinct as long as the NFA state names do not contain
 * <code>,</code>, <code>{</code> or <code>}</code>: with such names two
 * different configurations can render the same, and materializing the second
 * one fails with a {@link DuplicateStateException}.
 *
 * @param <T> type of the alphabet symbols
 */
public final class SubsetConstruction<T> {

  /**
   * No limit on the number of DFA states.
   */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private final Automaton<T> dfa;
  private final TransitionTable<T> table;

  private SubsetConstruction(Automaton<T> dfa, TransitionTable<T> table) {
    this.dfa = dfa;
    this.table = table;
  }

  /**
   * The DFA which was built.
   *
   * @return deterministic automaton accepting the same language as the input
   */
  public Automaton<T> dfa() {
    return dfa;
  }

  /**
   * Table of NFA configurations to successor configurations.
   *
   * @return full transition table
   */
  public TransitionTable<T> table() {
    return table;
  }

  /**
   * Run subset construction without any limit on the size of the output.
   *
   * @param nfa automaton to convert (it is not modified)
   * @return equivalent DFA along with its table
   * @throws NoEntryPointException if the automaton has no entry point
   */
  public static <T> SubsetConstruction<T> run(Automaton<T> nfa) {
    return run(nfa, UNBOUNDED);
  }

  /**
   * Run subset construction.
   *
   * <p>The number of DFA states is at most {@code 2^n} for an NFA with
   * {@code n} states, so termination is guaranteed. The limit is there to
   * bound the work on pathological inputs.
   *
   * @param nfa automaton to convert (it is not modified)
   * @param maxStates largest number of DFA states to build
   * @return equivalent DFA along with its table
   * @throws NoEntryPointException if the automaton has no entry point
   * @throws StateLimitExceededException if more than {@code maxStates} DFA
   *         states are discovered
   * @throws DuplicateStateException if two configurations render to the same name
   */
  public static <T> SubsetConstruction<T> run(Automaton<T> nfa, int maxStates) {
    if (maxStates < 1) {
      throw new IllegalArgumentException("maxStates must be positive, but got " + maxStates);
    }
    final State<T> entryPoint = nfa.entryPoint().orElseThrow(NoEntryPointException::new);
    final StateGraph<T> graph = nfa.stateGraph();
    final Alphabet<T> alphabet = nfa.alphabet();

    // Rows of the table: configuration to successor configuration of each symbol
    final var rows = new LinkedHashMap<IntSet, IntSet[]>();

    // Rows whose columns still need to be filled
    final var toVisit = new Stack<IntSet>();

    final IntSet initial = graph.epsilonClosure(IntSet.of(graph.indexOf(entryPoint)));
    rows.put(initial, new IntSet[alphabet.size()]);
    toVisit.push(initial);

    while (!toVisit.isEmpty()) {
      final IntSet configuration = toVisit.pop();
      final IntSet[] columns = rows.get(configuration);

      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        final IntSet successor = graph.step(configuration, symbol);
        columns[symbol] = successor;

        if (!rows.containsKey(successor)) {
          if (rows.size() >= maxStates) {
            throw new StateLimitExceededException(maxStates);
          }
          rows.put(successor, new IntSet[alphabet.size()]);
          toVisit.push(successor);
        }
      }
    }

    // One DFA state per row
    final var dfa = new Automaton<T>(alphabet, true);
    final var dfaStates = new HashMap<IntSet, State<T>>();
    for (IntSet configuration : rows.keySet()) {
      dfaStates.put(
        configuration,
        dfa.makeState(graph.render(configuration), graph.isAccepting(configuration))
      );
    }

    // Wire up the transitions
    final var tableRows = new ArrayList<TransitionTable.Row>();
    for (Map.Entry<IntSet, IntSet[]> row : rows.entrySet()) {
      final State<T> from = dfaStates.get(row.getKey());
      final List<Optional<String>> successors = new ArrayList<>();
      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        final State<T> to = dfaStates.get(row.getValue()[symbol]);
        from.addTransition(alphabet.symbol(symbol), to);
        successors.add(Optional.of(to.name()));
      }
      tableRows.add(new TransitionTable.Row(
        from.name(),
        row.getKey().equals(initial),
        from.isAccepting(),
        successors
      ));
    }

    dfa.setEntryPoint(dfaStates.get(initial));
    return new SubsetConstruction<T>(dfa, new TransitionTable<T>(alphabet, tableRows));
  }
}
