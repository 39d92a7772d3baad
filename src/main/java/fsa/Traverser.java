package fsa;

import fsa.util.IntSet;
import java.util.Arrays;

/**
 * Step-by-step simulation of an automaton.
 *
 * <p>The traverser holds the current configuration: the set of states the
 * automaton could be in. It starts out as the epsilon-closure of the entry
 * state and each consumed symbol replaces it with the epsilon-closure of the
 * union of the direct targets. For a deterministic automaton the configuration
 * never has more than one member.
 *
 * <p>The traverser works on a snapshot of the automaton taken when it was
 * created: states and transitions registered afterwards are not seen.
 *
 * @param <T> type of the alphabet symbols
 */
public final class Traverser<T> {

  private final StateGraph<T> graph;

  /**
   * If set, every step prints the configuration entered to "standard" error.
   */
  private final boolean printDebugInfo;

  private final String debugTag;

  private IntSet current;

  Traverser(StateGraph<T> graph, State<T> entryPoint, boolean deterministic, boolean printDebugInfo) {
    this.graph = graph;
    this.printDebugInfo = printDebugInfo;
    this.debugTag = deterministic ? "[DFA]" : "[NFA]";
    this.current = graph.epsilonClosure(IntSet.of(graph.indexOf(entryPoint)));

    if (printDebugInfo) {
      System.err.println(debugTag + " starting run at " + graph.render(current));
    }
  }

  /**
   * States the automaton could currently be in.
   *
   * @return current configuration
   */
  public Configuration<T> currentConfiguration() {
    return graph.toConfiguration(current);
  }

  /**
   * Overwrite the current configuration.
   *
   * <p>The configuration is taken as is: no epsilon-closure is applied.
   *
   * @param configuration states to continue the simulation from
   * @throws IllegalArgumentException if a state does not belong to the automaton
   */
  public void setCurrentConfiguration(Configuration<T> configuration) {
    current = graph.toIntSet(configuration);
  }

  /**
   * Whether the current configuration contains an accepting state.
   *
   * @return true if the input consumed so far is accepted
   */
  public boolean isAccepted() {
    return graph.isAccepting(current);
  }

  /**
   * Consume symbols, left to right.
   *
   * @param symbols input symbols
   * @return this traverser
   * @throws InvalidSymbolException if a symbol is not in the alphabet (the
   *         configuration is left at the point just before that symbol)
   */
  @SafeVarargs
  public final Traverser<T> traverse(T... symbols) {
    return traverse(Arrays.asList(symbols));
  }

  /**
   * Consume symbols, left to right.
   *
   * @param symbols input symbols
   * @return this traverser
   * @throws InvalidSymbolException if a symbol is not in the alphabet (the
   *         configuration is left at the point just before that symbol)
   */
  public Traverser<T> traverse(Iterable<? extends T> symbols) {
    for (T symbol : symbols) {
      final int index = graph.alphabet.indexOf(symbol);
      if (index < 0) {
        throw new InvalidSymbolException(symbol, graph.alphabet);
      }
      current = graph.step(current, index);

      if (printDebugInfo) {
        System.err.println(debugTag + " on " + symbol + " entering " + graph.render(current));
      }
    }
    return this;
  }

  @Override
  public String toString() {
    return "Traverser(" + graph.render(current) + ")";
  }
}
