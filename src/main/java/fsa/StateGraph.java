package fsa;

import fsa.util.IntSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;
import java.util.stream.Collectors;

/**
 * Indexed snapshot of the states of an automaton.
 *
 * <p>States are numbered in ascending name order and symbols by their position
 * in the alphabet, so a set of states is a sorted {@link IntSet} and its
 * rendering follows directly from the index order. Transitions and epsilon
 * edges are stored as index arrays, which keeps the graph free of object
 * cycles and turns epsilon-closure into a worklist over integers.
 *
 * <p>This is where the transition function of the traversal engine lives:
 * {@link #epsilonClosure(IntSet)} and {@link #step(IntSet, int)} are pure
 * functions of their arguments.
 *
 * @param <T> type of the alphabet symbols
 */
final class StateGraph<T> {

  final Alphabet<T> alphabet;

  /**
   * States, indexed. Sorted by name.
   */
  private final List<State<T>> states;

  /**
   * Inverse of {@code states}.
   */
  private final Map<State<T>, Integer> indices;

  /**
   * Targets indexed by source state then symbol index. Inner arrays are sorted.
   */
  private final int[][][] transitions;

  /**
   * Direct epsilon successors, indexed by source state.
   */
  private final int[][] epsilon;

  private final BitSet accepting;

  private StateGraph(Alphabet<T> alphabet, List<State<T>> states) {
    this.alphabet = alphabet;
    this.states = Collections.unmodifiableList(states);

    final var indices = new HashMap<State<T>, Integer>();
    for (int i = 0; i < states.size(); i++) {
      indices.put(states.get(i), i);
    }
    this.indices = Collections.unmodifiableMap(indices);

    this.transitions = new int[states.size()][][];
    this.epsilon = new int[states.size()][];
    this.accepting = new BitSet(states.size());
    for (int i = 0; i < states.size(); i++) {
      final State<T> state = states.get(i);
      final var perSymbol = new int[alphabet.size()][];
      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        perSymbol[symbol] = indicesOf(state.transitionsFor(alphabet.symbol(symbol)));
      }
      transitions[i] = perSymbol;
      epsilon[i] = indicesOf(state.epsilonTargets());
      accepting.set(i, state.isAccepting());
    }
  }

  /**
   * Index a closed set of states.
   *
   * @param alphabet alphabet of the automaton
   * @param states states to index (every transition target must be included)
   * @return indexed graph
   */
  static <T> StateGraph<T> of(Alphabet<T> alphabet, Collection<State<T>> states) {
    final var sorted = new ArrayList<State<T>>(states);
    sorted.sort(Comparator.comparing(State::name));
    return new StateGraph<T>(alphabet, sorted);
  }

  private int[] indicesOf(Collection<State<T>> targets) {
    return targets
      .stream()
      .mapToInt(this::indexOf)
      .sorted()
      .distinct()
      .toArray();
  }

  int size() {
    return states.size();
  }

  State<T> state(int index) {
    return states.get(index);
  }

  /**
   * Index of a state.
   *
   * @param state state in the graph
   * @return index of the state
   * @throws IllegalArgumentException if the state is not part of the graph
   */
  int indexOf(State<T> state) {
    final Integer index = indices.get(state);
    if (index == null) {
      throw new IllegalArgumentException("State " + state + " is not part of this automaton");
    }
    return index;
  }

  boolean isAccepting(int state) {
    return accepting.get(state);
  }

  boolean isAccepting(IntSet configuration) {
    return configuration.stream().anyMatch(accepting::get);
  }

  /**
   * Direct targets of a state on a symbol.
   *
   * @param state index of the source state
   * @param symbol index of the symbol
   * @return sorted target indices (do not modify)
   */
  int[] targets(int state, int symbol) {
    return transitions[state][symbol];
  }

  /**
   * Compute all states reachable from the seeds via zero or more epsilon edges.
   *
   * <p>Cycles of epsilon edges are fine: states are only expanded the first
   * time they are seen.
   *
   * @param seeds states from which to start
   * @return epsilon-closure of the seeds
   */
  IntSet epsilonClosure(IntSet seeds) {
    final var seen = new BitSet(states.size());
    final var toVisit = new Stack<Integer>();

    seeds.forEach((int seed) -> {
      seen.set(seed);
      toVisit.push(seed);
    });

    while (!toVisit.isEmpty()) {
      for (int next : epsilon[toVisit.pop()]) {
        if (!seen.get(next)) {
          seen.set(next);
          toVisit.push(next);
        }
      }
    }

    return IntSet.of(seen);
  }

  /**
   * Consume one symbol from a configuration.
   *
   * @param configuration states the automaton is currently in
   * @param symbol index of the symbol being consumed
   * @return epsilon-closure of the union of the direct targets
   */
  IntSet step(IntSet configuration, int symbol) {
    final var targets = new BitSet(states.size());
    configuration.forEach((int state) -> {
      for (int target : transitions[state][symbol]) {
        targets.set(target);
      }
    });
    return epsilonClosure(IntSet.of(targets));
  }

  /**
   * Public view of an indexed configuration.
   *
   * @param configuration indices of the states
   * @return configuration of the corresponding states
   */
  Configuration<T> toConfiguration(IntSet configuration) {
    return new Configuration<T>(
      configuration
        .stream()
        .mapToObj(states::get)
        .collect(Collectors.toList())
    );
  }

  /**
   * Indexed form of a public configuration.
   *
   * @param configuration states in the configuration
   * @return indices of the states
   * @throws IllegalArgumentException if a state is not part of the graph
   */
  IntSet toIntSet(Configuration<T> configuration) {
    return new IntSet(
      configuration
        .states()
        .stream()
        .map(this::indexOf)
        .collect(Collectors.toList())
    );
  }

  /**
   * Canonical name of a configuration, see {@link Configuration#render}.
   *
   * @param configuration indices of the states
   * @return sorted member names, joined
   */
  String render(IntSet configuration) {
    return Configuration.render(
      configuration
        .stream()
        .mapToObj(i -> states.get(i).name())
        .collect(Collectors.toList())
    );
  }
}
