package fsa;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * State in a finite automaton.
 *
 * <p>States are identified by their name: two state objects with the same name
 * are equal and hash the same. Deduplication in the automaton and in the
 * algorithms relies on this, so names must be unique inside an automaton.
 *
 * <p>A deterministic state maps each symbol to at most one target and has no
 * epsilon edges. A nondeterministic state has neither restriction.
 *
 * @param <T> type of the alphabet symbols
 */
public final class State<T> {

  private final String name;
  private final Alphabet<T> alphabet;
  private final boolean deterministic;
  private final boolean accepting;

  /**
   * Transition table (insertion ordered, for both the symbols and targets).
   */
  private final Map<T, Set<State<T>>> transitions = new LinkedHashMap<>();

  /**
   * Direct epsilon successors.
   */
  private final Set<State<T>> epsilon = new LinkedHashSet<>();

  /**
   * @param name unique name used to identify the state
   * @param alphabet symbols on which this state may transition
   * @param deterministic whether this state forbids epsilon edges and multiple
   *                      targets for one symbol
   * @param accepting whether this state is a final (accept) state
   */
  public State(String name, Alphabet<T> alphabet, boolean deterministic, boolean accepting) {
    this.name = Objects.requireNonNull(name, "state name");
    this.alphabet = Objects.requireNonNull(alphabet, "state alphabet");
    this.deterministic = deterministic;
    this.accepting = accepting;
  }

  public String name() {
    return name;
  }

  public Alphabet<T> alphabet() {
    return alphabet;
  }

  public boolean isDeterministic() {
    return deterministic;
  }

  public boolean isAccepting() {
    return accepting;
  }

  /**
   * Declare that a symbol leads from this state to the given states.
   *
   * <p>Adding a target which is already registered for the symbol is a no-op.
   *
   * @param symbol symbol from the alphabet
   * @param targets states to transition to
   * @throws InvalidSymbolException if the symbol is not in the alphabet
   * @throws DeterminismViolationException if this state is deterministic and
   *         the symbol would end up with more than one distinct target
   */
  @SafeVarargs
  public final void addTransition(T symbol, State<T>... targets) {
    final var newTargets = new LinkedHashSet<State<T>>(Arrays.asList(targets));
    checkTransition(symbol, newTargets);
    putTransition(symbol, newTargets);
  }

  /**
   * Declare that each of a group of symbols leads from this state to the given
   * states.
   *
   * <p>Either every transition is added or, if any of them is rejected, none
   * is.
   *
   * @param symbols symbols from the alphabet
   * @param targets states to transition to
   * @throws InvalidSymbolException if a symbol is not in the alphabet
   * @throws DeterminismViolationException if this state is deterministic and
   *         one of the symbols would end up with more than one distinct target
   * @see #addTransition(Object, State[])
   */
  @SafeVarargs
  public final void addTransition(Collection<? extends T> symbols, State<T>... targets) {
    final var newTargets = new LinkedHashSet<State<T>>(Arrays.asList(targets));
    for (T symbol : symbols) {
      checkTransition(symbol, newTargets);
    }
    for (T symbol : symbols) {
      putTransition(symbol, newTargets);
    }
  }

  private void checkTransition(T symbol, Set<State<T>> newTargets) {
    if (!alphabet.contains(symbol)) {
      throw new InvalidSymbolException(symbol, alphabet);
    }

    if (deterministic) {
      final var combined = new LinkedHashSet<State<T>>(transitionsFor(symbol));
      combined.addAll(newTargets);
      if (combined.size() > 1) {
        throw new DeterminismViolationException(
          name,
          "only one target allowed for " + symbol + " but got " + combined
        );
      }
    }
  }

  private void putTransition(T symbol, Set<State<T>> newTargets) {
    if (!newTargets.isEmpty()) {
      transitions
        .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
        .addAll(newTargets);
    }
  }

  /**
   * Declare epsilon transitions from this state.
   *
   * @param targets states reachable without consuming input
   * @throws DeterminismViolationException if this state is deterministic
   */
  @SafeVarargs
  public final void addEpsilon(State<T>... targets) {
    if (deterministic) {
      throw new DeterminismViolationException(name, "epsilon-transitions are not possible in DFA models");
    }
    epsilon.addAll(Arrays.asList(targets));
  }

  /**
   * Direct targets of a symbol.
   *
   * @param symbol input symbol
   * @return unmodifiable view of the targets (empty if none are defined)
   */
  public Set<State<T>> transitionsFor(T symbol) {
    final var targets = transitions.get(symbol);
    return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
  }

  /**
   * Symbols on which this state has at least one transition.
   *
   * @return unmodifiable view of the symbols, in the order they were added
   */
  public Set<T> symbols() {
    return Collections.unmodifiableSet(transitions.keySet());
  }

  /**
   * Direct epsilon successors.
   *
   * <p>Only one hop: if {@code a} has an epsilon edge to {@code b} and {@code b}
   * to {@code c}, then {@code c} is not in the epsilon targets of {@code a}.
   *
   * @return unmodifiable view of the epsilon successors
   */
  public Set<State<T>> epsilonTargets() {
    return Collections.unmodifiableSet(epsilon);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj || (obj instanceof State<?> other && other.name.equals(name));
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
