package fsa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Stack;
import java.util.stream.Stream;

/**
 * Finite automaton over an alphabet, either deterministic or nondeterministic.
 *
 * <p>The automaton owns its states: those created with {@link #makeState} and
 * those registered with {@link #addState} (along with everything reachable
 * from them at the time). Transition targets do not have to be registered
 * beforehand; {@link #allStates()} computes the reachable closure on demand.
 *
 * <p>Conversion to a DFA and minimization always produce a new automaton and
 * never modify this one. Registering states is not thread-safe.
 *
 * @param <T> type of the alphabet symbols
 */
public final class Automaton<T> implements DotGraph<String, String> {

  private final Alphabet<T> alphabet;
  private final boolean deterministic;

  /**
   * Owned states, keyed by name (insertion ordered).
   */
  private final Map<String, State<T>> states = new LinkedHashMap<>();

  /**
   * Which state the automaton starts at (if any).
   */
  private State<T> entryPoint = null;

  public Automaton(Alphabet<T> alphabet, boolean deterministic) {
    this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
    this.deterministic = deterministic;
  }

  public Alphabet<T> alphabet() {
    return alphabet;
  }

  public boolean isDeterministic() {
    return deterministic;
  }

  /**
   * Start state of the automaton.
   *
   * @return entry point, if one was set
   */
  public Optional<State<T>> entryPoint() {
    return Optional.ofNullable(entryPoint);
  }

  /**
   * Set the start state of the automaton.
   *
   * @param state owned state to start at
   * @throws IllegalArgumentException if the state is not owned by this automaton
   */
  public void setEntryPoint(State<T> state) {
    final State<T> owned = state == null ? null : states.get(state.name());
    if (owned == null) {
      throw new IllegalArgumentException("State " + state + " is not valid for this automaton");
    }
    entryPoint = owned;
  }

  /**
   * Create and register a non-accepting state.
   *
   * @param name unique name of the state
   * @return the new state
   * @see #makeState(String, boolean)
   */
  public State<T> makeState(String name) {
    return makeState(name, false);
  }

  /**
   * Create and register a state. The state is deterministic exactly when this
   * automaton is.
   *
   * @param name unique name of the state
   * @param accepting whether the state is a final (accept) state
   * @return the new state
   * @throws DuplicateStateException if the automaton already has a state by that name
   */
  public State<T> makeState(String name, boolean accepting) {
    if (states.containsKey(name)) {
      throw new DuplicateStateException(name);
    }
    final var state = new State<T>(name, alphabet, deterministic, accepting);
    states.put(name, state);
    return state;
  }

  /**
   * Register a state, along with every state reachable from it through
   * transitions or epsilon edges.
   *
   * <p>States are identified by name: a state whose name is already registered
   * is not registered again. Nothing is registered if any of the reachable
   * states is rejected.
   *
   * @param state state to register
   * @return whether the given state was not registered before
   * @throws DeterminismMismatchException if this automaton is deterministic and
   *         a nondeterministic state would be registered
   * @throws IllegalArgumentException if a state uses a different alphabet
   */
  public boolean addState(State<T> state) {
    final boolean isNew = !states.containsKey(state.name());

    final var toRegister = new LinkedHashSet<State<T>>();
    final var toVisit = new Stack<State<T>>();
    if (isNew) {
      toRegister.add(state);
      toVisit.push(state);
    }

    while (!toVisit.isEmpty()) {
      for (State<T> next : successors(toVisit.pop())) {
        if (!states.containsKey(next.name()) && toRegister.add(next)) {
          toVisit.push(next);
        }
      }
    }

    for (State<T> candidate : toRegister) {
      checkCompatible(candidate);
    }
    for (State<T> candidate : toRegister) {
      states.put(candidate.name(), candidate);
    }

    return isNew;
  }

  /**
   * Register states, along with every state reachable from them.
   *
   * @param states states to register
   * @see #addState(State)
   */
  @SafeVarargs
  public final void addStates(State<T>... states) {
    for (State<T> state : states) {
      addState(state);
    }
  }

  private void checkCompatible(State<T> state) {
    if (deterministic && !state.isDeterministic()) {
      throw new DeterminismMismatchException(state.name());
    }
    if (!alphabet.equals(state.alphabet())) {
      throw new IllegalArgumentException(
        "State " + state + " uses alphabet " + state.alphabet() + " instead of " + alphabet
      );
    }
  }

  // Direct successors through transitions and epsilon edges
  private List<State<T>> successors(State<T> state) {
    final var output = new ArrayList<State<T>>();
    for (T symbol : state.symbols()) {
      output.addAll(state.transitionsFor(symbol));
    }
    output.addAll(state.epsilonTargets());
    return output;
  }

  /**
   * Look up an owned state.
   *
   * @param name name of the state
   * @return state by that name, if it is owned
   */
  public Optional<State<T>> state(String name) {
    return Optional.ofNullable(states.get(name));
  }

  /**
   * Registered states.
   *
   * @return unmodifiable set of owned states, in registration order
   */
  public Set<State<T>> states() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(states.values()));
  }

  /**
   * Owned states along with everything reachable from them.
   *
   * @return all states (owned ones first, in registration order)
   * @throws DeterminismMismatchException if this automaton is deterministic and
   *         a nondeterministic state is reachable
   */
  public Set<State<T>> allStates() {
    final var output = new LinkedHashSet<State<T>>(states.values());
    final var toVisit = new Stack<State<T>>();
    toVisit.addAll(output);

    while (!toVisit.isEmpty()) {
      for (State<T> next : successors(toVisit.pop())) {
        if (output.add(next)) {
          checkCompatible(next);
          toVisit.push(next);
        }
      }
    }

    return Collections.unmodifiableSet(output);
  }

  /**
   * Index every state of the automaton.
   */
  StateGraph<T> stateGraph() {
    return StateGraph.of(alphabet, allStates());
  }

  /**
   * Check whether the automaton ends in an accepting configuration after
   * consuming the input from its entry point.
   *
   * @param string input symbols
   * @return true if the input is accepted, false if it is not or if there is no
   *         entry point
   * @throws InvalidSymbolException if a symbol is not in the alphabet
   */
  public boolean accepts(List<? extends T> string) {
    for (T symbol : string) {
      if (!alphabet.contains(symbol)) {
        throw new InvalidSymbolException(symbol, alphabet);
      }
    }

    if (entryPoint == null) {
      return false;
    }

    return makeTraverser().traverse(string).isAccepted();
  }

  @SafeVarargs
  public final boolean accepts(T... string) {
    return accepts(Arrays.asList(string));
  }

  /**
   * Create a traverser starting at the entry point.
   *
   * @return traverser over a snapshot of the automaton
   * @throws NoEntryPointException if no entry point is set
   */
  public Traverser<T> makeTraverser() {
    return makeTraverser(false);
  }

  /**
   * Create a traverser starting at the entry point.
   *
   * @param printDebugInfo print to STDERR a trace of the configurations entered
   * @return traverser over a snapshot of the automaton
   * @throws NoEntryPointException if no entry point is set
   */
  public Traverser<T> makeTraverser(boolean printDebugInfo) {
    if (entryPoint == null) {
      throw new NoEntryPointException();
    }
    return new Traverser<T>(stateGraph(), entryPoint, deterministic, printDebugInfo);
  }

  /**
   * Convert into an equivalent DFA.
   *
   * <p>DFA states are named after the NFA configurations they stand for (see
   * {@link Configuration#render}). State names containing <code>,</code>,
   * <code>{</code> or <code>}</code> can make two different configurations
   * render to the same name, which fails with a {@link DuplicateStateException}.
   *
   * @return a new DFA, or this automaton if it already is deterministic
   * @throws NoEntryPointException if this is an NFA without entry point
   * @throws DuplicateStateException if two configurations render to the same name
   * @see SubsetConstruction
   */
  public Automaton<T> toDeterministicAutomaton() {
    return toDeterministicAutomaton(false);
  }

  /**
   * Convert into an equivalent DFA.
   *
   * <p>DFA states are named after the NFA configurations they stand for (see
   * {@link Configuration#render}). State names containing <code>,</code>,
   * <code>{</code> or <code>}</code> can make two different configurations
   * render to the same name, which fails with a {@link DuplicateStateException}.
   *
   * @param printDebugInfo print to STDERR the transition table that was built
   * @return a new DFA, or this automaton if it already is deterministic
   * @throws NoEntryPointException if this is an NFA without entry point
   * @throws DuplicateStateException if two configurations render to the same name
   * @see SubsetConstruction
   */
  public Automaton<T> toDeterministicAutomaton(boolean printDebugInfo) {
    if (deterministic) {
      return this;
    }

    final SubsetConstruction<T> construction = SubsetConstruction.run(this);
    if (printDebugInfo) {
      System.err.println("[NFA->DFA] transition table:");
      System.err.println(construction.table().render());
    }
    return construction.dfa();
  }

  /**
   * Minimize this DFA.
   *
   * @return a new DFA with the fewest states that accepts the same language
   * @throws NotDeterministicException if this automaton is nondeterministic
   * @see PartitionRefinement
   */
  public Automaton<T> toMinimalDfa() {
    return toMinimalDfa(false);
  }

  /**
   * Minimize this DFA.
   *
   * @param printDebugInfo print to STDERR the partitions of every refinement round
   * @return a new DFA with the fewest states that accepts the same language
   * @throws NotDeterministicException if this automaton is nondeterministic
   * @see PartitionRefinement
   */
  public Automaton<T> toMinimalDfa(boolean printDebugInfo) {
    final PartitionRefinement<T> refinement = PartitionRefinement.run(this);
    if (printDebugInfo) {
      int round = 0;
      for (PartitionRefinement.PartitionSet partitionSet : refinement.history()) {
        System.err.println("[DFA-MIN] round " + round++ + ": " + partitionSet);
      }
      System.err.println(refinement.table().render());
    }
    return refinement.dfa();
  }

  @Override
  public Stream<DotGraph.Vertex<String>> vertices() {
    return allStates()
      .stream()
      .map((State<T> state) -> new DotGraph.Vertex<String>(state.name(), state.isAccepting()));
  }

  @Override
  public Stream<DotGraph.Edge<String, String>> edges() {
    final var transitionEdges = allStates()
      .stream()
      .flatMap((State<T> from) -> {
        final var symbolEdges = from
          .symbols()
          .stream()
          .flatMap((T symbol) -> from
            .transitionsFor(symbol)
            .stream()
            .map(to -> new DotGraph.Edge<>(from.name(), to.name(), String.valueOf(symbol)))
          );
        final var epsilonEdges = from
          .epsilonTargets()
          .stream()
          .map(to -> new DotGraph.Edge<>(from.name(), to.name(), "ε"));
        return Stream.concat(symbolEdges, epsilonEdges);
      });
    final var initialEdge = entryPoint()
      .stream()
      .map(entry -> new DotGraph.Edge<String, String>(null, entry.name(), null));
    return Stream.concat(initialEdge, transitionEdges);
  }

  @Override
  public String toString() {
    return (deterministic ? "DFA" : "NFA") + "(" + states.keySet() + ")";
  }
}
