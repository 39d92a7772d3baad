package fsa;

import fsa.util.IntSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Minimization of a DFA by partition refinement.
 *
 * <p>States start out split into accepting and non-accepting groups. Each
 * round then computes, for every state, the group reached on every symbol
 * (its signature) and splits the groups whose members disagree. Once a round
 * splits nothing, the states of each group are indistinguishable and every
 * group becomes one state of the minimal DFA.
 *
 * <p>Termination: every round that does not stop adds at least one group, and
 * there can be no more groups than states.
 *
 * @param <T> type of the alphabet symbols
 */
public final class PartitionRefinement<T> {

  /**
   * Partitions of the states after one refinement round.
   *
   * @param partitions groups of state names (each sorted), pairwise disjoint
   */
  public record PartitionSet(List<SortedSet<String>> partitions) {

    public PartitionSet {
      partitions = partitions
        .stream()
        .map(p -> Collections.unmodifiableSortedSet(new TreeSet<>(p)))
        .collect(Collectors.toUnmodifiableList());
    }

    public int size() {
      return partitions.size();
    }

    /**
     * Find the group that contains a state.
     *
     * @param stateName name of the state
     * @return group containing the state, if any
     */
    public Optional<SortedSet<String>> partitionOf(String stateName) {
      return partitions.stream().filter(p -> p.contains(stateName)).findFirst();
    }

    /**
     * Check whether two states are in the same group.
     *
     * @param state1 name of the first state
     * @param state2 name of the second state
     * @return true if some group contains both states
     */
    public boolean sharePartition(String state1, String state2) {
      return partitionOf(state1).map(p -> p.contains(state2)).orElse(false);
    }

    @Override
    public String toString() {
      return partitions
        .stream()
        .map(Configuration::render)
        .collect(Collectors.joining(", ", "[", "]"));
    }
  }

  // Signature of a state: index of the group reached on each symbol
  private record Signature(int[] targetGroups) {

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Signature other && Arrays.equals(targetGroups, other.targetGroups);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(targetGroups);
    }
  }

  private final Automaton<T> dfa;
  private final List<PartitionSet> history;
  private final TransitionTable<T> table;

  private PartitionRefinement(Automaton<T> dfa, List<PartitionSet> history, TransitionTable<T> table) {
    this.dfa = dfa;
    this.history = history;
    this.table = table;
  }

  /**
   * The minimal DFA.
   *
   * @return deterministic automaton with one state per final group
   */
  public Automaton<T> dfa() {
    return dfa;
  }

  /**
   * Partitions after each round: the initial accepting/non-accepting split
   * comes first and the final (stable) partition last.
   *
   * @return unmodifiable list of partition sets
   */
  public List<PartitionSet> history() {
    return history;
  }

  /**
   * Transition table between the final groups.
   *
   * @return transition table of the minimal DFA
   */
  public TransitionTable<T> table() {
    return table;
  }

  /**
   * Minimize a DFA.
   *
   * <p>Every state of the DFA takes part (including states which are not
   * reachable from the entry point), and each final group becomes a state
   * named after its members. Missing transitions are treated as going to a
   * rejecting sink: a group that ends up equivalent to that sink without
   * containing any real state is left out, and transitions into it stay
   * undefined.
   *
   * @param input deterministic automaton (it is not modified)
   * @return minimal DFA along with the refinement history
   * @throws NotDeterministicException if the automaton is nondeterministic
   */
  public static <T> PartitionRefinement<T> run(Automaton<T> input) {
    if (!input.isDeterministic()) {
      throw new NotDeterministicException("Minimization");
    }

    final StateGraph<T> graph = input.stateGraph();
    final Alphabet<T> alphabet = input.alphabet();
    final int stateCount = graph.size();

    // A missing transition behaves like one into a rejecting sink, so partial
    // DFAs get an extra state (after all the real ones) looping on every symbol
    final int deadState = isComplete(graph) ? -1 : stateCount;
    final var targets = new int[deadState < 0 ? stateCount : stateCount + 1][alphabet.size()];
    for (int state = 0; state < targets.length; state++) {
      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        final int[] direct = state == deadState ? new int[0] : graph.targets(state, symbol);
        targets[state][symbol] = direct.length == 0 ? deadState : direct[0];
      }
    }

    // Set up initial partition
    List<IntSet> partitions = new ArrayList<>();
    {
      final var accepting = new ArrayList<Integer>();
      final var rejecting = new ArrayList<Integer>();
      for (int state = 0; state < targets.length; state++) {
        (state != deadState && graph.isAccepting(state) ? accepting : rejecting).add(state);
      }
      if (!rejecting.isEmpty()) {
        partitions.add(new IntSet(rejecting));
      }
      if (!accepting.isEmpty()) {
        partitions.add(new IntSet(accepting));
      }
    }
    int[] groupOf = ensureCorrectness(partitions, targets.length);

    final var history = new ArrayList<PartitionSet>();
    history.add(toPartitionSet(graph, partitions));

    // Refine until a full pass splits nothing
    boolean split = true;
    while (split) {
      split = false;
      final var refined = new ArrayList<IntSet>();

      for (IntSet partition : partitions) {
        final var bySignature = new LinkedHashMap<Signature, List<Integer>>();
        for (int state : partition.stream().toArray()) {
          bySignature
            .computeIfAbsent(signature(targets[state], groupOf), k -> new ArrayList<>())
            .add(state);
        }

        if (bySignature.size() > 1) {
          split = true;
        }
        for (List<Integer> subPartition : bySignature.values()) {
          refined.add(new IntSet(subPartition));
        }
      }

      if (split) {
        partitions = refined;
        groupOf = ensureCorrectness(partitions, targets.length);
        history.add(toPartitionSet(graph, partitions));
      }
    }

    // One state per final group, except the group holding only the dead state
    final var dfa = new Automaton<T>(alphabet, true);
    final var groupStates = new ArrayList<State<T>>();
    for (IntSet partition : partitions) {
      final int representative = partition.first();
      groupStates.add(
        representative == deadState
          ? null
          : dfa.makeState(render(graph, partition), graph.isAccepting(representative))
      );
    }

    // Transitions come from any representative, mapped onto groups
    final var tableRows = new ArrayList<TransitionTable.Row>();
    final int entryIndex = input.entryPoint().isPresent()
      ? groupOf[graph.indexOf(input.entryPoint().get())]
      : -1;
    for (int group = 0; group < partitions.size(); group++) {
      final State<T> from = groupStates.get(group);
      if (from == null) {
        continue;
      }
      final int representative = partitions.get(group).first();
      final List<Optional<String>> successors = new ArrayList<>();
      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        final int target = targets[representative][symbol];
        final State<T> to = target == deadState ? null : groupStates.get(groupOf[target]);
        if (to == null) {
          successors.add(Optional.empty());
        } else {
          from.addTransition(alphabet.symbol(symbol), to);
          successors.add(Optional.of(to.name()));
        }
      }
      tableRows.add(new TransitionTable.Row(from.name(), group == entryIndex, from.isAccepting(), successors));
    }

    if (entryIndex >= 0) {
      dfa.setEntryPoint(groupStates.get(entryIndex));
    }

    return new PartitionRefinement<T>(
      dfa,
      Collections.unmodifiableList(history),
      new TransitionTable<T>(alphabet, tableRows)
    );
  }

  private static boolean isComplete(StateGraph<?> graph) {
    for (int state = 0; state < graph.size(); state++) {
      for (int symbol = 0; symbol < graph.alphabet.size(); symbol++) {
        if (graph.targets(state, symbol).length == 0) {
          return false;
        }
      }
    }
    return true;
  }

  private static Signature signature(int[] targets, int[] groupOf) {
    final var targetGroups = new int[targets.length];
    for (int symbol = 0; symbol < targets.length; symbol++) {
      targetGroups[symbol] = groupOf[targets[symbol]];
    }
    return new Signature(targetGroups);
  }

  /**
   * Ensure that the partition set is valid: every state is in exactly one
   * partition and no partition is empty.
   *
   * @param partitions partitions of state indices
   * @param stateCount number of states being partitioned
   * @return group index of each state
   * @throws IllegalStateException if partitions overlap, miss a state or are empty
   */
  static int[] ensureCorrectness(List<IntSet> partitions, int stateCount) {
    final var groupOf = new int[stateCount];
    Arrays.fill(groupOf, -1);

    for (int group = 0; group < partitions.size(); group++) {
      final IntSet partition = partitions.get(group);
      if (partition.isEmpty()) {
        throw new IllegalStateException("Partition " + group + " is empty");
      }
      for (int state : partition.stream().toArray()) {
        if (state < 0 || state >= stateCount) {
          throw new IllegalStateException("Partition " + group + " contains unknown state " + state);
        } else if (groupOf[state] >= 0) {
          throw new IllegalStateException("Two partitions cannot share a state: " + state);
        }
        groupOf[state] = group;
      }
    }

    for (int state = 0; state < stateCount; state++) {
      if (groupOf[state] < 0) {
        throw new IllegalStateException("State " + state + " is not in any partition");
      }
    }

    return groupOf;
  }

  // Names of the real states in a group (the dead state has no name)
  private static List<String> names(StateGraph<?> graph, IntSet partition) {
    return partition
      .stream()
      .filter(i -> i < graph.size())
      .mapToObj(i -> graph.state(i).name())
      .collect(Collectors.toList());
  }

  private static String render(StateGraph<?> graph, IntSet partition) {
    return Configuration.render(names(graph, partition));
  }

  private static PartitionSet toPartitionSet(StateGraph<?> graph, List<IntSet> partitions) {
    return new PartitionSet(
      partitions
        .stream()
        .map(partition -> names(graph, partition))
        .filter(names -> !names.isEmpty())
        .<SortedSet<String>>map(names -> new TreeSet<String>(names))
        .collect(Collectors.toList())
    );
  }
}
