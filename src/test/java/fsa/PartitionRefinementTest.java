package fsa;

import fsa.util.IntSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PartitionRefinementTest {

  private static final Alphabet<Integer> BINARY = Alphabet.of(0, 1);

  @Test
  void mergesIndistinguishableStates() {
    final var nfa = ExampleAutomata.redundantNfa();
    final var dfa = nfa.toDeterministicAutomaton();
    Assertions.assertEquals(4, dfa.allStates().size());

    final PartitionRefinement<Integer> refinement = PartitionRefinement.run(dfa);
    final Automaton<Integer> minimal = refinement.dfa();
    Assertions.assertEquals(3, minimal.allStates().size());
    Assertions.assertEquals(
      Set.of("{{a}}", "{{b},{c}}", "{{d}}"),
      minimal.states().stream().map(State::name).collect(Collectors.toSet())
    );
    Assertions.assertEquals("{{a}}", minimal.entryPoint().orElseThrow().name());

    final PartitionRefinement.PartitionSet last = refinement.history().get(refinement.history().size() - 1);
    Assertions.assertTrue(last.sharePartition("{b}", "{c}"));
    Assertions.assertFalse(last.sharePartition("{a}", "{b}"));

    for (List<Integer> string : ExampleAutomata.allStrings(nfa.alphabet(), 5)) {
      Assertions.assertEquals(nfa.accepts(string), minimal.accepts(string), "Mismatch on " + string);
    }
  }

  @Test
  void refinementHistory() {
    final var dfa = ExampleAutomata.branchingNfa().toDeterministicAutomaton();
    final PartitionRefinement<Integer> refinement = PartitionRefinement.run(dfa);
    final List<PartitionRefinement.PartitionSet> history = refinement.history();

    Assertions.assertEquals(
      List.of(2, 4, 5, 6),
      history.stream().map(PartitionRefinement.PartitionSet::size).collect(Collectors.toList())
    );

    final PartitionRefinement.PartitionSet initial = history.get(0);
    Assertions.assertEquals(Set.of("{a,c,s}", "{c}", "∅"), Set.copyOf(initial.partitionOf("{c}").orElseThrow()));
    Assertions.assertEquals(
      Set.of("{b}", "{b,c}", "{b,d}", "{b,e}"),
      Set.copyOf(initial.partitionOf("{b}").orElseThrow())
    );
    Assertions.assertTrue(initial.partitionOf("nothing").isEmpty());

    Assertions.assertEquals("[{{a,c,s},{c},∅}, {{b,c},{b,d},{b,e},{b}}]", initial.toString());
  }

  @Test
  void everyRoundIsAPartition() {
    final var dfa = ExampleAutomata.twoBranchNfa().toDeterministicAutomaton();
    final Set<String> names = dfa.allStates().stream().map(State::name).collect(Collectors.toSet());

    for (PartitionRefinement.PartitionSet partitionSet : PartitionRefinement.run(dfa).history()) {
      final var seen = new HashSet<String>();
      for (SortedSet<String> partition : partitionSet.partitions()) {
        Assertions.assertFalse(partition.isEmpty());
        for (String name : partition) {
          Assertions.assertTrue(seen.add(name), name + " is in two partitions");
        }
      }
      Assertions.assertEquals(names, seen);
    }
  }

  @Test
  void minimalDfaOfBranchingNfa() {
    final var nfa = ExampleAutomata.branchingNfa();
    final PartitionRefinement<Integer> refinement = PartitionRefinement.run(nfa.toDeterministicAutomaton());
    final Automaton<Integer> minimal = refinement.dfa();

    Assertions.assertEquals(6, minimal.allStates().size());
    Assertions.assertEquals("{{a,c,s},{c}}", minimal.entryPoint().orElseThrow().name());
    Assertions.assertEquals("{{a,c,s},{c}}", refinement.table().rows().get(0).name());
    Assertions.assertTrue(refinement.table().rows().get(0).entry());

    for (List<Integer> string : ExampleAutomata.allStrings(BINARY, 7)) {
      Assertions.assertEquals(nfa.accepts(string), minimal.accepts(string), "Mismatch on " + string);
    }
  }

  @Test
  void minimizationIsIdempotent() {
    final var minimal = ExampleAutomata.twoBranchNfa().toDeterministicAutomaton().toMinimalDfa();
    final var again = minimal.toMinimalDfa();
    Assertions.assertEquals(minimal.allStates().size(), again.allStates().size());

    final List<PartitionRefinement.PartitionSet> history = PartitionRefinement.run(minimal).history();
    Assertions.assertEquals(minimal.allStates().size(), history.get(history.size() - 1).size());

    for (List<Integer> string : ExampleAutomata.allStrings(BINARY, 6)) {
      Assertions.assertEquals(minimal.accepts(string), again.accepts(string));
    }
  }

  @Test
  void unreachableStatesArePartitionedToo() {
    final var dfa = new Automaton<Integer>(BINARY, true);
    final State<Integer> start = dfa.makeState("start", true);
    final State<Integer> island = dfa.makeState("island");
    start.addTransition(List.of(0, 1), start);
    island.addTransition(List.of(0, 1), start);
    dfa.setEntryPoint(start);

    final PartitionRefinement<Integer> refinement = PartitionRefinement.run(dfa);
    Assertions.assertEquals(2, refinement.dfa().allStates().size());
    Assertions.assertTrue(refinement.table().row("{island}").isPresent());
    Assertions.assertTrue(refinement.dfa().accepts(0, 1, 1));
  }

  @Test
  void missingTransitionsActAsSink() {
    // `q` has no transition on 1, which is no different from going to `sink`
    final var dfa = new Automaton<Integer>(BINARY, true);
    final State<Integer> p = dfa.makeState("p", true);
    final State<Integer> q = dfa.makeState("q", true);
    final State<Integer> sink = dfa.makeState("sink");
    p.addTransition(0, q);
    p.addTransition(1, sink);
    q.addTransition(0, p);
    sink.addTransition(List.of(0, 1), sink);
    dfa.setEntryPoint(p);

    final PartitionRefinement<Integer> refinement = PartitionRefinement.run(dfa);
    final Automaton<Integer> minimal = refinement.dfa();
    Assertions.assertEquals(
      Set.of("{p,q}", "{sink}"),
      minimal.states().stream().map(State::name).collect(Collectors.toSet())
    );
    Assertions.assertEquals(
      "→  F{p,q} : 0({p,q}) 1({sink})\n    {sink} : 0({sink}) 1({sink})",
      refinement.table().render()
    );

    // History only mentions real states
    for (PartitionRefinement.PartitionSet partitionSet : refinement.history()) {
      Assertions.assertEquals(
        Set.of("p", "q", "sink"),
        partitionSet.partitions().stream().flatMap(SortedSet::stream).collect(Collectors.toSet())
      );
    }

    for (List<Integer> string : ExampleAutomata.allStrings(BINARY, 5)) {
      Assertions.assertEquals(dfa.accepts(string), minimal.accepts(string), "Mismatch on " + string);
    }
  }

  @Test
  void undefinedTransitionsStayUndefined() {
    final var dfa = new Automaton<Integer>(BINARY, true);
    final State<Integer> x = dfa.makeState("x");
    final State<Integer> y = dfa.makeState("y", true);
    x.addTransition(0, y);
    dfa.setEntryPoint(x);

    final PartitionRefinement<Integer> refinement = PartitionRefinement.run(dfa);
    Assertions.assertEquals(2, refinement.dfa().allStates().size());
    Assertions.assertEquals(
      "→   {x} : 0({y}) 1(-)\n   F{y} : 0(-) 1(-)",
      refinement.table().render()
    );
    Assertions.assertTrue(refinement.dfa().accepts(0));
    Assertions.assertFalse(refinement.dfa().accepts(0, 0));
  }

  @Test
  void entryPointIsOptional() {
    final var dfa = new Automaton<Integer>(BINARY, true);
    final State<Integer> a = dfa.makeState("a", true);
    a.addTransition(List.of(0, 1), a);

    final Automaton<Integer> minimal = PartitionRefinement.run(dfa).dfa();
    Assertions.assertEquals(1, minimal.allStates().size());
    Assertions.assertTrue(minimal.entryPoint().isEmpty());
    Assertions.assertFalse(minimal.accepts(0));
  }

  @Test
  void emptyAutomaton() {
    final var dfa = new Automaton<Integer>(BINARY, true);
    final PartitionRefinement<Integer> refinement = PartitionRefinement.run(dfa);
    Assertions.assertTrue(refinement.dfa().allStates().isEmpty());
    Assertions.assertEquals(0, refinement.history().get(0).size());
  }

  @Test
  void requiresDeterministicInput() {
    Assertions.assertThrows(
      NotDeterministicException.class,
      () -> PartitionRefinement.run(ExampleAutomata.branchingNfa())
    );
  }

  @Test
  void partitionsMustBeDisjointAndComplete() {
    Assertions.assertArrayEquals(
      new int[] { 0, 1, 0 },
      PartitionRefinement.ensureCorrectness(List.of(IntSet.of(0, 2), IntSet.of(1)), 3)
    );

    final var overlap = Assertions.assertThrows(
      IllegalStateException.class,
      () -> PartitionRefinement.ensureCorrectness(List.of(IntSet.of(0, 1), IntSet.of(1, 2)), 3)
    );
    Assertions.assertTrue(overlap.getMessage().startsWith("Two partitions cannot share a state"));

    Assertions.assertThrows(
      IllegalStateException.class,
      () -> PartitionRefinement.ensureCorrectness(List.of(IntSet.of(0, 1)), 3)
    );
    Assertions.assertThrows(
      IllegalStateException.class,
      () -> PartitionRefinement.ensureCorrectness(List.of(IntSet.of(0, 1, 2), IntSet.EMPTY), 3)
    );
    Assertions.assertThrows(
      IllegalStateException.class,
      () -> PartitionRefinement.ensureCorrectness(List.of(IntSet.of(0, 1, 2, 3)), 3)
    );
  }
}
