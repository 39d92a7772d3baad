package fsa;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AutomatonTest {

  private static final Alphabet<Integer> BINARY = Alphabet.of(0, 1);

  @Test
  void acceptsWithEpsilonAndBranching() {
    final var nfa = ExampleAutomata.branchingNfa();
    Assertions.assertFalse(nfa.accepts());
    Assertions.assertTrue(nfa.accepts(1));
    Assertions.assertTrue(nfa.accepts(1, 0));
    Assertions.assertTrue(nfa.accepts(1, 0, 0));
    Assertions.assertTrue(nfa.accepts(1, 0, 0, 1));
    Assertions.assertTrue(nfa.accepts(List.of(1, 0, 0, 1, 0)));
    Assertions.assertFalse(nfa.accepts(1, 1));
    Assertions.assertTrue(nfa.accepts(0, 0, 0));
  }

  @Test
  void acceptsMatchesReferenceLanguage() {
    final var nfa = ExampleAutomata.twoBranchNfa();
    for (List<Integer> string : ExampleAutomata.allStrings(nfa.alphabet(), 7)) {
      Assertions.assertEquals(
        ExampleAutomata.twoBranchLanguage(string),
        nfa.accepts(string),
        "Mismatch on " + string
      );
    }
  }

  @Test
  void acceptsWithoutEntryPoint() {
    final var nfa = new Automaton<Integer>(BINARY, false);
    nfa.makeState("a", true);
    Assertions.assertFalse(nfa.accepts());
    Assertions.assertFalse(nfa.accepts(0, 1));

    // Symbols are still checked
    Assertions.assertThrows(InvalidSymbolException.class, () -> nfa.accepts(0, 7));
  }

  @Test
  void acceptsRejectsUnknownSymbols() {
    final var nfa = ExampleAutomata.branchingNfa();
    final var error = Assertions.assertThrows(InvalidSymbolException.class, () -> nfa.accepts(1, 2));
    Assertions.assertEquals(2, error.symbol);
  }

  @Test
  void makeStateRequiresUniqueNames() {
    final var dfa = new Automaton<Integer>(BINARY, true);
    final State<Integer> a = dfa.makeState("a");
    Assertions.assertTrue(a.isDeterministic());
    Assertions.assertFalse(a.isAccepting());
    Assertions.assertSame(BINARY, a.alphabet());

    final var error = Assertions.assertThrows(DuplicateStateException.class, () -> dfa.makeState("a", true));
    Assertions.assertEquals("a", error.stateName);
    Assertions.assertEquals(1, dfa.states().size());
    Assertions.assertSame(a, dfa.state("a").orElseThrow());
    Assertions.assertTrue(dfa.state("b").isEmpty());
  }

  @Test
  void addStateRegistersReachableStates() {
    final var a = new State<Integer>("a", BINARY, false, false);
    final var b = new State<Integer>("b", BINARY, false, false);
    final var c = new State<Integer>("c", BINARY, false, true);
    final var d = new State<Integer>("d", BINARY, false, false);
    a.addTransition(0, b);
    b.addEpsilon(c);
    c.addTransition(1, a);

    final var nfa = new Automaton<Integer>(BINARY, false);
    Assertions.assertTrue(nfa.addState(a));
    Assertions.assertEquals(Set.of("a", "b", "c"), names(nfa.states()));

    Assertions.assertFalse(nfa.addState(a));
    Assertions.assertFalse(nfa.addState(new State<Integer>("b", BINARY, false, false)));
    Assertions.assertSame(b, nfa.state("b").orElseThrow());

    nfa.addStates(c, d);
    Assertions.assertEquals(Set.of("a", "b", "c", "d"), names(nfa.states()));
  }

  @Test
  void allStatesFollowsLaterTransitions() {
    final var nfa = new Automaton<Integer>(BINARY, false);
    final State<Integer> a = nfa.makeState("a");
    final var b = new State<Integer>("b", BINARY, false, true);
    a.addTransition(0, b);

    Assertions.assertEquals(Set.of("a"), names(nfa.states()));
    Assertions.assertEquals(Set.of("a", "b"), names(nfa.allStates()));

    nfa.setEntryPoint(a);
    Assertions.assertTrue(nfa.accepts(0));
  }

  @Test
  void deterministicAutomatonRejectsNondeterministicStates() {
    final var dfa = new Automaton<Integer>(BINARY, true);
    final var x = new State<Integer>("x", BINARY, true, false);
    final var y = new State<Integer>("y", BINARY, false, false);
    x.addTransition(0, y);

    final var error = Assertions.assertThrows(DeterminismMismatchException.class, () -> dfa.addState(x));
    Assertions.assertEquals("y", error.stateName);
    Assertions.assertTrue(dfa.states().isEmpty());

    Assertions.assertThrows(DeterminismMismatchException.class, () -> dfa.addState(y));
    Assertions.assertTrue(dfa.states().isEmpty());

    // The other way around is fine
    final var nfa = new Automaton<Integer>(BINARY, false);
    nfa.addState(x);
    Assertions.assertEquals(Set.of("x", "y"), names(nfa.states()));
  }

  @Test
  void statesMustShareTheAlphabet() {
    final var nfa = new Automaton<Integer>(BINARY, false);
    final var other = new State<Integer>("z", Alphabet.of(0, 1, 2), false, false);
    Assertions.assertThrows(IllegalArgumentException.class, () -> nfa.addState(other));
    Assertions.assertTrue(nfa.states().isEmpty());
  }

  @Test
  void entryPointMustBeOwned() {
    final var nfa = new Automaton<Integer>(BINARY, false);
    Assertions.assertTrue(nfa.entryPoint().isEmpty());
    Assertions.assertThrows(
      IllegalArgumentException.class,
      () -> nfa.setEntryPoint(new State<Integer>("a", BINARY, false, false))
    );

    final State<Integer> a = nfa.makeState("a");
    nfa.setEntryPoint(new State<Integer>("a", BINARY, false, false));
    Assertions.assertSame(a, nfa.entryPoint().orElseThrow());
  }

  @Test
  void traverserRequiresEntryPoint() {
    final var nfa = new Automaton<Integer>(BINARY, false);
    nfa.makeState("a");
    Assertions.assertThrows(NoEntryPointException.class, () -> nfa.makeTraverser());
    Assertions.assertThrows(NoEntryPointException.class, () -> nfa.toDeterministicAutomaton());
  }

  @Test
  void deterministicConversionOfDfaIsIdentity() {
    final var dfa = new Automaton<Integer>(BINARY, true);
    dfa.makeState("a");
    Assertions.assertSame(dfa, dfa.toDeterministicAutomaton());
  }

  @Test
  void minimizationRequiresDfa() {
    final var nfa = ExampleAutomata.branchingNfa();
    final var error = Assertions.assertThrows(NotDeterministicException.class, () -> nfa.toMinimalDfa());
    Assertions.assertTrue(error.getMessage().contains("Minimization"));
  }

  @Test
  void conversionsPreserveLanguage() {
    final var nfa = ExampleAutomata.twoBranchNfa();
    final var dfa = nfa.toDeterministicAutomaton();
    final var minimal = dfa.toMinimalDfa();

    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertTrue(minimal.isDeterministic());
    Assertions.assertTrue(minimal.allStates().size() <= dfa.allStates().size());

    for (List<Integer> string : ExampleAutomata.allStrings(nfa.alphabet(), 7)) {
      final boolean expected = ExampleAutomata.twoBranchLanguage(string);
      Assertions.assertEquals(expected, dfa.accepts(string), "DFA mismatch on " + string);
      Assertions.assertEquals(expected, minimal.accepts(string), "Minimal DFA mismatch on " + string);
    }
  }

  @Test
  void conversionsLeaveInputUntouched() {
    final var nfa = ExampleAutomata.branchingNfa();
    final String before = nfa.dotGraph("nfa");
    nfa.toDeterministicAutomaton().toMinimalDfa();
    Assertions.assertEquals(before, nfa.dotGraph("nfa"));
  }

  @Test
  void dotGraphRendering() {
    final var nfa = new Automaton<Integer>(BINARY, false);
    final State<Integer> a = nfa.makeState("a");
    final State<Integer> b = nfa.makeState("b", true);
    a.addTransition(1, b);
    a.addEpsilon(b);
    nfa.setEntryPoint(a);

    final String dot = nfa.dotGraph("example");
    Assertions.assertTrue(dot.startsWith("digraph \"example\" {\n"));
    Assertions.assertTrue(dot.contains("  \"a\" [shape = circle, label = <a>];\n"));
    Assertions.assertTrue(dot.contains("  \"b\" [shape = doublecircle, label = <b>];\n"));
    Assertions.assertTrue(dot.contains("  \"_gen1\" -> \"a\" [label = <>];\n"));
    Assertions.assertTrue(dot.contains("  \"a\" -> \"b\" [label = <1>];\n"));
    Assertions.assertTrue(dot.contains("  \"a\" -> \"b\" [label = <ε>];\n"));
    Assertions.assertTrue(dot.contains("  \"_gen1\" [shape = none, label = <>];\n"));
    Assertions.assertTrue(dot.endsWith("}"));
  }

  private static Set<String> names(Set<State<Integer>> states) {
    return states.stream().map(State::name).collect(Collectors.toSet());
  }
}
