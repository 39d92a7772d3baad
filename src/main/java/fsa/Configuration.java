package fsa;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable set of states an automaton could simultaneously be in.
 *
 * <p>Two configurations are equal exactly when they contain states with the
 * same names, regardless of the order in which those states were discovered.
 *
 * @param <T> type of the alphabet symbols
 */
public final class Configuration<T> {

  /**
   * Rendering of the empty configuration.
   */
  public static final String EMPTY_SET = "∅";

  private static final Comparator<State<?>> BY_NAME = Comparator.comparing(State::name);

  // Sorted by name, distinct
  private final List<State<T>> states;

  public Configuration(Collection<State<T>> states) {
    this.states = states
      .stream()
      .distinct()
      .sorted(BY_NAME)
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Members of the configuration.
   *
   * @return unmodifiable list of the states, sorted by name
   */
  public List<State<T>> states() {
    return states;
  }

  public int size() {
    return states.size();
  }

  public boolean isEmpty() {
    return states.isEmpty();
  }

  public boolean contains(State<?> state) {
    return states.contains(state);
  }

  /**
   * Whether any member of the configuration is an accepting state.
   *
   * @return true if the configuration contains an accept state
   */
  public boolean isAccepting() {
    return states.stream().anyMatch(State::isAccepting);
  }

  /**
   * Canonical rendering of a set of names.
   *
   * <p>The names are sorted and joined as {@code {a,b,c}}. The empty set
   * renders as {@code ∅}.
   *
   * @param names names of the members
   * @return canonical string for the set
   */
  public static String render(Collection<String> names) {
    if (names.isEmpty()) {
      return EMPTY_SET;
    }
    return names
      .stream()
      .sorted()
      .collect(Collectors.joining(",", "{", "}"));
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj || (obj instanceof Configuration<?> other && other.states.equals(states));
  }

  @Override
  public int hashCode() {
    return states.hashCode();
  }

  @Override
  public String toString() {
    return render(states.stream().map(State::name).collect(Collectors.toList()));
  }
}
