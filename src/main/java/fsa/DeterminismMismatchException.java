package fsa;

/**
 * Thrown when a nondeterministic state is added to a deterministic automaton.
 */
public class DeterminismMismatchException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -5066408431976221135L;

  /**
   * Name of the nondeterministic state.
   */
  public final String stateName;

  public DeterminismMismatchException(String stateName) {
    super("Deterministic automaton can only contain deterministic states, but " + stateName + " is not");
    this.stateName = stateName;
  }
}
