package fsa;

/**
 * Thrown when a new state's name is already taken in the automaton.
 */
public class DuplicateStateException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 3018742906115377263L;

  /**
   * Name that collided.
   */
  public final String stateName;

  public DuplicateStateException(String stateName) {
    super("Duplicate state detected: " + stateName);
    this.stateName = stateName;
  }
}
