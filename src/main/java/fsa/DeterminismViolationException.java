package fsa;

/**
 * Thrown when an operation would make a deterministic state behave
 * nondeterministically: a second target for one symbol, or any epsilon edge.
 */
public class DeterminismViolationException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = 7100925433420655019L;

  /**
   * Name of the deterministic state.
   */
  public final String stateName;

  public DeterminismViolationException(String stateName, String message) {
    super("Deterministic state " + stateName + ": " + message);
    this.stateName = stateName;
  }
}
