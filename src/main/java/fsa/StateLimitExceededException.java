package fsa;

/**
 * Thrown when subset construction discovers more deterministic states than the
 * caller allowed.
 */
public class StateLimitExceededException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = -6389257190431774402L;

  /**
   * Maximum number of states that was allowed.
   */
  public final int limit;

  public StateLimitExceededException(int limit) {
    super("Subset construction exceeded the limit of " + limit + " states");
    this.limit = limit;
  }
}
