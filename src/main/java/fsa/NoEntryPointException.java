package fsa;

/**
 * Thrown when an operation needs a start state but the automaton has none.
 */
public class NoEntryPointException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = -1737005416553027848L;

  public NoEntryPointException() {
    super("Entry point state must be defined");
  }
}
