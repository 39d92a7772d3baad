package fsa;

/**
 * Thrown when an operation defined only on DFAs is handed an NFA.
 */
public class NotDeterministicException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = 2656312054417873090L;

  public NotDeterministicException(String operation) {
    super(operation + " requires a deterministic automaton");
  }
}
