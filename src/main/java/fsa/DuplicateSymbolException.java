package fsa;

/**
 * Thrown when an alphabet is given the same symbol more than once.
 */
public class DuplicateSymbolException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -2270731386124398512L;

  /**
   * Symbol which was supplied more than once.
   */
  public final transient Object symbol;

  public DuplicateSymbolException(Object symbol) {
    super("Elements in alphabet must be unique, but " + symbol + " appears more than once");
    this.symbol = symbol;
  }
}
