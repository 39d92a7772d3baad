package fsa;

/**
 * Thrown when a symbol used in a transition or in an input sequence is not part
 * of the automaton's alphabet.
 */
public class InvalidSymbolException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 4419207856183605276L;

  /**
   * Symbol which is missing from the alphabet.
   */
  public final transient Object symbol;

  public InvalidSymbolException(Object symbol, Alphabet<?> alphabet) {
    super("Symbol " + symbol + " is not in the alphabet " + alphabet);
    this.symbol = symbol;
  }
}
