package fsa.codegen;

/**
 * Membership check over symbol indices.
 *
 * <p>Implemented by the classes generated in {@link CompiledDfa}. Each element
 * of the input is the index of a symbol in the alphabet of the compiled DFA.
 */
public interface IndexMatcher {

  /**
   * Run the DFA over the whole input.
   *
   * @param input alphabet indices of the input symbols
   * @return whether the DFA ends in an accepting state
   */
  boolean accepts(int[] input);
}
