package fsa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Transition table produced by subset construction or minimization, kept for
 * inspection.
 *
 * <p>Rows are the states of the generated DFA (configurations or groups of
 * states) and columns are the symbols of the alphabet. Rows are ordered with
 * the entry row first, then the non-accepting rows, then the accepting rows;
 * ties are broken by name.
 *
 * @param <T> type of the alphabet symbols
 */
public final class TransitionTable<T> {

  /**
   * One row of the table.
   *
   * @param name canonical name of the row
   * @param entry is this the row of the entry state?
   * @param accepting is this row an accepting state?
   * @param successors name of the successor row for each symbol, in alphabet
   *                   order (empty if there is no transition)
   */
  public record Row(
    String name,
    boolean entry,
    boolean accepting,
    List<Optional<String>> successors
  ) {
    public Row {
      successors = List.copyOf(successors);
    }
  }

  private static final Comparator<Row> ROW_ORDER = Comparator
    .comparing((Row row) -> row.entry() ? 0 : row.accepting() ? 2 : 1)
    .thenComparing(Row::name);

  private final Alphabet<T> alphabet;
  private final List<Row> rows;

  TransitionTable(Alphabet<T> alphabet, List<Row> rows) {
    final var sorted = new ArrayList<Row>(rows);
    sorted.sort(ROW_ORDER);
    this.alphabet = alphabet;
    this.rows = Collections.unmodifiableList(sorted);
  }

  public Alphabet<T> alphabet() {
    return alphabet;
  }

  /**
   * Rows of the table.
   *
   * @return unmodifiable list of rows, entry row first
   */
  public List<Row> rows() {
    return rows;
  }

  /**
   * Find a row by name.
   *
   * @param name canonical name of the row
   * @return the row, if there is one with that name
   */
  public Optional<Row> row(String name) {
    return rows.stream().filter(row -> row.name().equals(name)).findFirst();
  }

  /**
   * Render the table in a human readable fashion.
   *
   * <p>Each line is one row: an arrow marks the entry row, an {@code F} marks
   * the accepting rows, and each symbol is followed by the successor row in
   * parentheses ({@code -} when there is no transition). For instance:
   *
   * <pre>
   * →   {a} : 0({a,b}) 1({b})
   *     ∅ : 0(∅) 1(∅)
   *    F{a,b} : 0({a,b}) 1({b})
   *    F{b} : 0({a}) 1(∅)
   * </pre>
   *
   * @return one line per row
   */
  public String render() {
    final var builder = new StringBuilder();
    for (Row row : rows) {
      if (builder.length() > 0) {
        builder.append('\n');
      }
      builder
        .append(row.entry() ? "→  " : "   ")
        .append(row.accepting() ? "F" : " ")
        .append(row.name())
        .append(" :");
      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        builder
          .append(' ')
          .append(alphabet.symbol(symbol))
          .append('(')
          .append(row.successors().get(symbol).orElse("-"))
          .append(')');
      }
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
