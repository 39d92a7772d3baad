package fsa;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable, ordered set of distinct input symbols.
 *
 * <p>Every symbol has a stable index (its position in the alphabet). The
 * indexed algorithms and the compiled matchers key their tables on that index
 * instead of on the symbol itself.
 *
 * @param <T> type of the symbols
 */
public final class Alphabet<T> implements Iterable<T> {

  // Symbols, in the order they were supplied
  private final List<T> symbols;

  // Inverse of `symbols`
  private final Map<T, Integer> indices;

  private Alphabet(List<T> symbols, Map<T, Integer> indices) {
    this.symbols = symbols;
    this.indices = indices;
  }

  /**
   * Make an alphabet out of the given symbols.
   *
   * @param symbols distinct, non-null symbols
   * @return alphabet with the symbols in the order given
   * @throws DuplicateSymbolException if two of the symbols are equal
   */
  @SafeVarargs
  public static <T> Alphabet<T> of(T... symbols) {
    return of(Arrays.asList(symbols));
  }

  /**
   * Make an alphabet out of the given symbols.
   *
   * @param symbols distinct, non-null symbols
   * @return alphabet with the symbols in iteration order
   * @throws DuplicateSymbolException if two of the symbols are equal
   */
  public static <T> Alphabet<T> of(Collection<? extends T> symbols) {
    final var indices = new HashMap<T, Integer>();
    for (T symbol : symbols) {
      Objects.requireNonNull(symbol, "alphabet symbols cannot be null");
      if (indices.putIfAbsent(symbol, indices.size()) != null) {
        throw new DuplicateSymbolException(symbol);
      }
    }
    return new Alphabet<T>(List.copyOf(symbols), Collections.unmodifiableMap(indices));
  }

  public int size() {
    return symbols.size();
  }

  /**
   * Symbols of the alphabet.
   *
   * @return unmodifiable list of the symbols, in alphabet order
   */
  public List<T> symbols() {
    return symbols;
  }

  /**
   * Symbol at a given index.
   *
   * @param index position in the alphabet
   * @return symbol at that position
   */
  public T symbol(int index) {
    return symbols.get(index);
  }

  /**
   * Position of a symbol in the alphabet.
   *
   * @param symbol symbol to look up
   * @return index of the symbol, or {@code -1} if it is not in the alphabet
   */
  public int indexOf(Object symbol) {
    final Integer index = symbol == null ? null : indices.get(symbol);
    return index == null ? -1 : index;
  }

  public boolean contains(Object symbol) {
    return indexOf(symbol) >= 0;
  }

  /**
   * Check that a sequence only uses symbols from this alphabet.
   *
   * @param sequence symbols to check
   * @return whether every element of the sequence is in the alphabet
   */
  public boolean containsAll(Iterable<?> sequence) {
    for (Object symbol : sequence) {
      if (!contains(symbol)) {
        return false;
      }
    }
    return true;
  }

  @SafeVarargs
  public final boolean containsAll(T... sequence) {
    return containsAll(Arrays.asList(sequence));
  }

  /**
   * Map a sequence of symbols onto their indices.
   *
   * @param sequence symbols from the alphabet
   * @return indices of the symbols, in the same order
   * @throws InvalidSymbolException if a symbol is not in the alphabet
   */
  public int[] indicesOf(Iterable<? extends T> sequence) {
    int[] buffer = new int[16];
    int length = 0;
    for (T symbol : sequence) {
      final int index = indexOf(symbol);
      if (index < 0) {
        throw new InvalidSymbolException(symbol, this);
      }
      if (length == buffer.length) {
        buffer = Arrays.copyOf(buffer, length * 2);
      }
      buffer[length++] = index;
    }
    return Arrays.copyOf(buffer, length);
  }

  @Override
  public Iterator<T> iterator() {
    return symbols.iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Alphabet<?> other)) {
      return false;
    } else {
      return symbols.equals(other.symbols);
    }
  }

  @Override
  public int hashCode() {
    return symbols.hashCode();
  }

  @Override
  public String toString() {
    return symbols
      .stream()
      .map(String::valueOf)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
