package fsa.util;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.TreeSet;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;
import java.util.stream.Collectors;

/**
 * Immutable set of integers.
 *
 * <p>Elements are kept sorted, so two sets with the same members are equal
 * (and hash the same) no matter the order in which members were discovered.
 * This makes the set usable as a canonical lookup key.
 */
public final class IntSet {

  public static final IntSet EMPTY = new IntSet(new int[0]);

  // Sorted and distinct elements
  private final int[] elements;

  private IntSet(int[] sortedDistinct) {
    this.elements = sortedDistinct;
  }

  public static IntSet of(int... elems) {
    return new IntSet(Arrays.stream(elems).boxed().collect(Collectors.toList()));
  }

  /**
   * Build a set from the bits set in a bit set.
   *
   * @param bits members of the set
   * @return set containing exactly the set bits
   */
  public static IntSet of(BitSet bits) {
    return bits.isEmpty() ? EMPTY : new IntSet(bits.stream().toArray());
  }

  public IntSet(Collection<Integer> elems) {
    this.elements = new TreeSet<Integer>(elems).stream().mapToInt((Integer i) -> i.intValue()).toArray();
  }

  public IntStream stream() {
    return Arrays.stream(elements);
  }

  /**
   * Run an action on every element, in ascending order.
   *
   * @param action action to run
   */
  public void forEach(IntConsumer action) {
    for (int element : elements) {
      action.accept(element);
    }
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(int element) {
    return Arrays.binarySearch(elements, element) >= 0;
  }

  /**
   * Smallest element of the set.
   *
   * @return first element in ascending order
   * @throws java.util.NoSuchElementException if the set is empty
   */
  public int first() {
    if (elements.length == 0) {
      throw new java.util.NoSuchElementException("empty set has no first element");
    }
    return elements[0];
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof IntSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((IntSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(elements)
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
