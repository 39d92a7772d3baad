package fsa.util;

import java.util.BitSet;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class IntSetTest {

  @Test
  void orderAndDuplicatesDoNotMatter() {
    final IntSet set = IntSet.of(3, 1, 2, 1);
    Assertions.assertEquals(IntSet.of(1, 2, 3), set);
    Assertions.assertEquals(new IntSet(List.of(2, 3, 1)), set);
    Assertions.assertEquals(IntSet.of(1, 2, 3).hashCode(), set.hashCode());
    Assertions.assertEquals(3, set.size());
    Assertions.assertEquals("{1,2,3}", set.toString());
    Assertions.assertArrayEquals(new int[] { 1, 2, 3 }, set.stream().toArray());
  }

  @Test
  void fromBitSet() {
    final var bits = new BitSet();
    bits.set(5);
    bits.set(0);
    Assertions.assertEquals(IntSet.of(0, 5), IntSet.of(bits));
    Assertions.assertSame(IntSet.EMPTY, IntSet.of(new BitSet()));
  }

  @Test
  void membership() {
    final IntSet set = IntSet.of(4, 8, 15);
    Assertions.assertTrue(set.contains(8));
    Assertions.assertFalse(set.contains(9));
    Assertions.assertEquals(4, set.first());
  }

  @Test
  void emptySet() {
    Assertions.assertTrue(IntSet.EMPTY.isEmpty());
    Assertions.assertEquals(IntSet.EMPTY, IntSet.of());
    Assertions.assertEquals("{}", IntSet.EMPTY.toString());
    Assertions.assertThrows(NoSuchElementException.class, () -> IntSet.EMPTY.first());
  }
}
