package com.obsidiandynamics.choicetree.util;

import org.junit.jupiter.api.*;

import java.util.*;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.*;

final class CappedIterableTest {
  @Test
  void testCapsInfiniteSource() {
    final var iterable = new CappedIterable<>(() -> Stream.iterate(0, i -> i + 1).iterator(), 5);
    assertThat(iterable).containsExactly(0, 1, 2, 3, 4);
  }

  @Test
  void testShortSourceEndsEarly() {
    final var iterable = new CappedIterable<>(() -> List.of("a", "b").iterator(), 10);
    assertThat(iterable).containsExactly("a", "b");
  }

  @Test
  void testRestartable() {
    final var iterable = new CappedIterable<>(() -> List.of(1, 2, 3).iterator(), 2);
    assertThat(iterable).containsExactly(1, 2);
    assertThat(iterable).containsExactly(1, 2);
  }

  @Test
  void testNextBeyondCap() {
    final var iterator = new CappedIterable<>(() -> List.of(1, 2).iterator(), 1).iterator();
    assertThat(iterator.next()).isEqualTo(1);
    assertThat(catchThrowable(iterator::next)).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void testNegativeCap() {
    assertThat(catchThrowable(() -> new CappedIterable<>(Collections::emptyIterator, -1))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testToString() {
    final var iterable = new CappedIterable<>(Collections::emptyIterator, 3);
    assertThat(iterable.toString()).contains(CappedIterable.class.getSimpleName()).contains("cap=3");
    assertThat(iterable.getCap()).isEqualTo(3);
  }
}
