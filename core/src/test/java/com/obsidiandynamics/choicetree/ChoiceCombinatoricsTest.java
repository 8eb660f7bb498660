package com.obsidiandynamics.choicetree;

import static com.obsidiandynamics.choicetree.ChoiceCombinatorics.*;
import static org.assertj.core.api.Assertions.*;

import com.obsidiandynamics.choicetree.ChoiceUsageException.*;
import org.junit.jupiter.api.*;

import java.util.*;

final class ChoiceCombinatoricsTest {
  private static long countChildren(Constraints<?> constraints) {
    final var distinct = new HashSet<>();
    var count = 0L;
    for (var child : allChildren(constraints)) {
      assertThat(constraints.permits(child)).as("child %s of %s", Choices.toString(child), constraints).isTrue();
      assertThat(distinct.add(Choices.key(child))).as("duplicate %s", Choices.toString(child)).isTrue();
      count++;
    }
    return count;
  }

  private static void assertCountMatchesEnumeration(Constraints<?> constraints) {
    final var maxChildren = computeMaxChildren(constraints);
    assertThat(maxChildren).isGreaterThanOrEqualTo(0);
    if (! isEffectivelyInfinite(maxChildren)) {
      assertThat(countChildren(constraints)).as("children of %s", constraints).isEqualTo(maxChildren);
    }
  }

  @Nested
  final class BooleanTests {
    @Test
    void testCertainProbabilities() {
      assertThat(computeMaxChildren(new BooleanConstraints(0))).isEqualTo(1);
      assertThat(computeMaxChildren(new BooleanConstraints(1))).isEqualTo(1);
    }

    @Test
    void testUncertainProbabilities() {
      assertThat(computeMaxChildren(new BooleanConstraints(0.5))).isEqualTo(2);
      assertThat(computeMaxChildren(new BooleanConstraints(0.001))).isEqualTo(2);
      assertThat(computeMaxChildren(new BooleanConstraints(0.999))).isEqualTo(2);
    }

    @Test
    void testEnumeration() {
      assertThat(allChildren(BooleanConstraints.fair())).containsExactly(false, true);
      assertThat(allChildren(new BooleanConstraints(1))).containsExactly(true);
    }
  }

  @Nested
  final class IntegerTests {
    @Test
    void testZeroWeightsAreExcluded() {
      assertThat(computeMaxChildren(IntegerConstraints.between(1, 2).withWeights(List.of(0.0, 1.0)))).isEqualTo(1);
      assertThat(computeMaxChildren(IntegerConstraints.between(1, 4).withWeights(List.of(0.0, 0.5, 0.0, 0.5)))).isEqualTo(2);
      assertThat(allChildren(IntegerConstraints.between(1, 4).withWeights(List.of(0.0, 0.5, 0.0, 0.5)))).containsExactly(2L, 4L);
    }

    @Test
    void testBoundedRange() {
      assertThat(computeMaxChildren(IntegerConstraints.between(-3, 3))).isEqualTo(7);
      assertThat(allChildren(IntegerConstraints.between(-1, 2))).containsExactly(-1L, 0L, 1L, 2L);
    }

    @Test
    void testHugeRangesAreCapped() {
      assertThat(computeMaxChildren(IntegerConstraints.between(Long.MIN_VALUE, Long.MAX_VALUE))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
      assertThat(computeMaxChildren(IntegerConstraints.between(0, MAX_CHILDREN_EFFECTIVELY_INFINITE))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
      assertThat(computeMaxChildren(IntegerConstraints.unbounded())).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
      assertThat(computeMaxChildren(IntegerConstraints.atLeast(0))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
    }

    @Test
    void testHalfBoundedRangesNearLongLimitsAreCounted() {
      assertThat(computeMaxChildren(IntegerConstraints.atLeast(Long.MAX_VALUE - 1))).isEqualTo(2);
      assertThat(allChildren(IntegerConstraints.atLeast(Long.MAX_VALUE - 1))).containsExactly(Long.MAX_VALUE - 1, Long.MAX_VALUE);
      assertThat(computeMaxChildren(IntegerConstraints.atMost(Long.MIN_VALUE + 2))).isEqualTo(3);
      assertThat(allChildren(IntegerConstraints.atMost(Long.MIN_VALUE + 2)))
          .containsExactlyInAnyOrder(Long.MIN_VALUE, Long.MIN_VALUE + 1, Long.MIN_VALUE + 2);
    }

    @Test
    void testHalfBoundedEnumerationWalksOutward() {
      final var iterator = allChildren(IntegerConstraints.atLeast(-2).shrinkingTowards(0)).iterator();
      final var first = new ArrayList<>();
      for (var i = 0; i < 6; i++) {
        first.add(iterator.next());
      }
      assertThat(first).containsExactly(0L, 1L, -1L, 2L, -2L, 3L);
    }

    @Test
    void testUnboundedEnumerationIsCapped() {
      assertThat(computeMaxChildren(IntegerConstraints.atMost(0))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
      final var iterator = allChildren(IntegerConstraints.atMost(0)).iterator();
      assertThat(iterator.next()).isEqualTo(0L);
      assertThat(iterator.next()).isEqualTo(-1L);
    }
  }

  @Nested
  final class FloatTests {
    @Test
    void testSignedZerosAreDistinct() {
      assertThat(computeMaxChildren(FloatConstraints.between(-0.0, 0.0))).isEqualTo(2);
      assertThat(allChildren(FloatConstraints.between(-0.0, 0.0))).containsExactly(-0.0, 0.0);
      assertThat(computeMaxChildren(FloatConstraints.between(0.0, 0.0))).isEqualTo(1);
    }

    @Test
    void testNeighbouringValues() {
      final var hi = Math.nextUp(Math.nextUp(1.0));
      assertThat(computeMaxChildren(FloatConstraints.between(1.0, hi))).isEqualTo(3);
      assertThat(allChildren(FloatConstraints.between(1.0, hi))).containsExactly(1.0, Math.nextUp(1.0), hi);
    }

    @Test
    void testSmallestNonzeroMagnitude() {
      final var constraints = new FloatConstraints(-1.0, 1.0, false, 1.0);
      assertThat(computeMaxChildren(constraints)).isEqualTo(4);
      assertThat(allChildren(constraints)).containsExactly(-1.0, -0.0, 0.0, 1.0);
    }

    @Test
    void testNanCountsAsOneMoreValue() {
      final var constraints = new FloatConstraints(1.0, 1.0, true, Double.MIN_VALUE);
      assertThat(computeMaxChildren(constraints)).isEqualTo(2);
      assertThat(allChildren(constraints)).containsExactly(1.0, Double.NaN);
      assertThat(computeMaxChildren(FloatConstraints.unbounded())).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
    }

    @Test
    void testNanOnlyDomain() {
      final var constraints = new FloatConstraints(0.5, 0.6, true, 1.0);
      assertThat(computeMaxChildren(constraints)).isEqualTo(1);
      assertThat(allChildren(constraints)).containsExactly(Double.NaN);
    }

    @Test
    void testOrdinalRoundTrip() {
      for (var value : new double[] {0.0, -0.0, Double.MIN_VALUE, -Double.MIN_VALUE, 1.5, -1.5,
                                     Double.MAX_VALUE, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY}) {
        assertThat(fromOrdinal(ordinal(value))).isEqualTo(value);
      }
      assertThat(ordinal(0.0)).isEqualTo(0);
      assertThat(ordinal(-0.0)).isEqualTo(-1);
      assertThat(ordinal(-Double.MIN_VALUE)).isLessThan(ordinal(-0.0));
    }
  }

  @Nested
  final class StringTests {
    @Test
    void testFixedSize() {
      assertThat(computeMaxChildren(StringConstraints.ofSize(8, 8, "abc"))).isEqualTo(6561);
    }

    @Test
    void testSizeRange() {
      var expected = 0L;
      for (var size = 2; size <= 8; size++) {
        expected += (long) Math.pow(4, size);
      }
      assertThat(computeMaxChildren(StringConstraints.ofSize(2, 8, "abcd"))).isEqualTo(expected);
    }

    @Test
    void testEmptyAlphabet() {
      assertThat(computeMaxChildren(StringConstraints.ofSize(0, 100, ""))).isEqualTo(1);
      assertThat(allChildren(StringConstraints.ofSize(0, 100, ""))).containsExactly("");
      assertThat(computeMaxChildren(StringConstraints.ofSize(1, 100, ""))).isZero();
    }

    @Test
    void testLargeDomainsAreCapped() {
      assertThat(computeMaxChildren(StringConstraints.ofSize(0, null, "a"))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
      assertThat(computeMaxChildren(StringConstraints.ofSize(0, 10_000, "abcdefg"))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
      assertThat(computeMaxChildren(StringConstraints.ofSize(50, 50, "ab"))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
    }

    @Test
    void testZeroMaxSize() {
      assertThat(computeMaxChildren(StringConstraints.ofSize(0, 0, "abc"))).isEqualTo(1);
    }

    @Test
    void testSingleCharacterAlphabet() {
      assertThat(computeMaxChildren(StringConstraints.ofSize(0, 3, "a"))).isEqualTo(4);
      assertThat(allChildren(StringConstraints.ofSize(0, 3, "a"))).containsExactly("", "a", "aa", "aaa");
    }

    @Test
    void testEnumerationFollowsShrinkOrder() {
      assertThat(allChildren(StringConstraints.ofSize(0, 1, "!0a"))).containsExactly("", "0", "a", "!");
    }
  }

  @Nested
  final class BytesTests {
    @Test
    void testSmallSizes() {
      assertThat(computeMaxChildren(new BytesConstraints(0))).isEqualTo(1);
      assertThat(computeMaxChildren(new BytesConstraints(1))).isEqualTo(256);
      assertThat(computeMaxChildren(new BytesConstraints(2))).isEqualTo(65_536);
      assertThat(computeMaxChildren(new BytesConstraints(3))).isEqualTo(MAX_CHILDREN_EFFECTIVELY_INFINITE);
    }

    @Test
    void testEnumeration() {
      assertCountMatchesEnumeration(new BytesConstraints(0));
      assertCountMatchesEnumeration(new BytesConstraints(1));
      assertCountMatchesEnumeration(new BytesConstraints(2));
    }
  }

  @Test
  void testRequireNonEmpty() {
    requireNonEmpty(IntegerConstraints.between(1, 1));
    requireNonEmpty(new FloatConstraints(0.5, 0.6, true, 1.0));

    final var emptyString = catchThrowableOfType(() -> requireNonEmpty(StringConstraints.ofSize(1, 3, "")), ChoiceUsageException.class);
    assertThat(emptyString.getReason()).isEqualTo(Reason.EMPTY_DOMAIN);

    final var zeroWeights = catchThrowableOfType(() -> requireNonEmpty(IntegerConstraints.between(1, 2).withWeights(List.of(0.0, 0.0))),
                                                 ChoiceUsageException.class);
    assertThat(zeroWeights.getReason()).isEqualTo(Reason.EMPTY_DOMAIN);

    final var emptyFloats = catchThrowableOfType(() -> requireNonEmpty(new FloatConstraints(0.5, 0.6, false, 1.0)), ChoiceUsageException.class);
    assertThat(emptyFloats.getReason()).isEqualTo(Reason.EMPTY_DOMAIN);
  }

  @Test
  void testCountsAgreeWithEnumerationForRandomConstraints() {
    final var random = new SplittableRandom(42);
    for (var i = 0; i < 300; i++) {
      assertCountMatchesEnumeration(randomInteger(random));
      assertCountMatchesEnumeration(randomFloat(random));
      assertCountMatchesEnumeration(randomString(random));
    }
  }

  @Test
  void testCountsAreNonNegativeForExtremeIntegers() {
    final var random = new SplittableRandom(7);
    for (var i = 0; i < 1000; i++) {
      final var a = random.nextLong();
      final var b = random.nextLong();
      final var constraints = IntegerConstraints.between(Math.min(a, b), Math.max(a, b));
      assertThat(computeMaxChildren(constraints)).isGreaterThanOrEqualTo(1);
    }
  }

  private static IntegerConstraints randomInteger(SplittableRandom random) {
    final long min = random.nextInt(-20, 20);
    final long max = min + random.nextInt(0, 12);
    List<Double> weights = null;
    if (random.nextBoolean()) {
      weights = new ArrayList<>();
      for (var v = min; v <= max; v++) {
        weights.add(random.nextInt(3) == 0 ? 0.0 : random.nextDouble());
      }
    }
    return new IntegerConstraints(min, max, weights, random.nextInt(-5, 5));
  }

  private static FloatConstraints randomFloat(SplittableRandom random) {
    final var lo = random.nextLong(-30, 30);
    final var hi = lo + random.nextLong(0, 40);
    final var smallest = random.nextBoolean() ? Double.MIN_VALUE : fromOrdinal(random.nextLong(1, 20));
    return new FloatConstraints(fromOrdinal(lo), fromOrdinal(hi), random.nextBoolean(), smallest);
  }

  private static StringConstraints randomString(SplittableRandom random) {
    final var alphabet = new StringBuilder();
    final var alphabetSize = random.nextInt(0, 5);
    for (var i = 0; i < alphabetSize; i++) {
      alphabet.appendCodePoint(random.nextInt(0x20, 0x80));
    }
    final var minSize = random.nextInt(0, 3);
    return StringConstraints.ofSize(minSize, minSize + random.nextInt(0, 3), alphabet.toString());
  }
}
