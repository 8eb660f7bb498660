package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.ChoiceUsageException.*;
import com.obsidiandynamics.choicetree.util.*;

import java.math.*;
import java.util.*;
import java.util.function.*;

/**
 *  Counts and enumerates the distinct values that a constraint set admits.<p>
 *
 *  Counts at or above {@link #MAX_CHILDREN_EFFECTIVELY_INFINITE} are reported as exactly that value, which
 *  then stands for "too many to ever enumerate". Below the cap, {@link #allChildren(Constraints)} yields
 *  exactly {@link #computeMaxChildren(Constraints)} distinct values.
 */
public final class ChoiceCombinatorics {
  public static final long MAX_CHILDREN_EFFECTIVELY_INFINITE = 10_000_000;

  private static final BigInteger CAP = BigInteger.valueOf(MAX_CHILDREN_EFFECTIVELY_INFINITE);

  private static final double LOG_CAP = Math.log(MAX_CHILDREN_EFFECTIVELY_INFINITE);

  private ChoiceCombinatorics() {}

  public static boolean isEffectivelyInfinite(long maxChildren) {
    return maxChildren >= MAX_CHILDREN_EFFECTIVELY_INFINITE;
  }

  public static long computeMaxChildren(Constraints<?> constraints) {
    switch (constraints.getType()) {
      case BOOLEAN -> {
        final var c = (BooleanConstraints) constraints;
        return (c.canBeFalse() ? 1 : 0) + (c.canBeTrue() ? 1 : 0);
      }
      case INTEGER -> {
        return integerChildren((IntegerConstraints) constraints);
      }
      case FLOAT -> {
        return capped(floatChildren((FloatConstraints) constraints));
      }
      case STRING -> {
        return stringChildren((StringConstraints) constraints);
      }
      case BYTES -> {
        final var size = ((BytesConstraints) constraints).getSize();
        return size >= 3 ? MAX_CHILDREN_EFFECTIVELY_INFINITE : 1L << (8 * size);
      }
      default -> throw new UnsupportedOperationException("Unsupported type " + constraints.getType());
    }
  }

  /**
   *  Fails fast if the constraints admit no value.
   *
   *  @param constraints The constraints.
   *  @throws ChoiceUsageException With {@link Reason#EMPTY_DOMAIN} if there are no children.
   */
  public static void requireNonEmpty(Constraints<?> constraints) {
    if (computeMaxChildren(constraints) == 0) {
      throw new ChoiceUsageException(Reason.EMPTY_DOMAIN, "No value satisfies " + constraints);
    }
  }

  private static long capped(BigInteger count) {
    return count.compareTo(CAP) >= 0 ? MAX_CHILDREN_EFFECTIVELY_INFINITE : count.longValueExact();
  }

  private static long integerChildren(IntegerConstraints c) {
    if (c.getMinValue() == null && c.getMaxValue() == null) {
      return MAX_CHILDREN_EFFECTIVELY_INFINITE;
    }
    // a missing bound stops at the end of the long range
    final long min = c.getMinValue() != null ? c.getMinValue() : Long.MIN_VALUE;
    final long max = c.getMaxValue() != null ? c.getMaxValue() : Long.MAX_VALUE;
    var count = BigInteger.valueOf(max).subtract(BigInteger.valueOf(min)).add(BigInteger.ONE);
    if (c.getWeights() != null) {
      final var zeroWeights = c.getWeights().stream().filter(weight -> weight == 0).count();
      count = count.subtract(BigInteger.valueOf(zeroWeights));
    }
    return capped(count);
  }

  private static long stringChildren(StringConstraints c) {
    final var alphabet = c.getIntervals().size();
    if (alphabet == 0) {
      // only the empty string, and only if it is long enough
      return c.getMinSize() == 0 ? 1 : 0;
    }
    if (c.getMaxSize() == null) {
      return MAX_CHILDREN_EFFECTIVELY_INFINITE;
    }
    final int minSize = c.getMinSize();
    final int maxSize = c.getMaxSize();
    if (alphabet == 1) {
      return capped(BigInteger.valueOf((long) maxSize - minSize + 1));
    }
    if (minSize * Math.log(alphabet) > LOG_CAP) {
      return MAX_CHILDREN_EFFECTIVELY_INFINITE;
    }

    final var base = BigInteger.valueOf(alphabet);
    var term = base.pow(minSize);
    var sum = BigInteger.ZERO;
    for (var size = minSize; size <= maxSize; size++) {
      sum = sum.add(term);
      if (sum.compareTo(CAP) >= 0) {
        return MAX_CHILDREN_EFFECTIVELY_INFINITE;
      }
      term = term.multiply(base);
    }
    return sum.longValueExact();
  }

  private static BigInteger floatChildren(FloatConstraints c) {
    final var min = c.getMinValue();
    final var max = c.getMaxValue();
    var count = countBetween(min, max);

    final var snm = c.getSmallestNonzeroMagnitude();
    if (snm > Double.MIN_VALUE) {
      // take away the nonzero values that are too close to zero
      final var belowSnm = Math.nextDown(snm);
      final var positiveLo = Math.max(min, Double.MIN_VALUE);
      final var positiveHi = Math.min(max, belowSnm);
      if (Double.compare(positiveLo, positiveHi) <= 0) {
        count = count.subtract(countBetween(positiveLo, positiveHi));
      }
      final var negativeLo = Math.max(min, -belowSnm);
      final var negativeHi = Math.min(max, -Double.MIN_VALUE);
      if (Double.compare(negativeLo, negativeHi) <= 0) {
        count = count.subtract(countBetween(negativeLo, negativeHi));
      }
    }
    return c.isAllowNan() ? count.add(BigInteger.ONE) : count;
  }

  /**
   *  Counts the doubles in {@code [lo, hi]}, treating {@code -0.0} and {@code 0.0} as distinct.
   */
  private static BigInteger countBetween(double lo, double hi) {
    return BigInteger.valueOf(ordinal(hi)).subtract(BigInteger.valueOf(ordinal(lo))).add(BigInteger.ONE);
  }

  /**
   *  Maps a non-NaN double onto a long, preserving the order of {@link Double#compare(double, double)}.
   *  {@code 0.0} maps to 0 and {@code -0.0} to -1.
   */
  static long ordinal(double value) {
    final var bits = Double.doubleToRawLongBits(value);
    return bits >= 0 ? bits : -(bits & Long.MAX_VALUE) - 1;
  }

  static double fromOrdinal(long ordinal) {
    return ordinal >= 0 ? Double.longBitsToDouble(ordinal) : Double.longBitsToDouble((-(ordinal + 1)) | Long.MIN_VALUE);
  }

  /**
   *  Lazily enumerates the values admitted by the given constraints, in shrink-friendly order where that
   *  is cheap. The sequence is restartable and never exceeds {@link #MAX_CHILDREN_EFFECTIVELY_INFINITE}
   *  elements.
   *
   *  @param constraints The constraints.
   *  @return An {@link Iterable} over the distinct permitted values.
   */
  public static Iterable<Object> allChildren(Constraints<?> constraints) {
    switch (constraints.getType()) {
      case BOOLEAN -> {
        final var c = (BooleanConstraints) constraints;
        final var values = new ArrayList<Object>(2);
        if (c.canBeFalse()) values.add(false);
        if (c.canBeTrue()) values.add(true);
        return capped(values::iterator);
      }
      case INTEGER -> {
        final var c = (IntegerConstraints) constraints;
        return capped(() -> new IntegerIterator(c));
      }
      case FLOAT -> {
        final var c = (FloatConstraints) constraints;
        return capped(() -> new FloatIterator(c));
      }
      case STRING -> {
        final var c = (StringConstraints) constraints;
        return capped(() -> new StringIterator(c));
      }
      case BYTES -> {
        final var c = (BytesConstraints) constraints;
        return capped(() -> new BytesIterator(c.getSize()));
      }
      default -> throw new UnsupportedOperationException("Unsupported type " + constraints.getType());
    }
  }

  private static Iterable<Object> capped(Supplier<Iterator<Object>> source) {
    return new CappedIterable<>(source, MAX_CHILDREN_EFFECTIVELY_INFINITE);
  }

  /**
   *  Bounded ranges ascend from the minimum; ranges open on either side walk outward from the target.
   */
  private static final class IntegerIterator implements Iterator<Object> {
    private final IntegerConstraints c;

    private Long next;

    /** Distance from the target of the value most recently considered, for the outward walk. */
    private long distance;

    private boolean aboveNext = true;

    IntegerIterator(IntegerConstraints c) {
      this.c = c;
      if (c.isBounded()) {
        next = c.getMinValue();
        skipZeroWeights();
      } else {
        next = c.getTarget();
      }
    }

    private void skipZeroWeights() {
      while (next != null && c.weightOf(next) == 0) {
        next = next.equals(c.getMaxValue()) ? null : next + 1;
      }
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public Object next() {
      if (next == null) throw new NoSuchElementException();
      final var current = next;
      if (c.isBounded()) {
        next = current.equals(c.getMaxValue()) ? null : current + 1;
        skipZeroWeights();
      } else {
        next = outward();
      }
      return current;
    }

    private Long outward() {
      final var target = c.getTarget();
      // try at most both sides at each distance before widening
      for (var attempts = 0; attempts < 4; attempts++) {
        if (aboveNext) {
          distance++;
          aboveNext = false;
          final var candidate = target + distance;
          if (candidate > target && c.inBounds(candidate)) return candidate;
        } else {
          aboveNext = true;
          final var candidate = target - distance;
          if (candidate < target && c.inBounds(candidate)) return candidate;
        }
      }
      return null;
    }
  }

  private static final class FloatIterator implements Iterator<Object> {
    private final FloatConstraints c;

    private final long lastOrdinal;

    private long nextOrdinal;

    private boolean exhausted;

    /** NaN comes last, after every number in range. */
    private boolean nanPending;

    FloatIterator(FloatConstraints c) {
      this.c = c;
      nextOrdinal = ordinal(c.getMinValue());
      lastOrdinal = ordinal(c.getMaxValue());
      nanPending = c.isAllowNan();
      advance();
    }

    /** Skips the band of excluded magnitudes around zero in one jump. */
    private void advance() {
      while (! exhausted && ! c.permitsMagnitude(fromOrdinal(nextOrdinal))) {
        final var resume = fromOrdinal(nextOrdinal) < 0 ? ordinal(-0.0) : ordinal(c.getSmallestNonzeroMagnitude());
        if (resume > lastOrdinal) {
          exhausted = true;
        } else {
          nextOrdinal = resume;
        }
      }
    }

    private void step() {
      if (nextOrdinal == lastOrdinal) {
        exhausted = true;
      } else {
        nextOrdinal++;
      }
    }

    @Override
    public boolean hasNext() {
      return ! exhausted || nanPending;
    }

    @Override
    public Object next() {
      if (exhausted) {
        if (! nanPending) throw new NoSuchElementException();
        nanPending = false;
        return Double.NaN;
      }
      final var value = fromOrdinal(nextOrdinal);
      step();
      advance();
      return value;
    }
  }

  /**
   *  Enumerates by ascending size, and within a size as an odometer over the alphabet in shrink order.
   */
  private static final class StringIterator implements Iterator<Object> {
    private final StringConstraints c;

    private final int alphabet;

    private int size;

    private int[] digits;

    private boolean exhausted;

    StringIterator(StringConstraints c) {
      this.c = c;
      alphabet = c.getIntervals().size();
      size = c.getMinSize();
      digits = new int[size];
      exhausted = alphabet == 0 && size > 0;
    }

    @Override
    public boolean hasNext() {
      return ! exhausted;
    }

    @Override
    public Object next() {
      if (exhausted) throw new NoSuchElementException();
      final var sb = new StringBuilder(size);
      for (var digit : digits) {
        sb.appendCodePoint(c.getIntervals().codePointInShrinkOrder(digit));
      }
      increment();
      return sb.toString();
    }

    private void increment() {
      for (var i = size - 1; i >= 0; i--) {
        if (++digits[i] < alphabet) {
          return;
        }
        digits[i] = 0;
      }
      // rolled over every position; move on to the next size
      if (alphabet == 0 || (c.getMaxSize() != null && size == c.getMaxSize())) {
        exhausted = true;
      } else {
        size++;
        digits = new int[size];
      }
    }
  }

  private static final class BytesIterator implements Iterator<Object> {
    private final int[] digits;

    private boolean exhausted;

    BytesIterator(int size) {
      digits = new int[size];
    }

    @Override
    public boolean hasNext() {
      return ! exhausted;
    }

    @Override
    public Object next() {
      if (exhausted) throw new NoSuchElementException();
      final var bytes = new byte[digits.length];
      for (var i = 0; i < digits.length; i++) {
        bytes[i] = (byte) digits[i];
      }
      exhausted = true;
      for (var i = digits.length - 1; i >= 0; i--) {
        if (++digits[i] < 256) {
          exhausted = false;
          break;
        }
        digits[i] = 0;
      }
      return bytes;
    }
  }
}
