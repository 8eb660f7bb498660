package com.obsidiandynamics.choicetree;

import java.util.*;

/**
 *  Draws values at random, skewed towards small magnitudes, shrink targets and boundary values, where
 *  failures tend to cluster. Never runs out of entropy.
 */
public final class RandomProvider implements ChoiceProvider {
  /** Mean number of code points beyond the minimum size of a string. */
  private static final int AVERAGE_EXTRA_SIZE = 5;

  /** Cap on the extra length of strings with no max size. */
  private static final int MAX_UNBOUNDED_EXTRA_SIZE = 64;

  private final SplittableRandom random;

  public RandomProvider(SplittableRandom random) {
    this.random = random;
  }

  /**
   *  Draws a value for constraints of any type.
   *
   *  @param constraints The constraints.
   *  @return A permitted value.
   */
  public Object drawValue(Constraints<?> constraints) {
    return switch (constraints.getType()) {
      case BOOLEAN -> drawBoolean((BooleanConstraints) constraints);
      case INTEGER -> drawInteger((IntegerConstraints) constraints);
      case FLOAT -> drawFloat((FloatConstraints) constraints);
      case STRING -> drawString((StringConstraints) constraints);
      case BYTES -> drawBytes((BytesConstraints) constraints);
    };
  }

  @Override
  public boolean drawBoolean(BooleanConstraints constraints) {
    if (! constraints.canBeFalse()) return true;
    if (! constraints.canBeTrue()) return false;
    return random.nextDouble() < constraints.getP();
  }

  @Override
  public long drawInteger(IntegerConstraints constraints) {
    if (constraints.getWeights() != null) {
      return drawWeighted(constraints);
    }
    final var target = constraints.getTarget();
    if (random.nextInt(8) == 0) {
      return target;
    }

    final var min = constraints.getMinValue();
    final var max = constraints.getMaxValue();
    if (constraints.isBounded() && random.nextBoolean()) {
      final var span = max - min;
      if (span >= 0 && span < Long.MAX_VALUE) {
        return min + random.nextLong(span + 1);
      }
      while (true) {
        final var candidate = random.nextLong();
        if (constraints.inBounds(candidate)) return candidate;
      }
    }

    final var magnitude = smallMagnitude();
    final long candidate;
    if (min != null && max == null) {
      candidate = addOrElse(min, magnitude, Long.MAX_VALUE);
    } else if (min == null && max != null) {
      candidate = addOrElse(max, -magnitude, Long.MIN_VALUE);
    } else {
      final var signed = random.nextBoolean() ? magnitude : -magnitude;
      candidate = addOrElse(target, signed, target);
    }
    return constraints.inBounds(candidate) ? candidate : target;
  }

  /**
   *  A non-negative magnitude whose bit length is uniform, so that small values are as likely as large ones.
   */
  private long smallMagnitude() {
    final var bits = 1 + random.nextInt(63);
    return random.nextLong() >>> (64 - bits);
  }

  private static long addOrElse(long a, long b, long onOverflow) {
    final var result = a + b;
    return ((a ^ result) & (b ^ result)) < 0 ? onOverflow : result;
  }

  private long drawWeighted(IntegerConstraints constraints) {
    final var weights = constraints.getWeights();
    var total = 0.0;
    for (var weight : weights) {
      total += weight;
    }
    final var threshold = random.nextDouble() * total;
    var cumulative = 0.0;
    var lastNonZero = -1;
    for (var i = 0; i < weights.size(); i++) {
      final var weight = weights.get(i);
      if (weight == 0) continue;
      lastNonZero = i;
      cumulative += weight;
      if (threshold < cumulative) {
        return constraints.getMinValue() + i;
      }
    }
    return lastNonZero == -1 ? constraints.simplest() : constraints.getMinValue() + lastNonZero;
  }

  @Override
  public double drawFloat(FloatConstraints constraints) {
    final var min = constraints.getMinValue();
    final var max = constraints.getMaxValue();
    final var roll = random.nextInt(20);
    final double candidate;
    if (roll == 0) {
      candidate = constraints.simplest();
    } else if (roll == 1 && constraints.isAllowNan()) {
      candidate = Double.NaN;
    } else if (roll == 2) {
      candidate = random.nextBoolean() ? min : max;
    } else if (Double.isFinite(min) && Double.isFinite(max)) {
      final var fraction = random.nextDouble();
      // interpolating this way avoids overflowing on max - min
      candidate = min * (1 - fraction) + max * fraction;
    } else {
      final var unscaled = random.nextDouble() * 2 - 1;
      final var scaled = unscaled * Math.scalb(1.0, random.nextInt(64));
      candidate = Math.max(min, Math.min(max, scaled));
    }

    if (constraints.permits(candidate)) {
      return candidate;
    }
    final var lifted = Math.copySign(constraints.getSmallestNonzeroMagnitude(), candidate);
    return constraints.permits(lifted) ? lifted : constraints.simplest();
  }

  @Override
  public String drawString(StringConstraints constraints) {
    final var intervals = constraints.getIntervals();
    if (intervals.isEmpty()) {
      return constraints.simplest();
    }
    final var maxExtra = constraints.getMaxSize() != null
        ? constraints.getMaxSize() - constraints.getMinSize()
        : MAX_UNBOUNDED_EXTRA_SIZE;
    var size = constraints.getMinSize();
    final var continueProbability = (double) AVERAGE_EXTRA_SIZE / (AVERAGE_EXTRA_SIZE + 1);
    for (var extra = 0; extra < maxExtra && random.nextDouble() < continueProbability; extra++) {
      size++;
    }

    final var alphabet = intervals.size();
    final var sb = new StringBuilder(size);
    for (var i = 0; i < size; i++) {
      final var index = random.nextBoolean() ? random.nextInt(Math.min(alphabet, 16)) : random.nextInt(alphabet);
      sb.appendCodePoint(intervals.codePointInShrinkOrder(index));
    }
    return sb.toString();
  }

  @Override
  public byte[] drawBytes(BytesConstraints constraints) {
    final var bytes = new byte[constraints.getSize()];
    random.nextBytes(bytes);
    return bytes;
  }
}
