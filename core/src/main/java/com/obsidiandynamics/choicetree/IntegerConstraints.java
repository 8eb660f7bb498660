package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.ChoiceUsageException.*;
import com.obsidiandynamics.choicetree.util.*;

import java.util.*;

/**
 *  Constraints on an integer choice. Either bound may be absent ({@code null}). When both bounds are present,
 *  an optional list of weights assigns a relative probability to each value in {@code [min, max]}, in
 *  ascending order; values of zero weight can never be drawn.
 */
public final class IntegerConstraints implements Constraints<Long> {
  private final Long minValue;

  private final Long maxValue;

  private final List<Double> weights;

  private final long shrinkTowards;

  public IntegerConstraints(Long minValue, Long maxValue, List<Double> weights, long shrinkTowards) {
    if (minValue != null && maxValue != null) {
      Assert.argument(minValue <= maxValue, () -> "Min value " + minValue + " exceeds max value " + maxValue);
    }
    if (weights != null) {
      Assert.argument(minValue != null && maxValue != null, () -> "Weights require both bounds");
      final var span = maxValue - minValue;
      Assert.argument(span >= 0 && span == weights.size() - 1,
                      () -> "Expected " + (maxValue - minValue + 1) + " weights, got " + weights.size());
      for (var weight : weights) {
        Assert.argument(weight != null && weight >= 0 && Double.isFinite(weight), () -> "Invalid weight " + weight);
      }
    }
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.weights = weights != null ? List.copyOf(weights) : null;
    this.shrinkTowards = shrinkTowards;
  }

  public static IntegerConstraints unbounded() {
    return new IntegerConstraints(null, null, null, 0);
  }

  public static IntegerConstraints between(long minValue, long maxValue) {
    return new IntegerConstraints(minValue, maxValue, null, 0);
  }

  public static IntegerConstraints atLeast(long minValue) {
    return new IntegerConstraints(minValue, null, null, 0);
  }

  public static IntegerConstraints atMost(long maxValue) {
    return new IntegerConstraints(null, maxValue, null, 0);
  }

  public IntegerConstraints withWeights(List<Double> weights) {
    return new IntegerConstraints(minValue, maxValue, weights, shrinkTowards);
  }

  public IntegerConstraints shrinkingTowards(long shrinkTowards) {
    return new IntegerConstraints(minValue, maxValue, weights, shrinkTowards);
  }

  public Long getMinValue() {
    return minValue;
  }

  public Long getMaxValue() {
    return maxValue;
  }

  public boolean isBounded() {
    return minValue != null && maxValue != null;
  }

  public List<Double> getWeights() {
    return weights;
  }

  public long getShrinkTowards() {
    return shrinkTowards;
  }

  /**
   *  The shrink target, clamped into the bounds.
   *
   *  @return The effective target.
   */
  public long getTarget() {
    var target = shrinkTowards;
    if (minValue != null) target = Math.max(target, minValue);
    if (maxValue != null) target = Math.min(target, maxValue);
    return target;
  }

  boolean inBounds(long value) {
    return (minValue == null || value >= minValue) && (maxValue == null || value <= maxValue);
  }

  double weightOf(long value) {
    return weights == null ? 1 : weights.get((int) (value - minValue));
  }

  @Override
  public ChoiceType getType() {
    return ChoiceType.INTEGER;
  }

  @Override
  public Class<Long> getValueClass() {
    return Long.class;
  }

  @Override
  public boolean permits(Object value) {
    if (! (value instanceof Long)) return false;
    final long v = (Long) value;
    return inBounds(v) && weightOf(v) != 0;
  }

  @Override
  public Long simplest() {
    final var target = getTarget();
    if (weights == null || weightOf(target) != 0) {
      return target;
    }

    // weights are only present for bounded ranges, so the outward search terminates
    for (var distance = 1L; distance <= weights.size(); distance++) {
      final var above = target + distance;
      if (inBounds(above) && weightOf(above) != 0) return above;
      final var below = target - distance;
      if (inBounds(below) && weightOf(below) != 0) return below;
    }
    throw new ChoiceUsageException(Reason.EMPTY_DOMAIN, "Every value in " + this + " has zero weight");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (IntegerConstraints) o;
    if (shrinkTowards != that.shrinkTowards) return false;
    if (! Objects.equals(minValue, that.minValue)) return false;
    if (! Objects.equals(maxValue, that.maxValue)) return false;
    return Objects.equals(weights, that.weights);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(minValue);
    result = 31 * result + Objects.hashCode(maxValue);
    result = 31 * result + Objects.hashCode(weights);
    result = 31 * result + Long.hashCode(shrinkTowards);
    return result;
  }

  @Override
  public String toString() {
    return IntegerConstraints.class.getSimpleName() + "[minValue=" + minValue +
        ", maxValue=" + maxValue + ", weights=" + weights + ", shrinkTowards=" + shrinkTowards + ']';
  }
}
