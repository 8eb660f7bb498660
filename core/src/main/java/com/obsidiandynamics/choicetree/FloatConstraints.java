package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.ChoiceUsageException.*;
import com.obsidiandynamics.choicetree.util.*;

/**
 *  Constraints on a double-precision choice. Bounds are compared in the total order of
 *  {@link Double#compare(double, double)}, so {@code -0.0} sorts strictly below {@code 0.0}. Nonzero values
 *  whose magnitude is below {@code smallestNonzeroMagnitude} are excluded.
 */
public final class FloatConstraints implements Constraints<Double> {
  private final double minValue;

  private final double maxValue;

  private final boolean allowNan;

  private final double smallestNonzeroMagnitude;

  public FloatConstraints(double minValue, double maxValue, boolean allowNan, double smallestNonzeroMagnitude) {
    Assert.argument(! Double.isNaN(minValue) && ! Double.isNaN(maxValue), () -> "Bounds cannot be NaN");
    Assert.argument(Double.compare(minValue, maxValue) <= 0, () -> "Min value " + minValue + " exceeds max value " + maxValue);
    Assert.argument(smallestNonzeroMagnitude > 0, () -> "Smallest nonzero magnitude must be positive, got " + smallestNonzeroMagnitude);
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.allowNan = allowNan;
    this.smallestNonzeroMagnitude = smallestNonzeroMagnitude;
  }

  public static FloatConstraints unbounded() {
    return new FloatConstraints(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true, Double.MIN_VALUE);
  }

  public static FloatConstraints between(double minValue, double maxValue) {
    return new FloatConstraints(minValue, maxValue, false, Double.MIN_VALUE);
  }

  public double getMinValue() {
    return minValue;
  }

  public double getMaxValue() {
    return maxValue;
  }

  public boolean isAllowNan() {
    return allowNan;
  }

  public double getSmallestNonzeroMagnitude() {
    return smallestNonzeroMagnitude;
  }

  boolean inBounds(double value) {
    return Double.compare(minValue, value) <= 0 && Double.compare(value, maxValue) <= 0;
  }

  boolean permitsMagnitude(double value) {
    return value == 0 || Math.abs(value) >= smallestNonzeroMagnitude;
  }

  @Override
  public ChoiceType getType() {
    return ChoiceType.FLOAT;
  }

  @Override
  public Class<Double> getValueClass() {
    return Double.class;
  }

  @Override
  public boolean permits(Object value) {
    if (! (value instanceof Double)) return false;
    final double v = (Double) value;
    if (Double.isNaN(v)) return allowNan;
    return inBounds(v) && permitsMagnitude(v);
  }

  @Override
  public Double simplest() {
    if (permits(0.0)) return 0.0;
    if (permits(-0.0)) return -0.0;

    // zero is out of range, so the range lies wholly on one side of it
    final double candidate;
    if (minValue > 0) {
      candidate = Math.max(minValue, smallestNonzeroMagnitude);
    } else {
      candidate = Math.min(maxValue, -smallestNonzeroMagnitude);
    }
    if (permits(candidate)) return candidate;
    if (allowNan) return Double.NaN;
    throw new ChoiceUsageException(Reason.EMPTY_DOMAIN, "No value satisfies " + this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (FloatConstraints) o;
    if (Double.compare(minValue, that.minValue) != 0) return false;
    if (Double.compare(maxValue, that.maxValue) != 0) return false;
    if (allowNan != that.allowNan) return false;
    return Double.compare(smallestNonzeroMagnitude, that.smallestNonzeroMagnitude) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(minValue);
    result = 31 * result + Double.hashCode(maxValue);
    result = 31 * result + (allowNan ? 1 : 0);
    result = 31 * result + Double.hashCode(smallestNonzeroMagnitude);
    return result;
  }

  @Override
  public String toString() {
    return FloatConstraints.class.getSimpleName() + "[minValue=" + minValue + ", maxValue=" + maxValue +
        ", allowNan=" + allowNan + ", smallestNonzeroMagnitude=" + smallestNonzeroMagnitude + ']';
  }
}
