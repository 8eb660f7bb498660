package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.util.*;

import java.util.*;

/**
 *  Constraints on a string choice. Sizes count code points, not UTF-16 units. An absent ({@code null}) max
 *  size leaves the length unbounded.
 */
public final class StringConstraints implements Constraints<String> {
  private final int minSize;

  private final Integer maxSize;

  private final IntervalSet intervals;

  public StringConstraints(int minSize, Integer maxSize, IntervalSet intervals) {
    Assert.argument(minSize >= 0, () -> "Min size cannot be negative, got " + minSize);
    Assert.argument(maxSize == null || maxSize >= minSize, () -> "Max size " + maxSize + " is below min size " + minSize);
    Assert.isNotNull(intervals, Assert.withMessage("Intervals cannot be null"));
    this.minSize = minSize;
    this.maxSize = maxSize;
    this.intervals = intervals;
  }

  public static StringConstraints of(IntervalSet intervals) {
    return new StringConstraints(0, null, intervals);
  }

  public static StringConstraints ofSize(int minSize, Integer maxSize, String alphabet) {
    return new StringConstraints(minSize, maxSize, IntervalSet.fromString(alphabet));
  }

  public int getMinSize() {
    return minSize;
  }

  public Integer getMaxSize() {
    return maxSize;
  }

  public IntervalSet getIntervals() {
    return intervals;
  }

  @Override
  public ChoiceType getType() {
    return ChoiceType.STRING;
  }

  @Override
  public Class<String> getValueClass() {
    return String.class;
  }

  @Override
  public boolean permits(Object value) {
    if (! (value instanceof String)) return false;
    final var str = (String) value;
    final var size = str.codePointCount(0, str.length());
    return size >= minSize && (maxSize == null || size <= maxSize) && intervals.containsAll(str);
  }

  @Override
  public String simplest() {
    if (minSize == 0) {
      return "";
    }
    if (intervals.isEmpty()) {
      throw new ChoiceUsageException(ChoiceUsageException.Reason.EMPTY_DOMAIN, "No characters available for " + this);
    }
    final var sb = new StringBuilder(minSize);
    final var simplestCodePoint = intervals.codePointInShrinkOrder(0);
    for (var i = 0; i < minSize; i++) {
      sb.appendCodePoint(simplestCodePoint);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (StringConstraints) o;
    if (minSize != that.minSize) return false;
    if (! Objects.equals(maxSize, that.maxSize)) return false;
    return Objects.equals(intervals, that.intervals);
  }

  @Override
  public int hashCode() {
    int result = minSize;
    result = 31 * result + Objects.hashCode(maxSize);
    result = 31 * result + Objects.hashCode(intervals);
    return result;
  }

  @Override
  public String toString() {
    return StringConstraints.class.getSimpleName() + "[minSize=" + minSize + ", maxSize=" + maxSize +
        ", intervals=" + intervals + ']';
  }
}
