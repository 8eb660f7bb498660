package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.util.*;

import java.util.*;

/**
 *  An immutable, disjoint union of closed code point ranges. Ranges are held sorted and merged, so that two
 *  sets describing the same code points are equal.
 */
public final class IntervalSet {
  public static final int MAX_CODE_POINT = Character.MAX_CODE_POINT;

  private static final IntervalSet EMPTY = new IntervalSet(new int[0]);

  /** Flattened {@code [lo0, hi0, lo1, hi1, ...]}. */
  private final int[] bounds;

  /** Number of code points preceding each range. */
  private final int[] offsets;

  private IntervalSet(int[] bounds) {
    this.bounds = bounds;
    offsets = new int[bounds.length / 2];
    var running = 0;
    for (var i = 0; i < offsets.length; i++) {
      offsets[i] = running;
      running += bounds[2 * i + 1] - bounds[2 * i] + 1;
    }
  }

  public static IntervalSet empty() {
    return EMPTY;
  }

  /**
   *  Builds a set from closed {@code [lo, hi]} pairs, which may overlap or arrive in any order.
   *
   *  @param ranges The ranges.
   *  @return The normalized {@link IntervalSet}.
   */
  public static IntervalSet of(int[]... ranges) {
    final var pairs = new ArrayList<int[]>(ranges.length);
    for (var range : ranges) {
      Assert.argument(range.length == 2, () -> "Range must have exactly two bounds, got " + range.length);
      Assert.argument(range[0] <= range[1], () -> "Range lower bound " + range[0] + " exceeds upper bound " + range[1]);
      Assert.argument(range[0] >= 0 && range[1] <= MAX_CODE_POINT, () -> "Range " + Arrays.toString(range) + " is outside the code point space");
      pairs.add(range.clone());
    }
    return normalize(pairs);
  }

  public static IntervalSet fromString(String chars) {
    final var pairs = new ArrayList<int[]>();
    chars.codePoints().forEach(cp -> pairs.add(new int[] {cp, cp}));
    return normalize(pairs);
  }

  private static IntervalSet normalize(List<int[]> pairs) {
    if (pairs.isEmpty()) {
      return EMPTY;
    }
    pairs.sort(Comparator.comparingInt(pair -> pair[0]));
    final var merged = new ArrayList<int[]>();
    var current = pairs.get(0).clone();
    for (var i = 1; i < pairs.size(); i++) {
      final var next = pairs.get(i);
      // adjacent ranges are merged too, keeping the representation canonical
      if ((long) next[0] <= (long) current[1] + 1) {
        current[1] = Math.max(current[1], next[1]);
      } else {
        merged.add(current);
        current = next.clone();
      }
    }
    merged.add(current);

    final var bounds = new int[merged.size() * 2];
    for (var i = 0; i < merged.size(); i++) {
      bounds[2 * i] = merged.get(i)[0];
      bounds[2 * i + 1] = merged.get(i)[1];
    }
    return new IntervalSet(bounds);
  }

  public int size() {
    final var ranges = offsets.length;
    return ranges == 0 ? 0 : offsets[ranges - 1] + bounds[2 * ranges - 1] - bounds[2 * ranges - 2] + 1;
  }

  public boolean isEmpty() {
    return bounds.length == 0;
  }

  public int numRanges() {
    return offsets.length;
  }

  /**
   *  Obtains the code point at the given position, counting in ascending order.
   *
   *  @param index The position, in {@code [0, size())}.
   *  @return The code point.
   */
  public int get(int index) {
    Assert.that(index >= 0 && index < size(), IndexOutOfBoundsException::new, () -> "Index " + index + " out of bounds for size " + size());
    var lo = 0;
    var hi = offsets.length - 1;
    while (lo < hi) {
      final var mid = (lo + hi + 1) >>> 1;
      if (offsets[mid] <= index) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return bounds[2 * lo] + index - offsets[lo];
  }

  /**
   *  The inverse of {@link #get(int)}.
   *
   *  @param codePoint The code point.
   *  @return Its position in ascending order, or {@code -1} if the code point is not a member.
   */
  public int indexOf(int codePoint) {
    var lo = 0;
    var hi = offsets.length - 1;
    while (lo <= hi) {
      final var mid = (lo + hi) >>> 1;
      if (codePoint < bounds[2 * mid]) {
        hi = mid - 1;
      } else if (codePoint > bounds[2 * mid + 1]) {
        lo = mid + 1;
      } else {
        return offsets[mid] + codePoint - bounds[2 * mid];
      }
    }
    return -1;
  }

  public boolean contains(int codePoint) {
    return indexOf(codePoint) != -1;
  }

  public boolean containsAll(String str) {
    return str.codePoints().allMatch(this::contains);
  }

  /**
   *  Number of members below {@code '0'}; shrink order starts just past them.
   */
  private int shrinkRotation() {
    final var size = size();
    if (size == 0) {
      return 0;
    }
    var below = 0;
    for (var i = 0; i < offsets.length; i++) {
      final var lo = bounds[2 * i];
      final var hi = bounds[2 * i + 1];
      if (hi < '0') {
        below += hi - lo + 1;
      } else {
        if (lo < '0') {
          below += '0' - lo;
        }
        break;
      }
    }
    return below % size;
  }

  /**
   *  Obtains the code point at the given position in shrink order, which begins at {@code '0'} (or the
   *  first member above it), ascends, and wraps around to the members below {@code '0'}.
   *
   *  @param index The position in shrink order.
   *  @return The code point.
   */
  public int codePointInShrinkOrder(int index) {
    final var size = size();
    Assert.that(index >= 0 && index < size, IndexOutOfBoundsException::new, () -> "Index " + index + " out of bounds for size " + size);
    return get((index + shrinkRotation()) % size);
  }

  public int indexInShrinkOrder(int codePoint) {
    final var index = indexOf(codePoint);
    if (index == -1) {
      return -1;
    }
    final var size = size();
    return (index - shrinkRotation() + size) % size;
  }

  public IntervalSet union(IntervalSet other) {
    final var pairs = new ArrayList<int[]>(numRanges() + other.numRanges());
    addPairs(pairs);
    other.addPairs(pairs);
    return normalize(pairs);
  }

  public IntervalSet intersection(IntervalSet other) {
    final var pairs = new ArrayList<int[]>();
    var i = 0;
    var j = 0;
    while (i < numRanges() && j < other.numRanges()) {
      final var lo = Math.max(bounds[2 * i], other.bounds[2 * j]);
      final var hi = Math.min(bounds[2 * i + 1], other.bounds[2 * j + 1]);
      if (lo <= hi) {
        pairs.add(new int[] {lo, hi});
      }
      if (bounds[2 * i + 1] < other.bounds[2 * j + 1]) {
        i++;
      } else {
        j++;
      }
    }
    return normalize(pairs);
  }

  public IntervalSet difference(IntervalSet other) {
    final var pairs = new ArrayList<int[]>();
    var j = 0;
    for (var i = 0; i < numRanges(); i++) {
      var lo = bounds[2 * i];
      final var hi = bounds[2 * i + 1];
      while (j < other.numRanges() && other.bounds[2 * j + 1] < lo) {
        j++;
      }
      var k = j;
      while (lo <= hi && k < other.numRanges() && other.bounds[2 * k] <= hi) {
        if (other.bounds[2 * k] > lo) {
          pairs.add(new int[] {lo, other.bounds[2 * k] - 1});
        }
        if (other.bounds[2 * k + 1] >= hi) {
          lo = hi + 1;
        } else {
          lo = Math.max(lo, other.bounds[2 * k + 1] + 1);
          k++;
        }
      }
      if (lo <= hi) {
        pairs.add(new int[] {lo, hi});
      }
    }
    return normalize(pairs);
  }

  private void addPairs(List<int[]> pairs) {
    for (var i = 0; i < numRanges(); i++) {
      pairs.add(new int[] {bounds[2 * i], bounds[2 * i + 1]});
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (IntervalSet) o;
    return Arrays.equals(bounds, that.bounds);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bounds);
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder(IntervalSet.class.getSimpleName()).append('[');
    for (var i = 0; i < numRanges(); i++) {
      if (i != 0) sb.append(", ");
      sb.append(bounds[2 * i]).append('-').append(bounds[2 * i + 1]);
    }
    return sb.append(']').toString();
  }
}
