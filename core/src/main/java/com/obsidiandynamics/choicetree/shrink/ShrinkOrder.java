package com.obsidiandynamics.choicetree.shrink;

import com.obsidiandynamics.choicetree.*;

import java.util.*;

/**
 *  The total order under which shrinking makes progress. Fewer choices are always simpler; among equally
 *  long sequences, the first differing choice decides.
 */
public final class ShrinkOrder {
  private ShrinkOrder() {}

  /**
   *  Compares two candidate choice lists.
   *
   *  @return A negative number if {@code a} is simpler than {@code b}, zero if equivalent, or positive
   *          otherwise.
   */
  public static int compare(List<ChoiceNode> a, List<ChoiceNode> b) {
    if (a.size() != b.size()) {
      return Integer.compare(a.size(), b.size());
    }
    for (var i = 0; i < a.size(); i++) {
      final var comparison = compareNodes(a.get(i), b.get(i));
      if (comparison != 0) {
        return comparison;
      }
    }
    return 0;
  }

  public static boolean isSmaller(List<ChoiceNode> a, List<ChoiceNode> b) {
    return compare(a, b) < 0;
  }

  public static int compareNodes(ChoiceNode a, ChoiceNode b) {
    if (a.getType() != b.getType()) {
      return a.getType().compareTo(b.getType());
    }
    return switch (a.getType()) {
      case BOOLEAN -> Boolean.compare((Boolean) a.getValue(), (Boolean) b.getValue());
      case INTEGER -> compareIntegers((IntegerConstraints) a.getConstraints(), (Long) a.getValue(),
                                      (IntegerConstraints) b.getConstraints(), (Long) b.getValue());
      case FLOAT -> compareFloats((Double) a.getValue(), (Double) b.getValue());
      case STRING -> compareStrings(((StringConstraints) a.getConstraints()).getIntervals(), (String) a.getValue(),
                                    ((StringConstraints) b.getConstraints()).getIntervals(), (String) b.getValue());
      case BYTES -> compareBytes((byte[]) a.getValue(), (byte[]) b.getValue());
    };
  }

  /**
   *  Unsigned distance between two longs; exact across the full range.
   */
  static long distance(long a, long b) {
    return a >= b ? a - b : b - a;
  }

  static int compareIntegers(IntegerConstraints ca, long a, IntegerConstraints cb, long b) {
    final var distanceA = distance(a, ca.getTarget());
    final var distanceB = distance(b, cb.getTarget());
    final var byDistance = Long.compareUnsigned(distanceA, distanceB);
    if (byDistance != 0) {
      return byDistance;
    }
    // values at or above the target come first
    return Boolean.compare(a < ca.getTarget(), b < cb.getTarget());
  }

  static int compareFloats(double a, double b) {
    final var nanA = Double.isNaN(a);
    final var nanB = Double.isNaN(b);
    if (nanA || nanB) {
      return Boolean.compare(nanA, nanB);
    }
    final var byMagnitude = Double.compare(Math.abs(a), Math.abs(b));
    if (byMagnitude != 0) {
      return byMagnitude;
    }
    return Boolean.compare(isNegative(a), isNegative(b));
  }

  private static boolean isNegative(double value) {
    return Double.doubleToRawLongBits(value) < 0;
  }

  static int compareStrings(IntervalSet ia, String a, IntervalSet ib, String b) {
    final var lengthA = a.codePointCount(0, a.length());
    final var lengthB = b.codePointCount(0, b.length());
    if (lengthA != lengthB) {
      return Integer.compare(lengthA, lengthB);
    }
    final var codePointsA = a.codePoints().toArray();
    final var codePointsB = b.codePoints().toArray();
    for (var i = 0; i < codePointsA.length; i++) {
      final var comparison = Integer.compare(ia.indexInShrinkOrder(codePointsA[i]), ib.indexInShrinkOrder(codePointsB[i]));
      if (comparison != 0) {
        return comparison;
      }
    }
    return 0;
  }

  static int compareBytes(byte[] a, byte[] b) {
    if (a.length != b.length) {
      return Integer.compare(a.length, b.length);
    }
    return Arrays.compareUnsigned(a, b);
  }
}
