package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.util.*;

public final class BooleanConstraints implements Constraints<Boolean> {
  /** Probabilities within this distance of 0 or 1 are treated as certain. */
  static final double EPSILON = 0x1.0p-64;

  private final double p;

  public BooleanConstraints(double p) {
    Assert.argument(p >= 0 && p <= 1, () -> "Probability must lie in [0, 1], got " + p);
    this.p = p;
  }

  public static BooleanConstraints fair() {
    return new BooleanConstraints(0.5);
  }

  public double getP() {
    return p;
  }

  boolean canBeFalse() {
    return p < 1 - EPSILON;
  }

  boolean canBeTrue() {
    return p > EPSILON;
  }

  @Override
  public ChoiceType getType() {
    return ChoiceType.BOOLEAN;
  }

  @Override
  public Class<Boolean> getValueClass() {
    return Boolean.class;
  }

  @Override
  public boolean permits(Object value) {
    if (! (value instanceof Boolean)) return false;
    return (Boolean) value ? canBeTrue() : canBeFalse();
  }

  @Override
  public Boolean simplest() {
    return ! canBeFalse();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (BooleanConstraints) o;
    return Double.compare(p, that.p) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(p);
  }

  @Override
  public String toString() {
    return BooleanConstraints.class.getSimpleName() + "[p=" + p + ']';
  }
}
