package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.util.*;

import java.util.*;

/**
 *  One recorded choice: its constraints, the value taken, and whether that value was pinned rather than
 *  drawn. Forced nodes are never altered by shrinking.
 */
public final class ChoiceNode {
  private final ChoiceType type;

  private final Constraints<?> constraints;

  private final Object value;

  private final boolean wasForced;

  public ChoiceNode(Constraints<?> constraints, Object value, boolean wasForced) {
    Assert.isNotNull(constraints, Assert.withMessage("Constraints cannot be null"));
    Assert.argument(constraints.permits(value), () -> "Value " + Choices.toString(value) + " does not satisfy " + constraints);
    this.type = constraints.getType();
    this.constraints = constraints;
    this.value = Choices.copy(value);
    this.wasForced = wasForced;
  }

  public ChoiceType getType() {
    return type;
  }

  public Constraints<?> getConstraints() {
    return constraints;
  }

  public Object getValue() {
    return Choices.copy(value);
  }

  public boolean wasForced() {
    return wasForced;
  }

  /**
   *  Derives a node with the same constraints and a different value; the forced flag is cleared.
   *
   *  @param newValue The replacement value, which must satisfy the constraints.
   *  @return The new {@link ChoiceNode}.
   */
  public ChoiceNode withValue(Object newValue) {
    Assert.that(! wasForced, IllegalStateException::new, () -> "Cannot alter forced node " + this);
    return new ChoiceNode(constraints, newValue, false);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (ChoiceNode) o;
    if (wasForced != that.wasForced) return false;
    if (type != that.type) return false;
    if (! Objects.equals(constraints, that.constraints)) return false;
    return Choices.equal(value, that.value);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(type);
    result = 31 * result + Objects.hashCode(constraints);
    result = 31 * result + Choices.hashCode(value);
    result = 31 * result + (wasForced ? 1 : 0);
    return result;
  }

  @Override
  public String toString() {
    return ChoiceNode.class.getSimpleName() + "[type=" + type + ", value=" + Choices.toString(value) +
        ", wasForced=" + wasForced + ", constraints=" + constraints + ']';
  }
}
