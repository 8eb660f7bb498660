package com.obsidiandynamics.choicetree;

/**
 *  Immutable generation parameters for one kind of choice. Implementations are value objects, so that they
 *  may serve as cache and tree keys.
 *
 *  @param <V> The Java type of the values this constraint set describes.
 */
public interface Constraints<V> {
  ChoiceType getType();

  Class<V> getValueClass();

  /**
   *  Determines whether the given value satisfies these constraints. Values of the wrong Java type are
   *  never permitted.
   *
   *  @param value The candidate value.
   *  @return True if the value may be recorded against these constraints.
   */
  boolean permits(Object value);

  /**
   *  Obtains the minimal permitted value in shrink order.
   *
   *  @return The simplest value.
   *  @throws ChoiceUsageException If the constraints admit no value at all.
   */
  V simplest();
}
