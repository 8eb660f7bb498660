package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.util.*;

/**
 *  How a draw obtains its value: either generated by the {@link ChoiceProvider}, or forced to a pinned value
 *  that bypasses the provider entirely.
 *
 *  @param <V> Value type.
 */
public abstract class Request<V> {
  private Request() {}

  public abstract boolean isForced();

  /**
   *  Obtains the pinned value of a forced request.
   *
   *  @return The forced value.
   *  @throws IllegalStateException If this request is not forced.
   */
  public abstract V getValue();

  private static final Request<?> GENERATE = new Generate<>();

  @SuppressWarnings("unchecked")
  public static <V> Request<V> generate() {
    return (Request<V>) GENERATE;
  }

  public static <V> Request<V> force(V value) {
    return new Force<>(value);
  }

  private static final class Generate<V> extends Request<V> {
    @Override
    public boolean isForced() {
      return false;
    }

    @Override
    public V getValue() {
      throw new IllegalStateException("A generated request has no value");
    }

    @Override
    public String toString() {
      return Request.class.getSimpleName() + ".generate()";
    }
  }

  private static final class Force<V> extends Request<V> {
    private final V value;

    Force(V value) {
      Assert.isNotNull(value, Assert.withMessage("Forced value cannot be null"));
      this.value = value;
    }

    @Override
    public boolean isForced() {
      return true;
    }

    @Override
    public V getValue() {
      return value;
    }

    @Override
    public String toString() {
      return Request.class.getSimpleName() + ".force(" + Choices.toString(value) + ')';
    }
  }
}
