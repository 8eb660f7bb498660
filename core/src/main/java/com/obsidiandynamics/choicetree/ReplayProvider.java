package com.obsidiandynamics.choicetree;

import java.util.*;

/**
 *  Hands out a fixed list of values in order. A value of the wrong type, or one its constraints reject, is
 *  replaced by the simplest permitted value. Once the list runs out, draws go to the fallback provider if
 *  there is one, and otherwise overrun.
 */
public final class ReplayProvider implements ChoiceProvider {
  private final List<?> values;

  private final ChoiceProvider fallback;

  private int index;

  private int substitutions;

  public ReplayProvider(List<?> values) {
    this(values, null);
  }

  public ReplayProvider(List<?> values, ChoiceProvider fallback) {
    this.values = List.copyOf(values);
    this.fallback = fallback;
  }

  public int getIndex() {
    return index;
  }

  /**
   *  Number of replayed values that had to be replaced because they did not fit their draw.
   *
   *  @return The substitution count.
   */
  public int getSubstitutions() {
    return substitutions;
  }

  private boolean hasNext() {
    return index < values.size();
  }

  private <V> V next(Constraints<V> constraints) {
    final var value = values.get(index++);
    if (constraints.permits(value)) {
      return constraints.getValueClass().cast(value);
    }
    substitutions++;
    return constraints.simplest();
  }

  private ChoiceProvider fallback() throws EntropyExhaustedException {
    if (fallback == null) {
      throw new EntropyExhaustedException("Replay exhausted after " + values.size() + " values");
    }
    return fallback;
  }

  @Override
  public boolean drawBoolean(BooleanConstraints constraints) throws EntropyExhaustedException {
    return hasNext() ? next(constraints) : fallback().drawBoolean(constraints);
  }

  @Override
  public long drawInteger(IntegerConstraints constraints) throws EntropyExhaustedException {
    return hasNext() ? next(constraints) : fallback().drawInteger(constraints);
  }

  @Override
  public double drawFloat(FloatConstraints constraints) throws EntropyExhaustedException {
    return hasNext() ? next(constraints) : fallback().drawFloat(constraints);
  }

  @Override
  public String drawString(StringConstraints constraints) throws EntropyExhaustedException {
    return hasNext() ? next(constraints) : fallback().drawString(constraints);
  }

  @Override
  public byte[] drawBytes(BytesConstraints constraints) throws EntropyExhaustedException {
    return hasNext() ? next(constraints) : fallback().drawBytes(constraints);
  }

  @Override
  public void observeForced(Constraints<?> constraints, Object value) {
    if (hasNext()) {
      index++;
    } else if (fallback != null) {
      fallback.observeForced(constraints, value);
    }
  }

  @Override
  public String toString() {
    return ReplayProvider.class.getSimpleName() + "[index=" + index + ", values.size=" + values.size() + ']';
  }
}
