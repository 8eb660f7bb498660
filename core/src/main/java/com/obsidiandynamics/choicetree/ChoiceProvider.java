package com.obsidiandynamics.choicetree;

/**
 *  The source of entropy behind a {@link ChoiceRecorder}. Each method returns a value satisfying the given
 *  constraints, or signals that no more values are available.
 */
public interface ChoiceProvider {
  boolean drawBoolean(BooleanConstraints constraints) throws EntropyExhaustedException;

  long drawInteger(IntegerConstraints constraints) throws EntropyExhaustedException;

  double drawFloat(FloatConstraints constraints) throws EntropyExhaustedException;

  String drawString(StringConstraints constraints) throws EntropyExhaustedException;

  byte[] drawBytes(BytesConstraints constraints) throws EntropyExhaustedException;

  /**
   *  Notifies the provider that a forced value occupied the next position, so that position-aligned
   *  providers can keep in step.
   *
   *  @param constraints The constraints of the forced draw.
   *  @param value The forced value.
   */
  default void observeForced(Constraints<?> constraints, Object value) {}
}
