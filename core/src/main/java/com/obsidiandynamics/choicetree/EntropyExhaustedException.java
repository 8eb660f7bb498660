package com.obsidiandynamics.choicetree;

/**
 *  Raised by a {@link ChoiceProvider} that has no more values to hand out. The recorder converts this
 *  into an {@link Status#OVERRUN} of the current trial.
 */
public final class EntropyExhaustedException extends Exception {
  private static final long serialVersionUID = 1L;

  public EntropyExhaustedException(String m) {
    super(m, null);
  }
}
