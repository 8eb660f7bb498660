package com.obsidiandynamics.choicetree;

/**
 *  Signals a defect in the caller or provider. Never retried.
 */
public final class ChoiceUsageException extends IllegalStateException {
  public enum Reason {
    FROZEN,
    UNMATCHED_SPAN_CLOSE,
    UNCLOSED_SPAN,
    FORCED_VALUE_REJECTED,
    PROVIDER_VALUE_REJECTED,
    EMPTY_DOMAIN
  }

  private final Reason reason;

  public ChoiceUsageException(Reason reason, String m) {
    super(m, null);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
