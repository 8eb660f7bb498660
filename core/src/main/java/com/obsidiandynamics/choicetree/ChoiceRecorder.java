package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.ChoiceUsageException.*;

import java.util.*;

/**
 *  Records the choices made during one trial. Every draw appends exactly one {@link ChoiceNode}, in call
 *  order; spans group contiguous runs of nodes. Once frozen, the recorder rejects all further mutation and
 *  exposes its immutable {@link ChoiceSequence}.
 */
public final class ChoiceRecorder {
  private static final class OpenSpan {
    final String label;
    final int start;
    final int slot;

    OpenSpan(String label, int start, int slot) {
      this.label = label;
      this.start = start;
      this.slot = slot;
    }
  }

  private final ChoiceProvider provider;

  private final int maxChoices;

  private final List<ChoiceNode> nodes = new ArrayList<>();

  /** Closed spans by open order; {@code null} while a span is still open. */
  private final List<Span> spans = new ArrayList<>();

  private final Deque<OpenSpan> openSpans = new ArrayDeque<>();

  private Status status = Status.VALID;

  private boolean stopped;

  private ChoiceSequence frozen;

  public ChoiceRecorder(ChoiceProvider provider, int maxChoices) {
    this.provider = provider;
    this.maxChoices = maxChoices;
  }

  /**
   *  Creates a recorder that replays the given values and overruns once they are used up.
   *
   *  @param values The values to replay.
   *  @return A new {@link ChoiceRecorder}.
   */
  public static ChoiceRecorder forChoices(List<?> values) {
    return new ChoiceRecorder(new ReplayProvider(values), values.size());
  }

  public boolean drawBoolean(BooleanConstraints constraints) {
    return drawBoolean(constraints, Request.generate());
  }

  public boolean drawBoolean(BooleanConstraints constraints, Request<Boolean> request) {
    return draw(constraints, request, () -> provider.drawBoolean(constraints));
  }

  public long drawInteger(IntegerConstraints constraints) {
    return drawInteger(constraints, Request.generate());
  }

  public long drawInteger(IntegerConstraints constraints, Request<Long> request) {
    return draw(constraints, request, () -> provider.drawInteger(constraints));
  }

  public double drawFloat(FloatConstraints constraints) {
    return drawFloat(constraints, Request.generate());
  }

  public double drawFloat(FloatConstraints constraints, Request<Double> request) {
    return draw(constraints, request, () -> provider.drawFloat(constraints));
  }

  public String drawString(StringConstraints constraints) {
    return drawString(constraints, Request.generate());
  }

  public String drawString(StringConstraints constraints, Request<String> request) {
    return draw(constraints, request, () -> provider.drawString(constraints));
  }

  public byte[] drawBytes(BytesConstraints constraints) {
    return drawBytes(constraints, Request.generate());
  }

  public byte[] drawBytes(BytesConstraints constraints, Request<byte[]> request) {
    final var value = draw(constraints, request, () -> provider.drawBytes(constraints));
    return value.clone();
  }

  @FunctionalInterface
  private interface ProviderCall<V> {
    V draw() throws EntropyExhaustedException;
  }

  private <V> V draw(Constraints<V> constraints, Request<V> request, ProviderCall<V> call) {
    ensureNotFrozen("draw");
    ChoiceCombinatorics.requireNonEmpty(constraints);

    if (request.isForced()) {
      final var value = request.getValue();
      if (! constraints.permits(value)) {
        throw new ChoiceUsageException(Reason.FORCED_VALUE_REJECTED,
                                       "Forced value " + Choices.toString(value) + " does not satisfy " + constraints);
      }
      ensureCapacity();
      provider.observeForced(constraints, value);
      nodes.add(new ChoiceNode(constraints, value, true));
      return value;
    }

    ensureCapacity();
    final V value;
    try {
      value = call.draw();
    } catch (EntropyExhaustedException e) {
      throw stop(Status.OVERRUN);
    }
    if (! constraints.permits(value)) {
      throw new ChoiceUsageException(Reason.PROVIDER_VALUE_REJECTED,
                                     "Provider value " + Choices.toString(value) + " does not satisfy " + constraints);
    }
    nodes.add(new ChoiceNode(constraints, value, false));
    return value;
  }

  private void ensureCapacity() {
    if (nodes.size() >= maxChoices) {
      throw stop(Status.OVERRUN);
    }
  }

  public void openSpan(String label) {
    ensureNotFrozen("openSpan");
    openSpans.push(new OpenSpan(label, nodes.size(), spans.size()));
    spans.add(null);
  }

  public void closeSpan() {
    ensureNotFrozen("closeSpan");
    if (openSpans.isEmpty()) {
      throw new ChoiceUsageException(Reason.UNMATCHED_SPAN_CLOSE, "No open span to close");
    }
    close(openSpans.pop());
  }

  private void close(OpenSpan open) {
    final var parent = openSpans.isEmpty() ? -1 : openSpans.peek().slot;
    spans.set(open.slot, new Span(open.label, open.start, nodes.size(), openSpans.size(), parent));
  }

  /**
   *  Concludes the trial as interesting, unless it has already concluded otherwise.
   *
   *  @throws StopTest Always, to unwind the test function.
   */
  public void markInteresting() {
    ensureNotFrozen("markInteresting");
    throw stop(Status.INTERESTING);
  }

  public void markInvalid() {
    ensureNotFrozen("markInvalid");
    throw stop(Status.INVALID);
  }

  private StopTest stop(Status newStatus) {
    if (status == Status.VALID) {
      status = newStatus;
    }
    stopped = true;
    return new StopTest(this);
  }

  private void ensureNotFrozen(String operation) {
    if (frozen != null) {
      throw new ChoiceUsageException(Reason.FROZEN, "Cannot " + operation + " on a frozen recorder");
    }
  }

  /**
   *  Freezes the recorder. A trial cut short by {@link StopTest} has its open spans closed at the current
   *  position; a trial that ran to completion must have closed every span itself. Freezing again returns
   *  the same sequence.
   *
   *  @return The immutable {@link ChoiceSequence}.
   */
  public ChoiceSequence freeze() {
    if (frozen != null) {
      return frozen;
    }
    if (! openSpans.isEmpty()) {
      if (! stopped) {
        throw new ChoiceUsageException(Reason.UNCLOSED_SPAN, openSpans.size() + " span(s) left open, innermost '" + openSpans.peek().label + "'");
      }
      while (! openSpans.isEmpty()) {
        close(openSpans.pop());
      }
    }
    frozen = ChoiceSequence.of(nodes, spans, status);
    return frozen;
  }

  public boolean isFrozen() {
    return frozen != null;
  }

  /**
   *  Obtains the frozen sequence.
   *
   *  @return The {@link ChoiceSequence}.
   *  @throws IllegalStateException If the recorder has not been frozen.
   */
  public ChoiceSequence getSequence() {
    if (frozen == null) {
      throw new IllegalStateException("Recorder has not been frozen");
    }
    return frozen;
  }

  public Status getStatus() {
    return status;
  }

  public int length() {
    return nodes.size();
  }

  public int depth() {
    return openSpans.size();
  }

  @Override
  public String toString() {
    return ChoiceRecorder.class.getSimpleName() + "[status=" + status + ", length=" + nodes.size() +
        ", openSpans=" + openSpans.size() + ", frozen=" + (frozen != null) + ']';
  }
}
