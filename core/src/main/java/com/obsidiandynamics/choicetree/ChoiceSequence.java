package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.util.*;

import java.util.*;

/**
 *  The frozen, immutable record of one trial: its choices in draw order, the spans over them (in the order
 *  they were opened), and the trial's {@link Status}.
 */
public final class ChoiceSequence {
  private final List<ChoiceNode> nodes;

  private final List<Span> spans;

  private final Status status;

  private final List<Object> values;

  private ChoiceSequence(List<ChoiceNode> nodes, List<Span> spans, Status status) {
    this.nodes = nodes;
    this.spans = spans;
    this.status = status;
    final var values = new ArrayList<>(nodes.size());
    for (var node : nodes) {
      values.add(node.getValue());
    }
    this.values = Collections.unmodifiableList(values);
  }

  /**
   *  Assembles a sequence, verifying that every span lies within the nodes and that spans nest properly.
   *
   *  @param nodes The choices.
   *  @param spans The spans, in open order.
   *  @param status The outcome.
   *  @return The frozen {@link ChoiceSequence}.
   */
  public static ChoiceSequence of(List<ChoiceNode> nodes, List<Span> spans, Status status) {
    Assert.isNotNull(status, Assert.withMessage("Status cannot be null"));
    validateSpans(nodes.size(), spans);
    return new ChoiceSequence(List.copyOf(nodes), List.copyOf(spans), status);
  }

  public static ChoiceSequence of(List<ChoiceNode> nodes, Status status) {
    return of(nodes, List.of(), status);
  }

  static void validateSpans(int length, List<Span> spans) {
    final var lastChildEnd = new HashMap<Integer, Integer>();
    for (var i = 0; i < spans.size(); i++) {
      final var span = spans.get(i);
      final var index = i;
      Assert.argument(span.getStart() >= 0 && span.getStart() <= span.getEnd() && span.getEnd() <= length,
                      () -> "Span " + index + " " + span + " lies outside [0, " + length + ")");
      final var parent = span.getParent();
      if (parent == -1) {
        Assert.argument(span.getDepth() == 0, () -> "Top-level span " + span + " must have depth 0");
      } else {
        Assert.argument(parent >= 0 && parent < index, () -> "Span " + span + " must follow its parent");
        final var enclosing = spans.get(parent);
        Assert.argument(enclosing.encloses(span), () -> "Span " + span + " escapes its parent " + enclosing);
        Assert.argument(span.getDepth() == enclosing.getDepth() + 1, () -> "Span " + span + " has inconsistent depth");
      }
      final var previousEnd = lastChildEnd.getOrDefault(parent, Integer.MIN_VALUE);
      Assert.argument(span.getStart() >= previousEnd, () -> "Span " + span + " overlaps a sibling");
      lastChildEnd.put(parent, span.getEnd());
    }
  }

  public List<ChoiceNode> getNodes() {
    return nodes;
  }

  public ChoiceNode getNode(int index) {
    return nodes.get(index);
  }

  /**
   *  The recorded values alone, with type and constraint metadata stripped.
   *
   *  @return An unmodifiable list of values.
   */
  public List<Object> getValues() {
    return values;
  }

  public List<Span> getSpans() {
    return spans;
  }

  public Status getStatus() {
    return status;
  }

  public int length() {
    return nodes.size();
  }

  /**
   *  Obtains the indexes of the spans directly beneath the given one.
   *
   *  @param parent A span index, or {@code -1} for the top level.
   *  @return Child span indexes, in open order.
   */
  public List<Integer> childrenOf(int parent) {
    final var children = new ArrayList<Integer>();
    for (var i = 0; i < spans.size(); i++) {
      if (spans.get(i).getParent() == parent) {
        children.add(i);
      }
    }
    return children;
  }

  @Override
  public String toString() {
    return ChoiceSequence.class.getSimpleName() + "[status=" + status + ", length=" + nodes.size() +
        ", values=" + valuesToString() + ", spans=" + spans.size() + ']';
  }

  private String valuesToString() {
    final var sb = new StringBuilder("[");
    for (var i = 0; i < values.size(); i++) {
      if (i != 0) sb.append(", ");
      sb.append(Choices.toString(values.get(i)));
    }
    return sb.append(']').toString();
  }
}
