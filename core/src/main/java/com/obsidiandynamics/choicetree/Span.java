package com.obsidiandynamics.choicetree;

import java.util.*;

/**
 *  A labelled run of choices {@code [start, end)} that may be deleted or moved as one unit. Spans nest;
 *  {@code parent} is the index of the enclosing span in open order, or {@code -1} at the top level.
 */
public final class Span {
  private final String label;

  private final int start;

  private final int end;

  private final int depth;

  private final int parent;

  public Span(String label, int start, int end, int depth, int parent) {
    this.label = label;
    this.start = start;
    this.end = end;
    this.depth = depth;
    this.parent = parent;
  }

  public String getLabel() {
    return label;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int getDepth() {
    return depth;
  }

  public int getParent() {
    return parent;
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  public boolean encloses(Span other) {
    return start <= other.start && other.end <= end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Span) o;
    if (start != that.start) return false;
    if (end != that.end) return false;
    if (depth != that.depth) return false;
    if (parent != that.parent) return false;
    return Objects.equals(label, that.label);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(label);
    result = 31 * result + start;
    result = 31 * result + end;
    result = 31 * result + depth;
    result = 31 * result + parent;
    return result;
  }

  @Override
  public String toString() {
    return Span.class.getSimpleName() + "[label=" + label + ", start=" + start + ", end=" + end +
        ", depth=" + depth + ", parent=" + parent + ']';
  }
}
