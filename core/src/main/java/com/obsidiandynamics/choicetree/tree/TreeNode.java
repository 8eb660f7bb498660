package com.obsidiandynamics.choicetree.tree;

import com.obsidiandynamics.choicetree.*;

import java.util.*;

/**
 *  A position in the {@link ExplorationTree}. Starts out unexplored, and becomes either a branch (a choice
 *  was made here) or a conclusion (a trial ended here).
 */
final class TreeNode {
  private Constraints<?> constraints;

  private boolean forced;

  /** Keyed by {@link Choices#key(Object)}; insertion order is kept so that walks are reproducible. */
  private final Map<Object, TreeNode> children = new LinkedHashMap<>();

  private Status conclusion;

  private boolean exhausted;

  boolean isUnexplored() {
    return constraints == null && conclusion == null;
  }

  boolean isBranch() {
    return constraints != null;
  }

  Constraints<?> getConstraints() {
    return constraints;
  }

  boolean isForced() {
    return forced;
  }

  Status getConclusion() {
    return conclusion;
  }

  boolean isExhausted() {
    return exhausted;
  }

  Map<Object, TreeNode> getChildren() {
    return children;
  }

  TreeNode child(Object value) {
    return children.get(Choices.key(value));
  }

  TreeNode childOrCreate(Object value) {
    return children.computeIfAbsent(Choices.key(value), __ -> new TreeNode());
  }

  void branch(int position, ChoiceNode node) {
    if (conclusion != null) {
      throw new FlakyGenerationException(position, "Trial continued at position " + position + " where an earlier trial concluded " + conclusion);
    }
    if (constraints == null) {
      constraints = node.getConstraints();
      forced = node.wasForced();
    } else if (! constraints.equals(node.getConstraints()) || forced != node.wasForced()) {
      throw new FlakyGenerationException(position, "Expected " + describe() + " at position " + position + ", saw " + node);
    }
  }

  void conclude(int position, Status status) {
    if (constraints != null) {
      throw new FlakyGenerationException(position, "Trial concluded " + status + " at position " + position + " where an earlier trial drew " + describe());
    }
    // the most recent verdict wins
    conclusion = status;
    exhausted = true;
  }

  /**
   *  Re-evaluates exhaustion. A branch is exhausted once it has seen every child it can have and each child
   *  is exhausted in turn. The flag never reverts.
   *
   *  @return The exhaustion state after the check.
   */
  boolean checkExhausted() {
    if (exhausted || constraints == null) {
      return exhausted;
    }
    final var maxChildren = forced ? 1 : ChoiceCombinatorics.computeMaxChildren(constraints);
    if (ChoiceCombinatorics.isEffectivelyInfinite(maxChildren) || children.size() < maxChildren) {
      return false;
    }
    for (var child : children.values()) {
      if (! child.exhausted) {
        return false;
      }
    }
    exhausted = true;
    return true;
  }

  /**
   *  Marks a branch exhausted without counting its children, once no open child can be found.
   */
  void close() {
    exhausted = true;
  }

  private String describe() {
    return (forced ? "forced " : "") + constraints;
  }

  @Override
  public String toString() {
    return TreeNode.class.getSimpleName() + "[constraints=" + constraints + ", forced=" + forced +
        ", children=" + children.size() + ", conclusion=" + conclusion + ", exhausted=" + exhausted + ']';
  }
}
