package com.obsidiandynamics.choicetree.tree;

import com.obsidiandynamics.choicetree.*;
import com.obsidiandynamics.choicetree.util.*;
import org.slf4j.*;

import java.util.*;

/**
 *  A prefix tree over every choice sequence seen in one session. It remembers which paths have been taken,
 *  how each one concluded, and which regions of the choice space have been enumerated in full.<p>
 *
 *  The tree assumes that the test function is deterministic given its choices. It carries no locking and
 *  must be owned by a single session.
 */
public final class ExplorationTree {
  private static final Logger log = LoggerFactory.getLogger(ExplorationTree.class);

  /** Random draws attempted at a branch before falling back to enumeration. */
  private static final int NOVELTY_ATTEMPTS = 16;

  /** Random draws at an uncountable branch, after which it is given up as a dead end. */
  private static final int DEAD_END_ATTEMPTS = 1_000;

  private final TreeNode root = new TreeNode();

  private int recorded;

  /**
   *  Folds a frozen sequence into the tree, then re-checks exhaustion from the deepest node on its path
   *  upwards. Overrun trials extend the tree but record no conclusion.
   *
   *  @param sequence The sequence.
   *  @throws FlakyGenerationException If the sequence contradicts an earlier one sharing its prefix.
   */
  public void record(ChoiceSequence sequence) {
    final var path = new ArrayList<TreeNode>(sequence.length() + 1);
    var node = root;
    var position = 0;
    for (var choice : sequence.getNodes()) {
      node.branch(position, choice);
      path.add(node);
      node = node.childOrCreate(choice.getValue());
      position++;
    }
    if (sequence.getStatus() != Status.OVERRUN) {
      node.conclude(position, sequence.getStatus());
    }
    path.add(node);
    recorded++;

    for (var i = path.size() - 1; i >= 0; i--) {
      if (! path.get(i).checkExhausted()) {
        break;
      }
    }
  }

  /**
   *  Indicates that every path from the root has been explored to a conclusion, so further generation
   *  cannot produce anything new.
   *
   *  @return True if the tree is exhausted.
   */
  public boolean isExhausted() {
    return root.isExhausted();
  }

  public int getRecordedCount() {
    return recorded;
  }

  /**
   *  Reports whether drawing {@code value} after {@code prefix} would take an unexplored path.
   *
   *  @param prefix The values leading to the position of interest.
   *  @param value The candidate value at that position.
   *  @return True if that value has never been observed at that position.
   */
  public boolean isNovel(List<?> prefix, Object value) {
    final var node = walk(prefix);
    if (node == null) {
      return true;
    } else if (! node.isBranch()) {
      return node.isUnexplored();
    } else if (node.isForced()) {
      return false;
    }
    final var constraints = node.getConstraints();
    return node.child(constraints.permits(value) ? value : constraints.simplest()) == null;
  }

  /**
   *  Follows a prefix of values down the tree.
   *
   *  @return The node reached, or {@code null} if the path leaves the explored tree or a conclusion is
   *          reached before the prefix is used up.
   */
  private TreeNode walk(List<?> values) {
    var node = root;
    for (var value : values) {
      if (! node.isBranch()) {
        return null;
      }
      node = step(node, value);
      if (node == null) {
        return null;
      }
    }
    return node;
  }

  private static TreeNode step(TreeNode node, Object value) {
    if (node.isForced()) {
      // a forced draw ignores the replayed value; follow its only child
      return node.getChildren().values().iterator().next();
    }
    final var constraints = node.getConstraints();
    return node.child(constraints.permits(value) ? value : constraints.simplest());
  }

  /**
   *  Predicts the outcome of replaying the given values, without running anything. A replay that would
   *  run past the values is treated as unknown.
   *
   *  @param values The candidate values.
   *  @return The known {@link Status}, or empty if the path has not been explored to a conclusion.
   */
  public Optional<Status> simulate(List<?> values) {
    var node = root;
    for (var value : values) {
      if (node.getConclusion() != null) {
        return Optional.of(node.getConclusion());
      }
      if (! node.isBranch()) {
        return Optional.empty();
      }
      node = step(node, value);
      if (node == null) {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(node.getConclusion());
  }

  /**
   *  Produces a prefix of values that leads to a position never explored before. Following the prefix and
   *  then drawing freely is guaranteed to produce a new sequence.<p>
   *
   *  A branch too large to count, where random search turns up no open child, is closed as a dead end and
   *  the walk restarts from the root.
   *
   *  @param random Source of randomness for choosing among unexplored children.
   *  @return The prefix, or empty if the tree is exhausted.
   */
  public Optional<List<Object>> novelPrefix(SplittableRandom random) {
    final var provider = new RandomProvider(random);
    while (! root.isExhausted()) {
      final var prefix = new ArrayList<>();
      final var path = new ArrayList<TreeNode>();
      var node = root;
      while (node.isBranch()) {
        path.add(node);
        if (node.isForced()) {
          final var only = node.getChildren().entrySet().iterator().next();
          prefix.add(node.getConstraints().permits(only.getKey()) ? only.getKey() : node.getConstraints().simplest());
          node = only.getValue();
          continue;
        }

        final var next = pickChild(node, provider);
        if (next.isEmpty()) {
          break;
        }
        prefix.add(next.get());
        final var child = node.child(next.get());
        if (child == null) {
          return Optional.of(prefix);
        }
        node = child;
      }

      if (! node.isBranch()) {
        Assert.that(node.isUnexplored(), () -> "Walk ended on a concluded node");
        return Optional.of(prefix);
      }
      if (log.isDebugEnabled()) log.debug("Closing dead end at depth {}: {}", path.size() - 1, node);
      node.close();
      for (var i = path.size() - 2; i >= 0; i--) {
        if (! path.get(i).checkExhausted()) {
          break;
        }
      }
    }
    return Optional.empty();
  }

  /**
   *  Chooses a value whose child is either missing or not yet exhausted, trying random draws first.
   *
   *  @return The value, or empty if none could be found.
   */
  private static Optional<Object> pickChild(TreeNode node, RandomProvider provider) {
    final var constraints = node.getConstraints();
    final var drawn = drawOpenChild(node, provider, NOVELTY_ATTEMPTS);
    if (drawn.isPresent()) {
      return drawn;
    }

    final var maxChildren = ChoiceCombinatorics.computeMaxChildren(constraints);
    if (! ChoiceCombinatorics.isEffectivelyInfinite(maxChildren)) {
      for (var candidate : ChoiceCombinatorics.allChildren(constraints)) {
        final var child = node.child(candidate);
        if (child == null || ! child.isExhausted()) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }

    for (var entry : node.getChildren().entrySet()) {
      if (! entry.getValue().isExhausted() && constraints.permits(entry.getKey())) {
        return Optional.of(entry.getKey());
      }
    }
    return drawOpenChild(node, provider, DEAD_END_ATTEMPTS);
  }

  private static Optional<Object> drawOpenChild(TreeNode node, RandomProvider provider, int attempts) {
    for (var attempt = 0; attempt < attempts; attempt++) {
      final var candidate = provider.drawValue(node.getConstraints());
      final var child = node.child(candidate);
      if (child == null || ! child.isExhausted()) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return ExplorationTree.class.getSimpleName() + "[recorded=" + recorded + ", exhausted=" + root.isExhausted() + ']';
  }
}
