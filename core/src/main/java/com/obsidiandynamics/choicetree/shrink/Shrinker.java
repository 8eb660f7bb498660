package com.obsidiandynamics.choicetree.shrink;

import static com.obsidiandynamics.choicetree.shrink.ShrinkOrder.*;

import com.obsidiandynamics.choicetree.*;
import com.obsidiandynamics.choicetree.tree.*;
import com.obsidiandynamics.choicetree.util.*;
import org.slf4j.*;

import java.util.*;

/**
 *  Reduces an interesting {@link ChoiceSequence} to a simpler one that is still interesting, by running a
 *  fixed battery of passes until none of them makes progress or the call budget is spent.<p>
 *
 *  Every accepted candidate is strictly smaller in {@link ShrinkOrder} than the one it replaces, so the
 *  result is never larger than the input. Forced choices are carried over untouched.
 */
public final class Shrinker {
  private static final Logger log = LoggerFactory.getLogger(Shrinker.class);

  private static final int[] CHUNK_SIZES = {8, 4, 2, 1};

  public static class Options {
    /** The most oracle invocations a single {@link #shrink()} may make. */
    public int maxCalls = 2000;

    void validate() {
      Assert.that(maxCalls >= 0, IllegalArgumentException::new, () -> "Max calls cannot be negative");
    }
  }

  /** Thrown internally once the call budget runs out. */
  private static final class StopShrinking extends RuntimeException {
    private static final long serialVersionUID = 1L;

    StopShrinking() {
      super(null, null, false, false);
    }
  }

  private final Oracle oracle;

  private final ExplorationTree tree;

  private final Options options;

  private final Set<List<ChoiceNode>> seen = new HashSet<>();

  private ChoiceSequence current;

  private int calls;

  /**
   *  Creates a shrinker.
   *
   *  @param initial The sequence to shrink; must be interesting.
   *  @param oracle Runs candidates.
   *  @param tree Consulted for known outcomes and updated with every run; may be {@code null}. Should be
   *              omitted for a {@link Oracle#direct} oracle, whose verdicts need not respect prefixes.
   *  @param options Shrinker options.
   */
  public Shrinker(ChoiceSequence initial, Oracle oracle, ExplorationTree tree, Options options) {
    Assert.argument(initial.getStatus() == Status.INTERESTING, () -> "Cannot shrink a " + initial.getStatus() + " sequence");
    options.validate();
    this.current = initial;
    this.oracle = oracle;
    this.tree = tree;
    this.options = options;
    seen.add(initial.getNodes());
  }

  public Shrinker(ChoiceSequence initial, Oracle oracle) {
    this(initial, oracle, null, new Options());
  }

  public ChoiceSequence getCurrent() {
    return current;
  }

  public int getCalls() {
    return calls;
  }

  /**
   *  Runs the passes to a fixed point, or until the call budget is spent.
   *
   *  @return The simplest interesting sequence found.
   */
  public ChoiceSequence shrink() {
    final var initialLength = current.length();
    try {
      var improved = true;
      while (improved) {
        improved = deleteSpans();
        improved |= deleteChunks();
        improved |= lowerValues();
        improved |= lowerDuplicates();
        improved |= sortSiblingSpans();
        improved |= redistributeIntegers();
      }
    } catch (StopShrinking e) {
      log.debug("Shrink budget of {} calls spent", options.maxCalls);
    }
    log.debug("Shrunk {} choices to {} in {} calls", initialLength, current.length(), calls);
    return current;
  }

  /**
   *  Runs a candidate unless it cannot be an improvement, adopting the result if it is interesting and
   *  strictly simpler.
   *
   *  @param candidate The candidate nodes.
   *  @return True if the current sequence was replaced.
   */
  private boolean consider(List<ChoiceNode> candidate) {
    if (! isSmaller(candidate, current.getNodes()) || ! seen.add(candidate)) {
      return false;
    }
    if (tree != null) {
      final var known = tree.simulate(valuesOf(candidate));
      if (known.isPresent() && known.get() != Status.INTERESTING) {
        return false;
      }
    }
    if (calls >= options.maxCalls) {
      throw new StopShrinking();
    }
    calls++;
    final var result = oracle.test(candidate);
    if (tree != null) {
      tree.record(result);
    }
    if (result.getStatus() == Status.INTERESTING && isSmaller(result.getNodes(), current.getNodes())) {
      if (log.isDebugEnabled()) log.debug("Accepted {}", result);
      current = result;
      return true;
    } else {
      return false;
    }
  }

  private static List<Object> valuesOf(List<ChoiceNode> nodes) {
    final var values = new ArrayList<>(nodes.size());
    for (var node : nodes) {
      values.add(node.getValue());
    }
    return values;
  }

  private boolean anyForced(int start, int end) {
    final var nodes = current.getNodes();
    for (var i = start; i < end; i++) {
      if (nodes.get(i).wasForced()) {
        return true;
      }
    }
    return false;
  }

  private boolean deleteRange(int start, int end) {
    if (start >= end || end > current.length() || anyForced(start, end)) {
      return false;
    }
    final var nodes = current.getNodes();
    final var candidate = new ArrayList<ChoiceNode>(nodes.size() - (end - start));
    candidate.addAll(nodes.subList(0, start));
    candidate.addAll(nodes.subList(end, nodes.size()));
    return consider(candidate);
  }

  /** Spans by decreasing length, ties broken by decreasing depth. */
  private List<Span> spansBySize() {
    final var spans = new ArrayList<>(current.getSpans());
    spans.sort(Comparator.comparingInt(Span::length).reversed().thenComparing(Comparator.comparingInt(Span::getDepth).reversed()));
    return spans;
  }

  private boolean deleteSpans() {
    var improved = false;
    var i = 0;
    while (true) {
      final var spans = spansBySize();
      if (i >= spans.size()) break;
      final var span = spans.get(i);
      if (deleteRange(span.getStart(), span.getEnd())) {
        improved = true;
      } else {
        i++;
      }
    }
    return improved;
  }

  private boolean deleteChunks() {
    var improved = false;
    for (var size : CHUNK_SIZES) {
      var i = 0;
      while (i + size <= current.length()) {
        if (deleteRange(i, i + size)) {
          improved = true;
        } else {
          i++;
        }
      }
    }
    return improved;
  }

  /**
   *  Replaces the values at the given positions, provided each position still holds an unforced node that
   *  permits the value.
   */
  private boolean replace(int[] indexes, Object value) {
    final var nodes = current.getNodes();
    final var candidate = new ArrayList<>(nodes);
    for (var index : indexes) {
      if (index >= nodes.size()) return false;
      final var node = nodes.get(index);
      if (node.wasForced() || ! node.getConstraints().permits(value)) return false;
      candidate.set(index, node.withValue(value));
    }
    return consider(candidate);
  }

  private boolean lowerValues() {
    var improved = false;
    for (var i = 0; i < current.length(); i++) {
      if (! current.getNode(i).wasForced()) {
        improved |= lower(new int[] {i});
      }
    }
    return improved;
  }

  /**
   *  Lowers the value shared by the nodes at the given positions, which must have the same type.
   */
  private boolean lower(int[] indexes) {
    final var node = current.getNode(indexes[0]);
    var improved = replace(indexes, node.getConstraints().simplest());
    if (indexes[0] >= current.length() || current.getNode(indexes[0]).getType() != node.getType()) {
      return improved;
    }
    final var latest = current.getNode(indexes[0]);
    improved |= switch (latest.getType()) {
      case BOOLEAN -> (Boolean) latest.getValue() && replace(indexes, false);
      case INTEGER -> lowerInteger(indexes, (IntegerConstraints) latest.getConstraints(), (Long) latest.getValue());
      case FLOAT -> lowerFloat(indexes, (Double) latest.getValue());
      case STRING -> lowerString(indexes, (StringConstraints) latest.getConstraints(), (String) latest.getValue());
      case BYTES -> lowerBytes(indexes, (byte[]) latest.getValue());
    };
    return improved;
  }

  /**
   *  Binary search between the value, which is known to work, and the target, which is assumed not to.
   */
  private boolean lowerInteger(int[] indexes, IntegerConstraints constraints, long value) {
    var good = value;
    var bad = constraints.getTarget();
    var improved = false;
    while (Long.compareUnsigned(distance(good, bad), 1) > 0) {
      final var mid = good > bad ? bad + (distance(good, bad) >>> 1) : bad - (distance(good, bad) >>> 1);
      if (replace(indexes, mid)) {
        good = mid;
        improved = true;
      } else {
        bad = mid;
      }
    }
    return improved;
  }

  private boolean lowerFloat(int[] indexes, double value) {
    var improved = false;
    var latest = value;
    if (Double.isNaN(latest)) {
      return replace(indexes, 0.0) || replace(indexes, Double.MAX_VALUE) || replace(indexes, -Double.MAX_VALUE);
    }
    if (Double.isInfinite(latest)) {
      final var finite = Math.copySign(Double.MAX_VALUE, latest);
      if (! replace(indexes, finite)) {
        return false;
      }
      improved = true;
      latest = finite;
    }
    final var truncated = latest < 0 ? Math.ceil(latest) : Math.floor(latest);
    if (truncated != latest && replace(indexes, truncated)) {
      improved = true;
      latest = truncated;
    }
    if (latest == Math.rint(latest) && Math.abs(latest) < 0x1.0p53) {
      // search over whole magnitudes, keeping the sign
      var good = (long) Math.abs(latest);
      var bad = 0L;
      final var sign = Math.copySign(1.0, latest);
      while (good - bad > 1) {
        final var mid = bad + (good - bad) / 2;
        if (replace(indexes, sign * mid)) {
          good = mid;
          improved = true;
        } else {
          bad = mid;
        }
      }
    }
    return improved;
  }

  private boolean lowerString(int[] indexes, StringConstraints constraints, String value) {
    final var intervals = constraints.getIntervals();
    final var codePoints = value.codePoints().toArray();
    var improved = false;

    // shortest prefix that still works
    var good = codePoints.length;
    var bad = constraints.getMinSize() - 1;
    while (good - bad > 1) {
      final var mid = bad + (good - bad) / 2;
      if (replace(indexes, new String(codePoints, 0, mid))) {
        good = mid;
        improved = true;
      } else {
        bad = mid;
      }
    }

    // drop single characters
    var kept = Arrays.copyOf(codePoints, good);
    var position = 0;
    while (position < kept.length && kept.length > constraints.getMinSize()) {
      final var without = new int[kept.length - 1];
      System.arraycopy(kept, 0, without, 0, position);
      System.arraycopy(kept, position + 1, without, position, without.length - position);
      if (replace(indexes, new String(without, 0, without.length))) {
        kept = without;
        improved = true;
      } else {
        position++;
      }
    }

    final var lowered = kept;
    for (var i = 0; i < lowered.length; i++) {
      var goodIndex = intervals.indexInShrinkOrder(lowered[i]);
      var badIndex = -1;
      while (goodIndex - badIndex > 1) {
        final var midIndex = badIndex + (goodIndex - badIndex) / 2;
        final var previous = lowered[i];
        lowered[i] = intervals.codePointInShrinkOrder(midIndex);
        if (replace(indexes, new String(lowered, 0, lowered.length))) {
          goodIndex = midIndex;
          improved = true;
        } else {
          lowered[i] = previous;
          badIndex = midIndex;
        }
      }
    }
    return improved;
  }

  private boolean lowerBytes(int[] indexes, byte[] value) {
    final var lowered = value.clone();
    var improved = false;
    for (var i = 0; i < lowered.length; i++) {
      var good = Byte.toUnsignedInt(lowered[i]);
      var bad = -1;
      while (good - bad > 1) {
        final var mid = bad + (good - bad) / 2;
        final var previous = lowered[i];
        lowered[i] = (byte) mid;
        if (replace(indexes, lowered.clone())) {
          good = mid;
          improved = true;
        } else {
          lowered[i] = previous;
          bad = mid;
        }
      }
    }
    return improved;
  }

  /**
   *  Lowers groups of unforced nodes that share constraints and value, all at once.
   */
  private boolean lowerDuplicates() {
    final var groups = new LinkedHashMap<List<Object>, List<Integer>>();
    final var nodes = current.getNodes();
    for (var i = 0; i < nodes.size(); i++) {
      final var node = nodes.get(i);
      if (! node.wasForced()) {
        groups.computeIfAbsent(List.of(node.getConstraints(), Choices.key(node.getValue())), __ -> new ArrayList<>()).add(i);
      }
    }

    var improved = false;
    for (var group : groups.values()) {
      if (group.size() < 2) continue;
      final var indexes = group.stream().mapToInt(Integer::intValue).toArray();
      if (! sameShape(indexes, nodes)) continue;
      improved |= lower(indexes);
    }
    return improved;
  }

  /**
   *  Guards against the current sequence having changed shape since the group was formed.
   */
  private boolean sameShape(int[] indexes, List<ChoiceNode> original) {
    for (var index : indexes) {
      if (index >= current.length() || ! current.getNode(index).getConstraints().equals(original.get(index).getConstraints())) {
        return false;
      }
    }
    return true;
  }

  /**
   *  Sorts the contents of sibling spans that share a label and a length, simplest first.
   */
  private boolean sortSiblingSpans() {
    var improved = false;
    final var parents = new ArrayList<Integer>();
    parents.add(-1);
    for (var i = 0; i < current.getSpans().size(); i++) {
      parents.add(i);
    }
    for (var parent : parents) {
      if (parent >= current.getSpans().size()) break;
      final var byShape = new LinkedHashMap<String, List<Span>>();
      for (var child : current.childrenOf(parent)) {
        final var span = current.getSpans().get(child);
        byShape.computeIfAbsent(span.getLabel() + '/' + span.length(), __ -> new ArrayList<>()).add(span);
      }
      for (var siblings : byShape.values()) {
        if (siblings.size() > 1 && sortSpans(siblings)) {
          // remaining groups refer to the old layout
          improved = true;
          break;
        }
      }
    }
    return improved;
  }

  private boolean sortSpans(List<Span> siblings) {
    final var nodes = current.getNodes();
    final var contents = new ArrayList<List<ChoiceNode>>(siblings.size());
    for (var span : siblings) {
      if (anyForced(span.getStart(), span.getEnd())) {
        return false;
      }
      contents.add(nodes.subList(span.getStart(), span.getEnd()));
    }
    final var sorted = new ArrayList<>(contents);
    sorted.sort(ShrinkOrder::compare);

    final var candidate = new ArrayList<ChoiceNode>(nodes.size());
    var position = 0;
    for (var i = 0; i < siblings.size(); i++) {
      final var span = siblings.get(i);
      candidate.addAll(nodes.subList(position, span.getStart()));
      candidate.addAll(sorted.get(i));
      position = span.getEnd();
    }
    candidate.addAll(nodes.subList(position, nodes.size()));
    return consider(candidate);
  }

  /**
   *  Moves magnitude from an earlier integer node to a later one with identical constraints, so that the
   *  earlier one approaches its target while their combined offset is preserved.
   */
  private boolean redistributeIntegers() {
    var improved = false;
    for (var i = 0; i < current.length(); i++) {
      for (var j = i + 1; j < current.length(); j++) {
        improved |= redistribute(i, j);
      }
    }
    return improved;
  }

  private boolean redistribute(int i, int j) {
    final var first = current.getNode(i);
    final var second = current.getNode(j);
    if (first.getType() != ChoiceType.INTEGER || first.wasForced() || second.wasForced() ||
        ! first.getConstraints().equals(second.getConstraints())) {
      return false;
    }
    final var constraints = (IntegerConstraints) first.getConstraints();
    final var value = (long) (Long) first.getValue();
    final var other = (long) (Long) second.getValue();
    final var target = constraints.getTarget();
    if (value == target) {
      return false;
    }

    final var full = distance(value, target);
    if (full <= 0) {
      // beyond the signed range
      return false;
    }
    if (tryMove(i, j, value, other, target, full)) {
      return true;
    }
    var good = 0L;
    var bad = full;
    var improved = false;
    while (bad - good > 1) {
      final var mid = good + (bad - good) / 2;
      if (tryMove(i, j, value, other, target, mid)) {
        good = mid;
        improved = true;
      } else {
        bad = mid;
      }
    }
    return improved;
  }

  /**
   *  Shifts the first value {@code amount} steps toward the target and the second the same number of steps
   *  the other way.
   */
  private boolean tryMove(int i, int j, long value, long other, long target, long amount) {
    final var up = value < target;
    final var movedFirst = up ? value + amount : value - amount;
    final long movedSecond;
    if (up) {
      if (other < Long.MIN_VALUE + amount) return false;
      movedSecond = other - amount;
    } else {
      if (other > Long.MAX_VALUE - amount) return false;
      movedSecond = other + amount;
    }
    final var nodes = current.getNodes();
    if (j >= nodes.size() || nodes.get(i).wasForced() || nodes.get(j).wasForced() ||
        ! nodes.get(i).getConstraints().permits(movedFirst) || ! nodes.get(j).getConstraints().permits(movedSecond)) {
      return false;
    }
    final var candidate = new ArrayList<>(nodes);
    candidate.set(i, nodes.get(i).withValue(movedFirst));
    candidate.set(j, nodes.get(j).withValue(movedSecond));
    return consider(candidate);
  }

  @Override
  public String toString() {
    return Shrinker.class.getSimpleName() + "[calls=" + calls + ", current=" + current + ']';
  }
}
