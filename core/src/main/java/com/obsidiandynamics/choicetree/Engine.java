package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.shrink.*;
import com.obsidiandynamics.choicetree.tree.*;
import com.obsidiandynamics.choicetree.util.*;
import org.slf4j.*;

import java.util.*;

/**
 *  Drives a test function: generates trials that each take a path never explored before, stops at the
 *  first interesting one (or when the choice space or example budget runs out), then shrinks it.
 */
public final class Engine {
  private static final Logger log = LoggerFactory.getLogger(Engine.class);

  public static class Options {
    public int maxExamples = 1000;

    public int maxChoices = 8 * 1024;

    public int maxShrinkCalls = 2000;

    /** Fixes the random source for reproducible runs; {@code null} to seed afresh. */
    public Long seed;

    void validate() {
      Assert.that(maxExamples > 0, IllegalArgumentException::new, () -> "Max examples must be positive");
      Assert.that(maxChoices > 0, IllegalArgumentException::new, () -> "Max choices must be positive");
      Assert.that(maxShrinkCalls >= 0, IllegalArgumentException::new, () -> "Max shrink calls cannot be negative");
    }
  }

  public static final class Result {
    private final Status status;

    private final ChoiceSequence interesting;

    private final ChoiceSequence shrunk;

    private final int examples;

    private final int shrinkCalls;

    private final boolean exhausted;

    Result(Status status, ChoiceSequence interesting, ChoiceSequence shrunk, int examples, int shrinkCalls, boolean exhausted) {
      this.status = status;
      this.interesting = interesting;
      this.shrunk = shrunk;
      this.examples = examples;
      this.shrinkCalls = shrinkCalls;
      this.exhausted = exhausted;
    }

    /**
     *  The most severe status among the generated trials, in {@link Status} order.
     *
     *  @return The overall {@link Status}.
     */
    public Status getStatus() {
      return status;
    }

    /**
     *  The first interesting sequence generated, before shrinking.
     *
     *  @return The sequence, or {@code null} if none was found.
     */
    public ChoiceSequence getInteresting() {
      return interesting;
    }

    /**
     *  The shrunk form of {@link #getInteresting()}.
     *
     *  @return The sequence, or {@code null} if none was found.
     */
    public ChoiceSequence getShrunk() {
      return shrunk;
    }

    public int getExamples() {
      return examples;
    }

    public int getShrinkCalls() {
      return shrinkCalls;
    }

    public int getCalls() {
      return examples + shrinkCalls;
    }

    /**
     *  Whether generation ended because every path through the test function had been explored.
     *
     *  @return True if the exploration tree was exhausted.
     */
    public boolean isExhausted() {
      return exhausted;
    }

    @Override
    public String toString() {
      return Result.class.getSimpleName() + "[status=" + status + ", examples=" + examples + ", shrinkCalls=" + shrinkCalls +
          ", exhausted=" + exhausted + ", shrunk=" + shrunk + ']';
    }
  }

  private final TestFunction function;

  private final Options options;

  private final ExplorationTree tree = new ExplorationTree();

  public Engine(TestFunction function, Options options) {
    Assert.isNotNull(function, Assert.withMessage("Test function cannot be null"));
    options.validate();
    this.function = function;
    this.options = options;
  }

  public Engine(TestFunction function) {
    this(function, new Options());
  }

  public ExplorationTree getTree() {
    return tree;
  }

  /**
   *  Runs the test function to completion.
   *
   *  @return The {@link Result}.
   *  @throws FlakyGenerationException If the test function behaves differently given the same choices.
   */
  public Result run() {
    final var random = options.seed != null ? new SplittableRandom(options.seed) : new SplittableRandom();
    var status = Status.OVERRUN;
    ChoiceSequence interesting = null;
    var examples = 0;

    while (examples < options.maxExamples) {
      final var prefix = tree.novelPrefix(random);
      if (prefix.isEmpty()) {
        break;
      }
      final var provider = new ReplayProvider(prefix.get(), new RandomProvider(random));
      final var sequence = TestFunction.execute(function, new ChoiceRecorder(provider, options.maxChoices));
      tree.record(sequence);
      examples++;
      if (sequence.getStatus().compareTo(status) > 0) {
        status = sequence.getStatus();
      }
      if (sequence.getStatus() == Status.INTERESTING) {
        interesting = sequence;
        break;
      }
    }
    final var exhausted = tree.isExhausted();

    if (interesting == null) {
      log.info("No interesting example after {} examples (status: {}, exhausted: {})", examples, status, exhausted);
      return new Result(status, null, null, examples, 0, exhausted);
    }

    log.info("Found interesting example of {} choices after {} examples; shrinking", interesting.length(), examples);
    final var shrinker = new Shrinker(interesting, Oracle.replaying(function, options.maxChoices), tree,
                                      new Shrinker.Options() {{
                                        maxCalls = options.maxShrinkCalls;
                                      }});
    final var shrunk = shrinker.shrink();
    log.info("Shrunk to {} choices in {} calls: {}", shrunk.length(), shrinker.getCalls(), shrunk.getValues());
    return new Result(status, interesting, shrunk, examples, shrinker.getCalls(), exhausted);
  }
}
