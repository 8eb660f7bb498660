package com.obsidiandynamics.choicetree.shrink;

import com.obsidiandynamics.choicetree.*;

import java.util.*;
import java.util.function.*;

/**
 *  Classifies a candidate list of choices by running it. The returned sequence is what the run actually
 *  consumed, which may be shorter than the candidate.
 */
@FunctionalInterface
public interface Oracle {
  ChoiceSequence test(List<ChoiceNode> candidate);

  /**
   *  An oracle that re-executes the test function, replaying the candidate's values. Values that no longer
   *  fit their draw are substituted with the simplest permitted value; running past the candidate overruns.
   *
   *  @param function The test function.
   *  @param maxChoices The most choices a single run may make.
   *  @return The {@link Oracle}.
   */
  static Oracle replaying(TestFunction function, int maxChoices) {
    return candidate -> {
      final var values = new ArrayList<>(candidate.size());
      for (var node : candidate) {
        values.add(node.getValue());
      }
      return TestFunction.execute(function, new ChoiceRecorder(new ReplayProvider(values), maxChoices));
    };
  }

  /**
   *  An oracle that judges the candidate nodes as they stand, without replaying them. The resulting
   *  sequences carry no spans.
   *
   *  @param interesting Decides whether the candidate is interesting.
   *  @return The {@link Oracle}.
   */
  static Oracle direct(Predicate<List<ChoiceNode>> interesting) {
    return candidate -> ChoiceSequence.of(candidate, interesting.test(candidate) ? Status.INTERESTING : Status.VALID);
  }
}
