package com.obsidiandynamics.choicetree;

/**
 *  The code under test: draws its inputs from the recorder and concludes the trial by returning normally
 *  ({@link Status#VALID}) or by marking it interesting or invalid.
 */
@FunctionalInterface
public interface TestFunction {
  void run(ChoiceRecorder data);

  /**
   *  Runs the test function to completion against the given recorder and freezes it.
   *
   *  @param function The test function.
   *  @param data A fresh recorder.
   *  @return The resulting {@link ChoiceSequence}.
   */
  static ChoiceSequence execute(TestFunction function, ChoiceRecorder data) {
    try {
      function.run(data);
    } catch (StopTest stop) {
      if (stop.getRecorder() != data) {
        throw stop;
      }
    }
    return data.freeze();
  }
}
