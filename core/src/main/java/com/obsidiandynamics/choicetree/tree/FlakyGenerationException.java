package com.obsidiandynamics.choicetree.tree;

/**
 *  Thrown when a trial disagrees with an earlier trial that took the same path, which means the test
 *  function does not draw deterministically from its recorded choices.
 */
public final class FlakyGenerationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final int position;

  public FlakyGenerationException(int position, String m) {
    super(m, null);
    this.position = position;
  }

  public int getPosition() {
    return position;
  }
}
