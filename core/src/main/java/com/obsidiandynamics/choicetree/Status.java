package com.obsidiandynamics.choicetree;

/**
 *  Outcome of a single trial, ordered from least to most useful.
 */
public enum Status {
  /** The entropy or length budget ran out mid-draw. */
  OVERRUN,

  /** The candidate violated an assumption of the test function. */
  INVALID,

  VALID,

  /** The candidate reproduces the behaviour being searched for. */
  INTERESTING
}
