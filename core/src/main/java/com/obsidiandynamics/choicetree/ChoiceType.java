package com.obsidiandynamics.choicetree;

/**
 *  The closed set of primitive choice kinds. Every consumer dispatches over this enum exhaustively.
 */
public enum ChoiceType {
  BOOLEAN,
  INTEGER,
  FLOAT,
  STRING,
  BYTES
}
