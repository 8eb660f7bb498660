package com.obsidiandynamics.choicetree.codec;

/**
 *  Thrown when a byte stream cannot be decoded into choice values.
 */
public final class MalformedChoicesException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int offset;

  MalformedChoicesException(int offset, String m) {
    super(m + " at offset " + offset);
    this.offset = offset;
  }

  MalformedChoicesException(int offset, String m, Throwable cause) {
    super(m + " at offset " + offset, cause);
    this.offset = offset;
  }

  /**
   *  The position in the input where decoding failed.
   *
   *  @return The byte offset.
   */
  public int getOffset() {
    return offset;
  }
}
