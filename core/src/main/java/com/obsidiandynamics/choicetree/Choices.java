package com.obsidiandynamics.choicetree;

import java.util.*;

/**
 *  Value-level helpers that treat {@code byte[]} choices by content.
 */
public final class Choices {
  private Choices() {}

  public static boolean equal(Object a, Object b) {
    return Objects.deepEquals(a, b);
  }

  public static int hashCode(Object value) {
    return value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value);
  }

  public static String toString(Object value) {
    if (value instanceof byte[]) return Arrays.toString((byte[]) value);
    if (value instanceof String) return '"' + (String) value + '"';
    return String.valueOf(value);
  }

  static Object copy(Object value) {
    return value instanceof byte[] ? ((byte[]) value).clone() : value;
  }

  /**
   *  Wraps a choice value so that it may key a hash map by content.
   *
   *  @param value The value.
   *  @return A key with content-based equality.
   */
  public static Object key(Object value) {
    return value instanceof byte[] ? new BytesKey((byte[]) value) : value;
  }

  private static final class BytesKey {
    private final byte[] bytes;

    BytesKey(byte[] bytes) {
      this.bytes = bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof BytesKey && Arrays.equals(bytes, ((BytesKey) o).bytes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
      return Arrays.toString(bytes);
    }
  }
}
