package com.obsidiandynamics.choicetree;

import com.obsidiandynamics.choicetree.util.*;

public final class BytesConstraints implements Constraints<byte[]> {
  private final int size;

  public BytesConstraints(int size) {
    Assert.argument(size >= 0, () -> "Size cannot be negative, got " + size);
    this.size = size;
  }

  public int getSize() {
    return size;
  }

  @Override
  public ChoiceType getType() {
    return ChoiceType.BYTES;
  }

  @Override
  public Class<byte[]> getValueClass() {
    return byte[].class;
  }

  @Override
  public boolean permits(Object value) {
    return value instanceof byte[] && ((byte[]) value).length == size;
  }

  @Override
  public byte[] simplest() {
    return new byte[size];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (BytesConstraints) o;
    return size == that.size;
  }

  @Override
  public int hashCode() {
    return size;
  }

  @Override
  public String toString() {
    return BytesConstraints.class.getSimpleName() + "[size=" + size + ']';
  }
}
