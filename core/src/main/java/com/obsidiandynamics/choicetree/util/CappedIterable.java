package com.obsidiandynamics.choicetree.util;

import java.util.*;
import java.util.function.*;

/**
 *  A lazy, restartable sequence that never yields more than a fixed number of elements. Every call to
 *  {@link #iterator()} begins afresh from the underlying source.
 *
 *  @param <T> Element type.
 */
public final class CappedIterable<T> implements Iterable<T> {
  private final Supplier<Iterator<T>> source;

  private final long cap;

  public CappedIterable(Supplier<Iterator<T>> source, long cap) {
    Assert.argument(cap >= 0, () -> "Cap cannot be negative, got " + cap);
    this.source = source;
    this.cap = cap;
  }

  public long getCap() {
    return cap;
  }

  @Override
  public Iterator<T> iterator() {
    final var delegate = source.get();
    return new Iterator<>() {
      private long yielded;

      @Override
      public boolean hasNext() {
        return yielded < cap && delegate.hasNext();
      }

      @Override
      public T next() {
        if (! hasNext()) {
          throw new NoSuchElementException();
        }
        yielded++;
        return delegate.next();
      }
    };
  }

  @Override
  public String toString() {
    return CappedIterable.class.getSimpleName() + "[cap=" + cap + ']';
  }
}
