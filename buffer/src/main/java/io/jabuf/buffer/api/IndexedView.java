package io.jabuf.buffer.api;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Read-only positional access to a fixed number of elements.
 *
 * <p>Iteration is derived purely from {@link #apply(int)} and {@link #length()}, so every call to
 * {@link #iterator()} starts a new traversal from index zero.
 *
 * @param <A> the element type
 */
public interface IndexedView<A> extends ElementSource<A> {

  /**
   * Returns the element at {@code n}.
   *
   * @throws IndexOutOfRangeException unless {@code 0 <= n < length()}
   */
  A apply(int n);

  int length();

  @Override
  default int knownSize() {
    return length();
  }

  @Override
  default Iterator<A> iterator() {
    return new Iterator<A>() {
      private final int end = length();
      private int cursor;

      @Override
      public boolean hasNext() {
        return cursor < end;
      }

      @Override
      public A next() {
        if (cursor >= end) {
          throw new NoSuchElementException();
        }
        return apply(cursor++);
      }
    };
  }
}
