package io.jabuf.buffer.api;

/**
 * A mutable indexed sequence that can grow and shrink at any position.
 *
 * <p>Every index argument is validated before the sequence is touched; a call that throws {@link
 * IndexOutOfRangeException} leaves the sequence unchanged.
 *
 * @param <A> the element type
 */
public interface GrowableSeq<A> extends IndexedView<A> {

  /**
   * Replaces the element at {@code n}.
   *
   * @throws IndexOutOfRangeException unless {@code 0 <= n < length()}
   */
  void update(int n, A elem);

  /** Adds {@code elem} at the end. */
  GrowableSeq<A> append(A elem);

  /** Adds every element of {@code source} at the end, in iteration order. */
  GrowableSeq<A> appendAll(Iterable<? extends A> source);

  /**
   * Inserts {@code elem} so that it ends up at index {@code idx}.
   *
   * @throws IndexOutOfRangeException unless {@code 0 <= idx <= length()}
   */
  void insert(int idx, A elem);

  /**
   * Inserts the elements of {@code source} starting at index {@code idx}, keeping their order.
   *
   * @throws IndexOutOfRangeException unless {@code 0 <= idx <= length()}
   */
  void insertAll(int idx, Iterable<? extends A> source);

  /**
   * Removes and returns the element at {@code idx}.
   *
   * @throws IndexOutOfRangeException unless {@code 0 <= idx < length()}
   */
  A remove(int idx);

  /**
   * Removes {@code n} elements starting at {@code from}. Does nothing when {@code n <= 0}.
   *
   * @throws IndexOutOfRangeException if {@code n > 0} and the range does not fit
   */
  void removeRange(int from, int n);

  /** Removes all elements. */
  void clear();

  default boolean isEmpty() {
    return length() == 0;
  }
}
