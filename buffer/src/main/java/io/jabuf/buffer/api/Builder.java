package io.jabuf.buffer.api;

/**
 * Accumulates elements and produces a container from them.
 *
 * @param <A> the element type
 * @param <C> the type of container produced
 */
public interface Builder<A, C> {

  Builder<A, C> addOne(A elem);

  /** Adds every element of {@code source} in iteration order. */
  Builder<A, C> addAll(Iterable<? extends A> source);

  /** Discards everything added so far. */
  void clear();

  C result();
}
