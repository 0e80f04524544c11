package io.jabuf.buffer.api;

import java.util.Collection;
import java.util.Iterator;

/**
 * A finite source of elements, optionally able to report its size before being traversed.
 *
 * <p>Sources come in two flavours. Restartable sources return a fresh iterator from every call to
 * {@link #iterator()}. One-shot sources (see {@link #once(Iterator)}) can be traversed only once;
 * consumers that need the size of such a source up front have to materialize it first.
 *
 * @param <A> the element type
 */
public interface ElementSource<A> extends Iterable<A> {

  /**
   * Number of elements this source will produce, or {@code -1} if it is not known without
   * traversing the source.
   */
  default int knownSize() {
    return -1;
  }

  /**
   * Size hint for any {@link Iterable}: {@link #knownSize()} for element sources, {@link
   * Collection#size()} for collections and {@code -1} for everything else.
   */
  static int knownSizeOf(Iterable<?> source) {
    if (source instanceof ElementSource) {
      return ((ElementSource<?>) source).knownSize();
    }
    if (source instanceof Collection) {
      return ((Collection<?>) source).size();
    }
    return -1;
  }

  /** Restartable source of known size backed by a collection. */
  static <A> ElementSource<A> of(Collection<? extends A> collection) {
    BufferValidation.requireNonNull(collection, "collection");
    return new ElementSource<A>() {
      @Override
      public int knownSize() {
        return collection.size();
      }

      @Override
      @SuppressWarnings("unchecked")
      public Iterator<A> iterator() {
        return (Iterator<A>) collection.iterator();
      }
    };
  }

  /**
   * One-shot source of unknown size that hands out {@code iterator} exactly once.
   *
   * @throws IllegalStateException from {@link #iterator()} on the second call
   */
  static <A> ElementSource<A> once(Iterator<? extends A> iterator) {
    BufferValidation.requireNonNull(iterator, "iterator");
    return new ElementSource<A>() {
      private boolean consumed;

      @Override
      @SuppressWarnings("unchecked")
      public Iterator<A> iterator() {
        if (consumed) {
          throw new IllegalStateException("One-shot element source has already been traversed");
        }
        consumed = true;
        return (Iterator<A>) iterator;
      }
    };
  }
}
