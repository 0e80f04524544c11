package io.jabuf.buffer;

import io.jabuf.buffer.api.BufferValidation;
import io.jabuf.buffer.api.IndexedView;
import io.jabuf.buffer.internal_api.BlockCopySource;

/**
 * Point-in-time read window over the storage of an {@link ArrayBuffer}.
 *
 * <p>The view keeps the storage block and the length the buffer had when {@link
 * ArrayBuffer#view()} was called. Later appends, inserts and removals do not change what the view
 * reports as its length. The block itself is shared, not copied: an in-place write the buffer
 * performs without reallocating is visible through the view. Do not mutate a buffer while a view
 * or iterator derived from it is still in use.
 *
 * @param <A> the element type
 */
public final class ArrayBufferView<A> implements IndexedView<A>, BlockCopySource {
  private final Object[] array;
  private final int length;

  ArrayBufferView(Object[] array, int length) {
    this.array = array;
    this.length = length;
  }

  @Override
  @SuppressWarnings("unchecked")
  public A apply(int n) {
    BufferValidation.checkElementIndex(n, length);
    return (A) array[n];
  }

  @Override
  public int length() {
    return length;
  }

  @Override
  public int blockLength() {
    return length;
  }

  @Override
  public void copyBlock(int srcPos, Object[] dest, int destPos, int count) {
    System.arraycopy(array, srcPos, dest, destPos, count);
  }

  @Override
  public boolean sharesBlock(Object[] storage) {
    return array == storage;
  }

  @Override
  public String toString() {
    return ArrayBuffer.render("ArrayBufferView", array, length);
  }
}
