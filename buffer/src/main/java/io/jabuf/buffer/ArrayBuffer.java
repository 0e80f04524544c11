package io.jabuf.buffer;

import io.jabuf.buffer.api.BufferValidation;
import io.jabuf.buffer.api.Builder;
import io.jabuf.buffer.api.CapacityExceededException;
import io.jabuf.buffer.api.ElementSource;
import io.jabuf.buffer.api.GrowableSeq;
import io.jabuf.buffer.internal_api.BlockCopySource;
import io.jabuf.buffer.internal_api.GrowthPolicy;
import java.util.Arrays;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Growable, randomly indexable sequence backed by a single {@code Object[]} block.
 *
 * <p>Appends are amortized O(1): when the block is full it is replaced by one of twice the size
 * (see {@link GrowthPolicy}). Indexed reads and writes are O(1); inserting or removing at an
 * arbitrary position shifts the tail of the block with one {@link System#arraycopy} call.
 *
 * <p>Bulk operations take a block-copy path when the source is itself backed by a contiguous
 * block (another {@code ArrayBuffer} or an {@link ArrayBufferView}) and fall back to element by
 * element copying for any other {@link Iterable}.
 *
 * <p>Slots past the logical length never keep references: every operation that shortens the
 * buffer, {@link #clear()} included, nulls the slots it vacates. The block itself never shrinks.
 *
 * <p>Instances are not thread-safe.
 *
 * @param <A> the element type
 */
public final class ArrayBuffer<A>
    implements GrowableSeq<A>, Builder<A, ArrayBuffer<A>>, BlockCopySource {
  private static final Logger log = LoggerFactory.getLogger(ArrayBuffer.class);

  /** System property overriding the capacity of buffers created with {@link #ArrayBuffer()}. */
  public static final String INITIAL_CAPACITY_PROPERTY = "jabuf.buffer.initialCapacity";

  public static final int DEFAULT_INITIAL_CAPACITY = 16;

  static final int INITIAL_CAPACITY =
      resolveInitialCapacity(System.getProperty(INITIAL_CAPACITY_PROPERTY));

  private Object[] array;
  private int end;

  /** Creates an empty buffer with the default initial capacity. */
  public ArrayBuffer() {
    this(new Object[INITIAL_CAPACITY], 0);
  }

  /**
   * Creates an empty buffer able to hold {@code initialCapacity} elements before it grows.
   *
   * @throws IllegalArgumentException if {@code initialCapacity} is negative
   * @throws CapacityExceededException if {@code initialCapacity} exceeds {@link
   *     GrowthPolicy#MAX_CAPACITY}
   */
  public ArrayBuffer(int initialCapacity) {
    BufferValidation.checkCapacity(initialCapacity);
    GrowthPolicy.checkMaximum(initialCapacity);
    this.array = new Object[initialCapacity];
  }

  private ArrayBuffer(Object[] array, int end) {
    this.array = array;
    this.end = end;
  }

  public static <A> ArrayBuffer<A> empty() {
    return new ArrayBuffer<>();
  }

  @SafeVarargs
  public static <A> ArrayBuffer<A> of(A... elems) {
    BufferValidation.requireNonNull(elems, "elems");
    return new ArrayBuffer<>(Arrays.copyOf(elems, elems.length, Object[].class), elems.length);
  }

  /**
   * Builds a buffer holding the elements of {@code source} in iteration order.
   *
   * <p>When the size of the source is known up front the storage is allocated at exactly that size,
   * so no doubling takes place. Otherwise the elements are appended to a default buffer.
   */
  public static <A> ArrayBuffer<A> fromIterable(Iterable<? extends A> source) {
    BufferValidation.requireNonNull(source, "source");
    if (source instanceof BlockCopySource) {
      BlockCopySource block = (BlockCopySource) source;
      int size = block.blockLength();
      Object[] storage = new Object[size];
      block.copyBlock(0, storage, 0, size);
      return new ArrayBuffer<>(storage, size);
    }
    int size = ElementSource.knownSizeOf(source);
    if (size >= 0) {
      Object[] storage = new Object[size];
      Iterator<? extends A> it = source.iterator();
      for (int i = 0; i < size; i++) {
        storage[i] = it.next();
      }
      return new ArrayBuffer<>(storage, size);
    }
    return new ArrayBuffer<A>().appendAll(source);
  }

  public static <A> Builder<A, ArrayBuffer<A>> newBuilder() {
    return new ArrayBuffer<>();
  }

  static int resolveInitialCapacity(String value) {
    if (value == null) {
      return DEFAULT_INITIAL_CAPACITY;
    }
    try {
      int capacity = Integer.parseInt(value.trim());
      if (capacity >= 1) {
        return capacity;
      }
      log.warn(
          "Ignoring {}={}: capacity must be at least 1, using {}",
          INITIAL_CAPACITY_PROPERTY,
          value,
          DEFAULT_INITIAL_CAPACITY);
    } catch (NumberFormatException e) {
      log.warn(
          "Ignoring {}={}: not an integer, using {}",
          INITIAL_CAPACITY_PROPERTY,
          value,
          DEFAULT_INITIAL_CAPACITY);
    }
    return DEFAULT_INITIAL_CAPACITY;
  }

  /** Makes sure the block has at least {@code n} slots. */
  private void ensureSize(long n) {
    array = GrowthPolicy.ensureCapacity(array, end, n);
  }

  /** Reduces the length to {@code n}, nulling out all dropped elements. */
  private void reduceToSize(int n) {
    GrowthPolicy.clearRange(array, n, end);
    end = n;
  }

  @Override
  @SuppressWarnings("unchecked")
  public A apply(int n) {
    BufferValidation.checkElementIndex(n, end);
    return (A) array[n];
  }

  @Override
  public void update(int n, A elem) {
    BufferValidation.checkElementIndex(n, end);
    array[n] = elem;
  }

  @Override
  public int length() {
    return end;
  }

  @Override
  public int knownSize() {
    return end;
  }

  /** Number of slots in the storage block; always at least {@link #length()}. */
  public int capacity() {
    return array.length;
  }

  /**
   * Returns a read window over the current content.
   *
   * <p>The view shares this buffer's storage block. It keeps the length the buffer has now, but it
   * will observe in-place writes made before the next reallocation.
   */
  public ArrayBufferView<A> view() {
    return new ArrayBufferView<>(array, end);
  }

  /** Iterates over a {@link #view()} taken at the time of the call. */
  @Override
  public Iterator<A> iterator() {
    return view().iterator();
  }

  @Override
  public ArrayBuffer<A> append(A elem) {
    ensureSize(end + 1L);
    array[end] = elem;
    end++;
    return this;
  }

  @Override
  public ArrayBuffer<A> appendAll(Iterable<? extends A> source) {
    BufferValidation.requireNonNull(source, "source");
    if (source instanceof BlockCopySource) {
      BlockCopySource block = (BlockCopySource) source;
      // read before growing: the source may be this buffer
      int count = block.blockLength();
      ensureSize((long) end + count);
      block.copyBlock(0, array, end, count);
      end += count;
      return this;
    }
    int size = ElementSource.knownSizeOf(source);
    if (size > 0) {
      ensureSize((long) end + size);
    }
    for (A elem : source) {
      append(elem);
    }
    return this;
  }

  @Override
  public void insert(int idx, A elem) {
    BufferValidation.checkPositionIndex(idx, end);
    ensureSize(end + 1L);
    System.arraycopy(array, idx, array, idx + 1, end - idx);
    array[idx] = elem;
    end++;
  }

  @Override
  public void insertAll(int idx, Iterable<? extends A> source) {
    BufferValidation.checkPositionIndex(idx, end);
    BufferValidation.requireNonNull(source, "source");
    BlockCopySource block = source instanceof BlockCopySource ? (BlockCopySource) source : null;
    int count = block != null ? block.blockLength() : ElementSource.knownSizeOf(source);
    if (count < 0) {
      insertAll(idx, new ArrayBuffer<A>().appendAll(source));
      return;
    }
    if (block == null) {
      // read the whole source before shifting: it may fail halfway or read this buffer
      Object[] staged = new Object[count];
      Iterator<? extends A> it = source.iterator();
      for (int i = 0; i < count; i++) {
        staged[i] = it.next();
      }
      block = new ArrayBufferView<A>(staged, count);
    } else if (block.sharesBlock(array)) {
      // the shift below would move the source's elements under it
      Object[] snapshot = new Object[count];
      block.copyBlock(0, snapshot, 0, count);
      block = new ArrayBufferView<A>(snapshot, count);
    }
    ensureSize((long) end + count);
    System.arraycopy(array, idx, array, idx + count, end - idx);
    block.copyBlock(0, array, idx, count);
    end += count;
  }

  @Override
  @SuppressWarnings("unchecked")
  public A remove(int idx) {
    BufferValidation.checkElementIndex(idx, end);
    A res = (A) array[idx];
    System.arraycopy(array, idx + 1, array, idx, end - (idx + 1));
    reduceToSize(end - 1);
    return res;
  }

  @Override
  public void removeRange(int from, int n) {
    if (n > 0) {
      BufferValidation.checkRange(from, n, end);
      System.arraycopy(array, from + n, array, from, end - (from + n));
      reduceToSize(end - n);
    }
  }

  @Override
  public void clear() {
    reduceToSize(0);
  }

  @Override
  public ArrayBuffer<A> addOne(A elem) {
    return append(elem);
  }

  @Override
  public ArrayBuffer<A> addAll(Iterable<? extends A> source) {
    return appendAll(source);
  }

  @Override
  public ArrayBuffer<A> result() {
    return this;
  }

  @Override
  public int blockLength() {
    return end;
  }

  @Override
  public void copyBlock(int srcPos, Object[] dest, int destPos, int count) {
    System.arraycopy(array, srcPos, dest, destPos, count);
  }

  @Override
  public boolean sharesBlock(Object[] storage) {
    return array == storage;
  }

  /** Copy of the live elements; later changes to the buffer do not affect it. */
  public Object[] toArray() {
    return Arrays.copyOf(array, end);
  }

  @Override
  public String toString() {
    return render("ArrayBuffer", array, end);
  }

  static String render(String prefix, Object[] storage, int length) {
    StringBuilder sb = new StringBuilder(prefix).append('(');
    for (int i = 0; i < length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(storage[i]);
    }
    return sb.append(')').toString();
  }
}
